package com.flagship.fec_diligence.qoe;

import lombok.Value;

/**
 * Two adjustments that probably restate the same thing.
 * Surfaced to the analyst; neither adjustment is dropped or merged.
 */
@Value
public class AdjustmentCollision {

    public enum Reason {
        /** Same fiscal year and type, amounts within tolerance. */
        SIMILAR_AMOUNT,
        /** Every related account of the existing adjustment is also on the new one. */
        OVERLAPPING_ACCOUNTS
    }

    QoeAdjustment adjustment;
    QoeAdjustment conflictsWith;
    Reason reason;
}
