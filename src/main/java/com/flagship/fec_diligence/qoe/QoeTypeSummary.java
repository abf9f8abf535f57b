package com.flagship.fec_diligence.qoe;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Validated adjustments of one type across all years.
 */
@Value
public class QoeTypeSummary {
    AdjustmentType type;
    String label;
    int count;
    BigDecimal totalImpact;
    BigDecimal averageImpact;

    public String getDescription() {
        return count + " ajustement(s) de ce type";
    }
}
