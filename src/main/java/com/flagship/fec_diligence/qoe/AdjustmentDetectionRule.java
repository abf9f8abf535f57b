package com.flagship.fec_diligence.qoe;

import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.PnlStatement;

import java.util.List;

/**
 * One heuristic of the QoE battery. Rules are independent and side-effect free:
 * each inspects the entries of one fiscal year and returns zero or more suggestions.
 */
public interface AdjustmentDetectionRule {

    String name();

    AdjustmentType type();

    ConfidenceTier confidence();

    List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl);

    /**
     * Builder pre-filled with this rule's type, name and confidence.
     */
    default SuggestedAdjustment.SuggestedAdjustmentBuilder suggestion() {
        return SuggestedAdjustment.builder()
            .type(type())
            .ruleName(name())
            .confidence(confidence());
    }
}
