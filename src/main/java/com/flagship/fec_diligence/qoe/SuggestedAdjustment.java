package com.flagship.fec_diligence.qoe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A proposal raised by a detection rule.
 *
 * Suggestions never affect adjusted EBITDA on their own: they have to be promoted to a
 * {@link QoeAdjustment} and validated first.
 */
@Value
@Builder
public class SuggestedAdjustment {
    AdjustmentType type;
    String ruleName;
    ConfidenceTier confidence;
    String label;
    String description;
    /** Positive adds back to EBITDA, negative removes from it. */
    BigDecimal impactEbitda;
    @Singular
    List<String> relatedAccounts;
    @JsonIgnore
    @Singular
    List<LedgerEntry> entries;

    public int getEntryCount() {
        return entries.size();
    }

    /**
     * Label prefixed with the confidence tier, e.g. "[HIGH] Charges exceptionnelles".
     */
    public String taggedLabel() {
        return "[" + confidence.name() + "] " + label;
    }
}
