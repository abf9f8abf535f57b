package com.flagship.fec_diligence.qoe;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A QoE restatement attached to one fiscal year.
 *
 * Only validated adjustments move adjusted EBITDA. Validation is an explicit,
 * one-way transition that returns a new instance.
 */
@Value
@Builder(toBuilder = true)
public class QoeAdjustment {
    UUID id;
    AdjustmentType type;
    String label;
    String description;
    String fiscalYear;
    BigDecimal impactEbitda;
    /** Optional, only set on manual adjustments. */
    BigDecimal impactResultatNet;
    ConfidenceTier confidence;
    AdjustmentSource source;
    @Singular
    List<String> relatedAccounts;
    boolean validated;
    Instant validatedAt;

    /**
     * Promotes a rule suggestion to an adjustment awaiting validation.
     */
    public static QoeAdjustment fromSuggestion(SuggestedAdjustment suggestion, String fiscalYear) {
        if (suggestion == null) {
            throw new IllegalArgumentException("Suggestion is required");
        }
        if (fiscalYear == null || fiscalYear.isBlank()) {
            throw new IllegalArgumentException("Fiscal year is required");
        }
        return QoeAdjustment.builder()
            .id(UUID.randomUUID())
            .type(suggestion.getType())
            .label(suggestion.getLabel())
            .description(suggestion.getDescription())
            .fiscalYear(fiscalYear)
            .impactEbitda(suggestion.getImpactEbitda())
            .confidence(suggestion.getConfidence())
            .source(AdjustmentSource.AUTO_DETECTED)
            .relatedAccounts(suggestion.getRelatedAccounts())
            .validated(false)
            .build();
    }

    /**
     * Transitions the adjustment to validated.
     *
     * @return New instance, validated now
     * @throws IllegalStateException if the adjustment is already validated
     */
    public QoeAdjustment validate() {
        if (validated) {
            throw new IllegalStateException(
                String.format("Adjustment %s is already validated", id));
        }
        return toBuilder()
            .validated(true)
            .validatedAt(Instant.now())
            .build();
    }
}
