package com.flagship.fec_diligence.qoe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.flagship.fec_diligence.LedgerFixtures.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

class QoeAdjustmentTest {

    private static SuggestedAdjustment suggestion() {
        return SuggestedAdjustment.builder()
            .type(AdjustmentType.BAD_DEBT)
            .ruleName("Bad debt write-offs")
            .confidence(ConfidenceTier.HIGH)
            .label("Provisions/pertes sur créances")
            .description("Dotations")
            .impactEbitda(new BigDecimal("6000"))
            .relatedAccount("654000")
            .build();
    }

    @Test
    @DisplayName("A promoted suggestion awaits validation")
    void testFromSuggestion() {
        QoeAdjustment adjustment = QoeAdjustment.fromSuggestion(suggestion(), "2023");

        assertNotNull(adjustment.getId());
        assertEquals(AdjustmentSource.AUTO_DETECTED, adjustment.getSource());
        assertEquals(ConfidenceTier.HIGH, adjustment.getConfidence());
        assertEquals("2023", adjustment.getFiscalYear());
        assertAmount("6000", adjustment.getImpactEbitda());
        assertEquals(List.of("654000"), adjustment.getRelatedAccounts());
        assertFalse(adjustment.isValidated());
        assertNull(adjustment.getValidatedAt());
    }

    @Test
    @DisplayName("Promotion requires a suggestion and a fiscal year")
    void testFromSuggestionRejectsMissingInput() {
        assertThrows(IllegalArgumentException.class, () -> QoeAdjustment.fromSuggestion(null, "2023"));
        assertThrows(IllegalArgumentException.class, () -> QoeAdjustment.fromSuggestion(suggestion(), " "));
    }

    @Test
    @DisplayName("Validation returns a new validated instance")
    void testValidate() {
        QoeAdjustment pending = QoeAdjustment.fromSuggestion(suggestion(), "2023");

        QoeAdjustment validated = pending.validate();

        assertTrue(validated.isValidated());
        assertNotNull(validated.getValidatedAt());
        assertEquals(pending.getId(), validated.getId());
        assertFalse(pending.isValidated());
    }

    @Test
    @DisplayName("Validation is one-way")
    void testValidateTwice() {
        QoeAdjustment validated = QoeAdjustment.fromSuggestion(suggestion(), "2023").validate();

        IllegalStateException ex = assertThrows(IllegalStateException.class, validated::validate);
        assertTrue(ex.getMessage().contains("already validated"));
    }
}
