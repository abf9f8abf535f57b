package com.flagship.fec_diligence.qoe.rules;

import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.pnl.PnlStatement;
import com.flagship.fec_diligence.qoe.AdjustmentDetectionRule;
import com.flagship.fec_diligence.qoe.AdjustmentType;
import com.flagship.fec_diligence.qoe.ConfidenceTier;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static com.flagship.fec_diligence.LedgerFixtures.FY_END;
import static com.flagship.fec_diligence.LedgerFixtures.FY_START;
import static com.flagship.fec_diligence.LedgerFixtures.assertAmount;
import static com.flagship.fec_diligence.LedgerFixtures.auxiliaryEntry;
import static com.flagship.fec_diligence.LedgerFixtures.entry;
import static com.flagship.fec_diligence.LedgerFixtures.labelledEntry;
import static org.junit.jupiter.api.Assertions.*;

class AdjustmentDetectionRulesTest {

    private static PnlStatement pnlOf(List<LedgerEntry> entries) {
        return new PnlEngine().generate(entries, "2023", FY_START, FY_END);
    }

    private static List<SuggestedAdjustment> detect(AdjustmentDetectionRule rule,
                                                    List<LedgerEntry> entries) {
        return rule.detect(entries, pnlOf(entries));
    }

    @Nested
    @DisplayName("Non-recurring items")
    class NonRecurringItems {

        private final NonRecurringItemsRule rule = new NonRecurringItemsRule();

        @Test
        @DisplayName("Exceptional charges are added back and exceptional income removed")
        void testChargesAndIncome() {
            List<LedgerEntry> entries = List.of(
                entry("671200", "1500", "0"),
                entry("675000", "2500", "0"),
                entry("775000", "0", "3000"),
                entry("778000", "0", "500"),
                entry("512000", "0", "500"));

            List<SuggestedAdjustment> suggestions = detect(rule, entries);

            assertEquals(2, suggestions.size());
            SuggestedAdjustment charges = suggestions.get(0);
            assertEquals("Charges exceptionnelles", charges.getLabel());
            assertAmount("4000", charges.getImpactEbitda());
            assertEquals(List.of("671200", "675000"), charges.getRelatedAccounts());
            assertEquals(2, charges.getEntryCount());
            assertEquals(ConfidenceTier.HIGH, charges.getConfidence());
            assertEquals(AdjustmentType.NON_RECURRING, charges.getType());
            assertEquals("[HIGH] Charges exceptionnelles", charges.taggedLabel());

            SuggestedAdjustment income = suggestions.get(1);
            assertEquals("Produits exceptionnels", income.getLabel());
            assertAmount("-3500", income.getImpactEbitda());
        }

        @Test
        @DisplayName("Amounts at or below the threshold raise nothing")
        void testBelowThreshold() {
            List<LedgerEntry> entries = List.of(
                entry("671200", "1000", "0"),
                entry("771300", "0", "800"));

            assertTrue(detect(rule, entries).isEmpty());
        }
    }

    @Nested
    @DisplayName("Related parties")
    class RelatedParties {

        private final RelatedPartyRule rule = new RelatedPartyRule();

        @Test
        @DisplayName("Flows are grouped by counterparty and carry no EBITDA impact")
        void testGroupedByCounterparty() {
            List<LedgerEntry> entries = List.of(
                auxiliaryEntry(LocalDate.of(2023, 3, 1), "455000", "ASSOC1", "0", "15000"),
                auxiliaryEntry(LocalDate.of(2023, 9, 1), "455000", "ASSOC1", "0", "5000"),
                entry("451000", "3000", "0"));

            List<SuggestedAdjustment> suggestions = detect(rule, entries);

            assertEquals(1, suggestions.size());
            assertEquals("Flux groupe/associés (ASSOC1)", suggestions.get(0).getLabel());
            assertAmount("0", suggestions.get(0).getImpactEbitda());
            assertEquals(2, suggestions.get(0).getEntryCount());
            assertEquals(ConfidenceTier.MEDIUM, suggestions.get(0).getConfidence());
        }

        @Test
        @DisplayName("Without an auxiliary account the general account is the counterparty")
        void testGeneralAccountKey() {
            List<SuggestedAdjustment> suggestions = detect(rule, List.of(entry("458000", "6000", "0")));

            assertEquals("Flux groupe/associés (458000)", suggestions.get(0).getLabel());
        }
    }

    @Nested
    @DisplayName("Owner compensation")
    class OwnerCompensation {

        private final OwnerCompensationRule rule = new OwnerCompensationRule();

        @Test
        @DisplayName("Excess over the benchmark is proposed as an add-back")
        void testAboveBenchmark() {
            List<SuggestedAdjustment> suggestions = detect(rule, List.of(entry("641100", "120000", "0")));

            assertEquals(1, suggestions.size());
            assertAmount("40000", suggestions.get(0).getImpactEbitda());
            assertTrue(suggestions.get(0).getDescription().startsWith("Rémunération actuelle"));
            assertEquals(AdjustmentType.OWNER_COMPENSATION, suggestions.get(0).getType());
        }

        @Test
        @DisplayName("A below-market package is reported with a zero impact")
        void testBelowBenchmark() {
            List<SuggestedAdjustment> suggestions = detect(rule, List.of(entry("641100", "50000", "0")));

            assertEquals(1, suggestions.size());
            assertAmount("0", suggestions.get(0).getImpactEbitda());
        }

        @Test
        @DisplayName("A package close to the benchmark is not material")
        void testWithinMateriality() {
            assertTrue(detect(rule, List.of(entry("641100", "85000", "0"))).isEmpty());
            assertTrue(detect(rule, List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Accounting method changes")
    class AccountingMethodChanges {

        private final AccountingMethodChangeRule rule = new AccountingMethodChangeRule();

        @Test
        @DisplayName("Large services work-in-progress without invoices to issue")
        void testEnCoursWithoutFae() {
            List<SuggestedAdjustment> suggestions = detect(rule, List.of(entry("345000", "60000", "0")));

            assertEquals(1, suggestions.size());
            assertEquals(ConfidenceTier.LOW, suggestions.get(0).getConfidence());
            assertAmount("0", suggestions.get(0).getImpactEbitda());
            assertEquals(List.of("34", "418"), suggestions.get(0).getRelatedAccounts());
        }

        @Test
        @DisplayName("Invoices to issue alone never trigger the rule")
        void testFaeOnly() {
            assertTrue(detect(rule, List.of(entry("418100", "50000", "0"))).isEmpty());
        }

        @Test
        @DisplayName("Significant invoices to issue explain the work-in-progress")
        void testEnCoursWithFae() {
            List<LedgerEntry> entries = List.of(
                entry("345000", "60000", "0"),
                entry("418100", "5000", "0"));

            assertTrue(detect(rule, entries).isEmpty());
        }
    }

    @Nested
    @DisplayName("Bad debt")
    class BadDebt {

        private final BadDebtRule rule = new BadDebtRule();

        @Test
        @DisplayName("Write-offs above the threshold are added back")
        void testWriteOffs() {
            List<LedgerEntry> entries = List.of(
                entry("654000", "4000", "0"),
                entry("671400", "2000", "0"));

            List<SuggestedAdjustment> suggestions = detect(rule, entries);

            assertEquals(1, suggestions.size());
            assertEquals("Provisions/pertes sur créances", suggestions.get(0).getLabel());
            assertAmount("6000", suggestions.get(0).getImpactEbitda());
            assertEquals(List.of("654000", "671400"), suggestions.get(0).getRelatedAccounts());
        }

        @Test
        @DisplayName("Small write-offs raise nothing")
        void testBelowThreshold() {
            assertTrue(detect(rule, List.of(entry("654000", "4000", "0"))).isEmpty());
        }
    }

    @Nested
    @DisplayName("Professional fees")
    class ProfessionalFees {

        private final ProfessionalFeesRule rule = new ProfessionalFeesRule();

        @Test
        @DisplayName("Large fees labelled as a one-off operation are flagged")
        void testOneOffFees() {
            List<LedgerEntry> entries = List.of(
                labelledEntry("622600", "Honoraires due diligence acquisition", "15000", "0"),
                labelledEntry("622600", "Honoraires comptables", "20000", "0"),
                labelledEntry("622700", "Frais de cession", "8000", "0"));

            List<SuggestedAdjustment> suggestions = detect(rule, entries);

            assertEquals(1, suggestions.size());
            assertEquals("Honoraires exceptionnels: honoraires due diligence acquisition",
                suggestions.get(0).getLabel());
            assertAmount("15000", suggestions.get(0).getImpactEbitda());
            assertEquals(AdjustmentType.NON_RECURRING, suggestions.get(0).getType());
            assertEquals(ConfidenceTier.MEDIUM, suggestions.get(0).getConfidence());
        }

        @Test
        @DisplayName("Labels are grouped case-insensitively and truncated in the suggestion")
        void testGroupingAndTruncation() {
            String longLabel = "Audit legal et contractuel de la societe cible pour le compte de l'acquereur";
            List<LedgerEntry> entries = List.of(
                labelledEntry("622600", longLabel, "6000", "0"),
                labelledEntry("622600", longLabel.toUpperCase(Locale.ROOT), "6000", "0"));

            List<SuggestedAdjustment> suggestions = detect(rule, entries);

            assertEquals(1, suggestions.size());
            assertAmount("12000", suggestions.get(0).getImpactEbitda());
            String expected = "Honoraires exceptionnels: "
                + longLabel.toLowerCase(Locale.ROOT).substring(0, 50);
            assertEquals(expected, suggestions.get(0).getLabel());
        }

        @Test
        @DisplayName("The threshold is strict")
        void testThreshold() {
            List<LedgerEntry> entries = List.of(labelledEntry("622600", "Audit", "10000", "0"));

            assertTrue(detect(rule, entries).isEmpty());
            assertEquals(1, new ProfessionalFeesRule(new BigDecimal("9999")).detect(entries, pnlOf(entries)).size());
        }
    }
}
