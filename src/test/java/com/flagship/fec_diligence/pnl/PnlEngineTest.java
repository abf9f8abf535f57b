package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.AccountGroups;
import com.flagship.fec_diligence.classification.PnlSection;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static com.flagship.fec_diligence.LedgerFixtures.FY_END;
import static com.flagship.fec_diligence.LedgerFixtures.FY_START;
import static com.flagship.fec_diligence.LedgerFixtures.assertAmount;
import static com.flagship.fec_diligence.LedgerFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

/**
 * P&L derivation: direct lines, netting exceptions, the subtotal chain and the
 * multi-period views built on top of it.
 */
class PnlEngineTest {

    private final PnlEngine engine = new PnlEngine();

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    static List<LedgerEntry> fullYear() {
        return List.of(
            entry("706000", "0", "100000"),
            entry("740000", "0", "5000"),
            entry("713000", "2000", "0"),
            entry("607000", "30000", "0"),
            entry("609000", "0", "1000"),
            entry("611000", "10000", "0"),
            entry("613200", "6000", "0"),
            entry("622600", "4000", "0"),
            entry("635000", "1500", "0"),
            entry("641000", "20000", "0"),
            entry("645000", "8000", "0"),
            entry("651000", "500", "0"),
            entry("758000", "0", "300"),
            entry("681100", "5000", "0"),
            entry("781500", "0", "1000"),
            entry("761000", "0", "200"),
            entry("661100", "700", "0"),
            entry("775000", "0", "3000"),
            entry("675000", "2500", "0"),
            entry("671200", "300", "0"),
            entry("691000", "1000", "0"),
            entry("695000", "4000", "0"),
            // Balance sheet movements are ignored by the P&L
            entry("512000", "50000", "0"),
            entry("411000", "0", "50000"));
    }

    static List<LedgerEntry> previousYear() {
        return List.of(
            entry(LocalDate.of(2022, 6, 30), "706000", "0", "80000"),
            entry(LocalDate.of(2022, 6, 30), "607000", "25000", "0"),
            entry(LocalDate.of(2022, 6, 30), "641000", "20000", "0"),
            entry(LocalDate.of(2022, 6, 30), "613200", "5000", "0"));
    }

    @Test
    @DisplayName("Subtotal chain from chiffre d'affaires down to résultat net")
    void testDerivationChain() {
        printTestHeader("P&L derivation chain");

        PnlStatement pnl = engine.generate(fullYear(), "2023", FY_START, FY_END);
        pnl.getLines().forEach(line -> printOutput(line.getCode(), line.getAmount()));

        assertAmount("105000", pnl.getChiffreAffaires());
        assertAmount("-2000", pnl.amountOf(PnlSection.VARIATION_ENCOURS));
        assertAmount("103000", pnl.getProduction());
        assertAmount("29000", pnl.getAchatsConsommes());
        assertAmount("10000", pnl.amountOf(PnlSection.SOUS_TRAITANCE));
        assertAmount("64000", pnl.getMargeCoutsDirects());
        assertAmount("1500", pnl.amountOf(PnlSection.IMPOTS_TAXES));
        assertAmount("28000", pnl.amountOf(PnlSection.CHARGES_PERSONNEL));
        assertAmount("24300", pnl.getEbitda());
        assertAmount("20300", pnl.getResultatExploitation());
        assertAmount("-500", pnl.amountOf(PnlSection.RESULTAT_FINANCIER));
        assertAmount("19800", pnl.amountOf(PnlSection.RESULTAT_COURANT));
        assertAmount("200", pnl.amountOf(PnlSection.RESULTAT_EXCEPTIONNEL));
        assertAmount("1000", pnl.amountOf(PnlSection.PARTICIPATION_SALARIES));
        assertAmount("4000", pnl.amountOf(PnlSection.IMPOT_SOCIETES));
        assertAmount("15000", pnl.getResultatNet());
        assertAmount("3000", pnl.getProduitsCessionsActifs());
        assertAmount("23.5922", pnl.getEbitdaMargin());
        assertEquals("EUR", pnl.getCurrency());
        printSuccess("Every subtotal recomputed from its components");
    }

    @Test
    @DisplayName("Sub-contracting is carved out of other purchases, write-backs and other income are netted")
    void testNettingRules() {
        PnlStatement pnl = engine.generate(fullYear(), "2023", FY_START, FY_END);

        // 61 + 62 without 611
        assertAmount("10000", pnl.amountOf(PnlSection.AUTRES_ACHATS));
        // 68 - 78
        assertAmount("4000", pnl.amountOf(PnlSection.DOTATIONS_AMORTISSEMENTS));
        // 65 - 75
        assertAmount("200", pnl.amountOf(PnlSection.AUTRES_CHARGES_GESTION));
    }

    @Test
    @DisplayName("EBITDA equals marge minus the operating cost lines")
    void testEbitdaIdentity() {
        PnlStatement pnl = engine.generate(fullYear(), "2023", FY_START, FY_END);

        BigDecimal expected = pnl.getMargeCoutsDirects()
            .subtract(pnl.amountOf(PnlSection.AUTRES_ACHATS))
            .subtract(pnl.amountOf(PnlSection.IMPOTS_TAXES))
            .subtract(pnl.amountOf(PnlSection.CHARGES_PERSONNEL))
            .subtract(pnl.amountOf(PnlSection.AUTRES_CHARGES_GESTION));
        assertEquals(0, expected.compareTo(pnl.getEbitda()));
    }

    @Test
    @DisplayName("Sub-contracting line and the autres achats carve-out share one account list")
    void testSousTraitanceCarveOut() {
        assertEquals(AccountGroups.SOUS_TRAITANCE,
            PnlStructure.definitionOf(PnlSection.SOUS_TRAITANCE).orElseThrow().getAccountPrefixes());
        assertEquals(AccountGroups.SOUS_TRAITANCE,
            PnlStructure.nettingRuleOf(PnlSection.AUTRES_ACHATS).orElseThrow().getDeductionPrefixes());

        PnlStatement pnl = engine.generate(List.of(
            entry("611000", "700", "0"),
            entry("613200", "300", "0"),
            entry("401000", "0", "1000")), "2023", FY_START, FY_END);
        assertAmount("700", pnl.amountOf(PnlSection.SOUS_TRAITANCE));
        assertAmount("300", pnl.amountOf(PnlSection.AUTRES_ACHATS));
    }

    @Test
    @DisplayName("Lines follow the fixed presentation order with margins on calculated lines only")
    void testLinesAndMargins() {
        PnlStatement pnl = engine.generate(fullYear(), "2023", FY_START, FY_END);

        assertEquals(PnlStructure.LINES.size(), pnl.getLines().size());
        assertEquals("CA", pnl.getLines().get(0).getCode());
        assertEquals("RN", pnl.getLines().get(pnl.getLines().size() - 1).getCode());

        PnlLine ebitda = pnl.getLines().stream().filter(l -> l.getSection() == PnlSection.EBITDA).findFirst().orElseThrow();
        assertTrue(ebitda.isSubtotal());
        assertAmount("23.5922", ebitda.getMarginPercent());

        PnlLine ca = pnl.getLines().get(0);
        assertNull(ca.getMarginPercent());
    }

    @Test
    @DisplayName("No production means no margin percentage and a zero EBITDA margin")
    void testZeroProduction() {
        PnlStatement pnl = engine.generate(List.of(entry("641000", "1000", "0")), "2023", FY_START, FY_END);

        assertAmount("-1000", pnl.getEbitda());
        assertAmount("0", pnl.getEbitdaMargin());
        pnl.getLines().forEach(line -> assertNull(line.getMarginPercent()));
    }

    @Test
    @DisplayName("Empty ledger gives an all-zero statement")
    void testEmptyLedger() {
        PnlStatement pnl = engine.generate(List.of(), "2023", FY_START, FY_END);

        pnl.getLines().forEach(line -> assertAmount("0", line.getAmount()));
    }

    @Test
    @DisplayName("Section detail lists accounts by absolute amount and skips carved-out accounts")
    void testSectionDetail() {
        List<SectionDetailLine> autresAchats = engine.sectionDetail(fullYear(), PnlSection.AUTRES_ACHATS);

        assertEquals(List.of("613200", "622600"),
            autresAchats.stream().map(SectionDetailLine::getAccountNumber).toList());
        assertAmount("6000", autresAchats.get(0).getAmount());

        List<SectionDetailLine> dotations = engine.sectionDetail(fullYear(), PnlSection.DOTATIONS_AMORTISSEMENTS);
        assertEquals(2, dotations.size());
        assertAmount("5000", dotations.get(0).getAmount());
        assertAmount("-1000", dotations.get(1).getAmount());

        List<SectionDetailLine> ca = engine.sectionDetail(fullYear(), PnlSection.CHIFFRE_AFFAIRES);
        assertAmount("100000", ca.get(0).getAmount());

        assertTrue(engine.sectionDetail(fullYear(), PnlSection.EBITDA).isEmpty());
    }

    @Test
    @DisplayName("EBITDA bridge steps add up from the previous to the current EBITDA")
    void testEbitdaBridgeTies() {
        printTestHeader("EBITDA bridge");

        PnlStatement previous = engine.generate(previousYear(), "2022",
            LocalDate.of(2022, 1, 1), LocalDate.of(2022, 12, 31));
        PnlStatement current = engine.generate(fullYear(), "2023", FY_START, FY_END);

        List<EbitdaBridgeItem> bridge = engine.ebitdaBridge(current, previous);
        bridge.forEach(item -> printOutput(item.getLabel(), item.getValue()));

        assertEquals(7, bridge.size());
        assertEquals(EbitdaBridgeItem.Type.START, bridge.get(0).getType());
        assertEquals("EBITDA 2022", bridge.get(0).getLabel());
        assertAmount("30000", bridge.get(0).getValue());
        assertEquals(EbitdaBridgeItem.Type.END, bridge.get(6).getType());
        assertAmount("24300", bridge.get(6).getValue());

        assertEquals("Δ Production", bridge.get(1).getLabel());
        assertAmount("23000", bridge.get(1).getValue());
        assertEquals(EbitdaBridgeItem.Type.POSITIVE, bridge.get(1).getType());
        assertEquals("Δ Sous-traitance", bridge.get(3).getLabel());
        assertAmount("-10000", bridge.get(3).getValue());
        assertEquals(EbitdaBridgeItem.Type.NEGATIVE, bridge.get(3).getType());

        BigDecimal walked = bridge.get(0).getValue();
        for (EbitdaBridgeItem step : bridge.subList(1, bridge.size() - 1)) {
            walked = walked.add(step.getValue());
        }
        assertEquals(0, walked.compareTo(bridge.get(6).getValue()));
        printSuccess("Bridge ties to the current EBITDA");
    }

    @Test
    @DisplayName("Unchanged components produce no bridge step")
    void testEbitdaBridgeSkipsNullSteps() {
        PnlStatement previous = engine.generate(previousYear(), "2022", FY_START, FY_END);

        List<EbitdaBridgeItem> bridge = engine.ebitdaBridge(previous, previous);

        assertEquals(2, bridge.size());
    }

    @Test
    @DisplayName("Monthly P&L re-derives each calendar month")
    void testMonthly() {
        List<LedgerEntry> entries = List.of(
            entry(LocalDate.of(2023, 1, 10), "706000", "0", "1000"),
            entry(LocalDate.of(2023, 1, 20), "607000", "400", "0"),
            entry(LocalDate.of(2023, 3, 5), "706000", "0", "2000"));

        List<MonthlyPnl> months = engine.generateMonthly(entries, "2023");

        assertEquals(2, months.size());
        assertEquals(YearMonth.of(2023, 1), months.get(0).getMonth());
        assertAmount("600", months.get(0).getEbitda());
        assertAmount("60", months.get(0).getEbitdaMargin());
        assertEquals(YearMonth.of(2023, 3), months.get(1).getMonth());
        assertAmount("2000", months.get(1).getChiffreAffaires());
    }

    @Test
    @DisplayName("LTM covers the twelve months ending at the given date")
    void testLtm() {
        List<LedgerEntry> entries = List.of(
            entry(LocalDate.of(2022, 6, 30), "706000", "0", "1000"),
            entry(LocalDate.of(2022, 7, 1), "706000", "0", "2000"),
            entry(LocalDate.of(2023, 6, 30), "706000", "0", "4000"),
            entry(LocalDate.of(2023, 7, 1), "706000", "0", "8000"));

        PnlStatement ltm = engine.generateLtm(entries, LocalDate.of(2023, 6, 30));

        assertEquals("LTM 2023-06", ltm.getFiscalYear());
        assertEquals(LocalDate.of(2022, 7, 1), ltm.getStartDate());
        assertAmount("6000", ltm.getChiffreAffaires());
    }

    @Test
    @DisplayName("Comparison reports absolute and relative variation between the last two periods")
    void testCompare() {
        PnlStatement previous = engine.generate(previousYear(), "2022", FY_START, FY_END);
        PnlStatement current = engine.generate(fullYear(), "2023", FY_START, FY_END);

        PnlComparison comparison = engine.compare(List.of(previous, current));

        PnlVariation ca = comparison.getVariations().stream()
            .filter(v -> v.getSection() == PnlSection.CHIFFRE_AFFAIRES).findFirst().orElseThrow();
        assertAmount("25000", ca.getAbsoluteVariation());
        assertAmount("31.25", ca.getPercentVariation());

        PnlVariation sousTraitance = comparison.getVariations().stream()
            .filter(v -> v.getSection() == PnlSection.SOUS_TRAITANCE).findFirst().orElseThrow();
        assertAmount("0", sousTraitance.getPercentVariation());

        assertTrue(engine.compare(List.of(current)).getVariations().isEmpty());
    }
}
