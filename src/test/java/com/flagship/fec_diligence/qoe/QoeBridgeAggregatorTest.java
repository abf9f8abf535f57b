package com.flagship.fec_diligence.qoe;

import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.pnl.PnlStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.fec_diligence.LedgerFixtures.FY_END;
import static com.flagship.fec_diligence.LedgerFixtures.FY_START;
import static com.flagship.fec_diligence.LedgerFixtures.assertAmount;
import static com.flagship.fec_diligence.LedgerFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

class QoeBridgeAggregatorTest {

    private final QoeBridgeAggregator aggregator = new QoeBridgeAggregator();
    private final PnlEngine pnlEngine = new PnlEngine();

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

    private PnlStatement pnl2023() {
        return pnlEngine.generate(List.of(
            entry("706000", "0", "100000"),
            entry("641000", "60000", "0")), "2023", FY_START, FY_END);
    }

    private PnlStatement pnl2022() {
        LocalDate date = LocalDate.of(2022, 6, 30);
        return pnlEngine.generate(List.of(
            entry(date, "706000", "0", "80000"),
            entry(date, "641000", "50000", "0")), "2022", LocalDate.of(2022, 1, 1), LocalDate.of(2022, 12, 31));
    }

    private static QoeAdjustment adjustment(String fiscalYear, AdjustmentType type, String impact,
                                            boolean validated, String... accounts) {
        return QoeAdjustment.builder()
            .id(UUID.randomUUID())
            .type(type)
            .label(type.getLabel())
            .fiscalYear(fiscalYear)
            .impactEbitda(new BigDecimal(impact))
            .confidence(ConfidenceTier.HIGH)
            .source(AdjustmentSource.AUTO_DETECTED)
            .relatedAccounts(List.of(accounts))
            .validated(validated)
            .build();
    }

    @Test
    @DisplayName("Only validated adjustments of the year reach adjusted EBITDA")
    void testAnalyze() {
        printTestHeader("QoE analysis");

        QoeAdjustment nonRecurring = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAdjustment pending = adjustment("2023", AdjustmentType.BAD_DEBT, "3000", false, "654000");
        QoeAdjustment otherYear = adjustment("2022", AdjustmentType.OWNER_COMPENSATION, "10000", true);

        QoeAnalysis analysis = aggregator.analyze(pnl2023(), List.of(nonRecurring, pending, otherYear));
        printOutput("EBITDA ajusté", analysis.getEbitdaAjuste());

        assertAmount("40000", analysis.getEbitdaReporte());
        assertEquals(List.of(nonRecurring), analysis.getAdjustments());
        assertAmount("5000", analysis.getTotalAdjustments());
        assertAmount("45000", analysis.getEbitdaAjuste());
        assertAmount("45", analysis.getMargeEbitdaAjustee());
        assertAmount("100000", analysis.getProduction());
        printSuccess("Pending adjustment ignored");
    }

    @Test
    @DisplayName("Validating an adjustment shifts adjusted EBITDA by exactly its impact")
    void testValidationShift() {
        QoeAdjustment nonRecurring = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAdjustment pending = adjustment("2023", AdjustmentType.BAD_DEBT, "3000", false, "654000");

        BigDecimal before = aggregator.analyze(pnl2023(), List.of(nonRecurring, pending)).getEbitdaAjuste();
        BigDecimal after = aggregator.analyze(pnl2023(), List.of(nonRecurring, pending.validate())).getEbitdaAjuste();

        assertAmount("3000", after.subtract(before));
    }

    @Test
    @DisplayName("No production gives a zero adjusted margin")
    void testZeroProduction() {
        PnlStatement empty = pnlEngine.generate(List.of(), "2023", FY_START, FY_END);

        QoeAnalysis analysis = aggregator.analyze(empty,
            List.of(adjustment("2023", AdjustmentType.OTHER, "1000", true)));

        assertAmount("1000", analysis.getEbitdaAjuste());
        assertAmount("0", analysis.getMargeEbitdaAjustee());
    }

    @Test
    @DisplayName("Bridge has one analysis per year, a type summary and the suspected double counts")
    void testBridge() {
        QoeAdjustment nonRecurring = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAdjustment owner = adjustment("2022", AdjustmentType.OWNER_COMPENSATION, "10000", true);
        QoeAdjustment lookalike = adjustment("2023", AdjustmentType.NON_RECURRING, "5200", true, "675000");
        QoeAdjustment pending = adjustment("2023", AdjustmentType.BAD_DEBT, "3000", false);

        QoeBridge bridge = aggregator.bridge(List.of(pnl2022(), pnl2023()),
            List.of(nonRecurring, owner, lookalike, pending));

        assertEquals(2, bridge.getAnalyses().size());
        assertAmount("40000", bridge.getAnalyses().get(0).getEbitdaAjuste());
        assertAmount("50200", bridge.getAnalyses().get(1).getEbitdaAjuste());

        assertEquals(2, bridge.getSummary().size());
        QoeTypeSummary first = bridge.getSummary().get(0);
        assertEquals(AdjustmentType.OWNER_COMPENSATION, first.getType());
        assertEquals(1, first.getCount());
        assertAmount("10000", first.getAverageImpact());
        QoeTypeSummary second = bridge.getSummary().get(1);
        assertEquals(2, second.getCount());
        assertAmount("10200", second.getTotalImpact());
        assertAmount("5100", second.getAverageImpact());
        assertEquals("2 ajustement(s) de ce type", second.getDescription());

        assertEquals(1, bridge.getCollisions().size());
        AdjustmentCollision collision = bridge.getCollisions().get(0);
        assertEquals(lookalike, collision.getAdjustment());
        assertEquals(nonRecurring, collision.getConflictsWith());
        assertEquals(AdjustmentCollision.Reason.SIMILAR_AMOUNT, collision.getReason());
    }

    @Test
    @DisplayName("An adjustment covering another one's accounts is a suspected double count")
    void testOverlappingAccounts() {
        QoeAdjustment existing = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAdjustment candidate = adjustment("2023", AdjustmentType.OTHER, "25000", true, "671200", "675000");

        Optional<AdjustmentCollision> collision = aggregator.findDuplicate(candidate, List.of(existing));

        assertTrue(collision.isPresent());
        assertEquals(AdjustmentCollision.Reason.OVERLAPPING_ACCOUNTS, collision.get().getReason());
    }

    @Test
    @DisplayName("Distinct adjustments and the adjustment itself are not duplicates")
    void testNoDuplicate() {
        QoeAdjustment existing = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAdjustment different = adjustment("2023", AdjustmentType.NON_RECURRING, "9000", true, "675000");

        assertTrue(aggregator.findDuplicate(existing, List.of(existing)).isEmpty());
        assertTrue(aggregator.findDuplicate(different, List.of(existing)).isEmpty());
        assertTrue(aggregator.findDuplicate(existing.toBuilder().id(UUID.randomUUID()).fiscalYear("2022").build(),
            List.of(different)).isEmpty());
    }

    @Test
    @DisplayName("Chart walks from reported to adjusted EBITDA")
    void testChart() {
        QoeAdjustment nonRecurring = adjustment("2023", AdjustmentType.NON_RECURRING, "5000", true, "671200");
        QoeAnalysis analysis = aggregator.analyze(pnl2023(), List.of(nonRecurring));

        List<QoeBridgeChartItem> chart = aggregator.chart(analysis);

        assertEquals(3, chart.size());
        assertEquals(QoeBridgeChartItem.Type.START, chart.get(0).getType());
        assertEquals("EBITDA reporté", chart.get(0).getLabel());
        assertAmount("5000", chart.get(1).getValue());
        assertEquals(AdjustmentType.NON_RECURRING.getLabel(), chart.get(1).getLabel());
        assertEquals(QoeBridgeChartItem.Type.END, chart.get(2).getType());
        assertAmount("45000", chart.get(2).getValue());
    }
}
