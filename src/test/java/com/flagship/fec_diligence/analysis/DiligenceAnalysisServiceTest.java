package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.balance.BalanceSheetEngine;
import com.flagship.fec_diligence.cashflow.CashFlowEngine;
import com.flagship.fec_diligence.cashflow.CashFlowStatement;
import com.flagship.fec_diligence.ledger.LedgerParser;
import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.qoe.AdjustmentType;
import com.flagship.fec_diligence.qoe.QoeAdjustment;
import com.flagship.fec_diligence.qoe.QoeBridgeAggregator;
import com.flagship.fec_diligence.qoe.QoeEngine;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static com.flagship.fec_diligence.LedgerFixtures.assertAmount;
import static com.flagship.fec_diligence.LedgerFixtures.resource;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end analysis of two consecutive fiscal years, wired by Spring.
 */
@SpringBootTest
class DiligenceAnalysisServiceTest {

    private static final String FEC_2022 = "123456789FEC20221231.xml";
    private static final String FEC_2023 = "123456789FEC20231231.txt";

    @Autowired
    private DiligenceAnalysisService analysisService;

    @Autowired
    private LedgerParser parser;

    @Autowired
    private PnlEngine pnlEngine;

    @Autowired
    private BalanceSheetEngine balanceSheetEngine;

    @Autowired
    private CashFlowEngine cashFlowEngine;

    @Autowired
    private QoeEngine qoeEngine;

    @Autowired
    private QoeBridgeAggregator bridgeAggregator;

    @Autowired
    private DiligenceMetrics metrics;

    @Autowired
    private MeterRegistry meterRegistry;

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

    private static List<LedgerSource> twoYears() {
        // Deliberately newest first
        return List.of(
            new LedgerSource(FEC_2023, resource("/fec/" + FEC_2023)),
            new LedgerSource(FEC_2022, resource("/fec/" + FEC_2022)));
    }

    private double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }

    @Test
    @DisplayName("Two fiscal years give ordered statements, one cash flow and the bridges")
    void testTwoYearAnalysis() {
        printTestHeader("Two-year diligence analysis");

        DiligencePack pack = analysisService.analyze(twoYears(), List.of());

        assertEquals(2, pack.getYears().size());
        FiscalYearAnalysis first = pack.getYears().get(0);
        FiscalYearAnalysis second = pack.getYears().get(1);
        assertEquals("2022", first.getFiscalYear());
        assertEquals("2023", second.getFiscalYear());
        assertEquals(LocalDate.of(2023, 12, 31), second.getEndDate());
        assertEquals(18, second.getEntryCount());
        assertTrue(second.isBalanced());
        assertEquals("EUR", pack.getCurrency());
        assertNotNull(pack.getGeneratedAt());

        printOutput("EBITDA 2022", first.getPnl().getEbitda());
        printOutput("EBITDA 2023", second.getPnl().getEbitda());
        assertAmount("5000", first.getPnl().getEbitda());
        assertAmount("5000", second.getPnl().getEbitda());
        assertAmount("3500", second.getPnl().getResultatNet());
        assertEquals(LocalDate.of(2023, 12, 31), second.getBalanceSheet().getAsOfDate());
        assertAmount("24500", second.getBalanceSheet().getTresorerieActif());
        assertNotNull(second.getWorkingCapital());

        assertEquals(1, pack.getCashFlows().size());
        CashFlowStatement cashFlow = pack.getCashFlows().get(0);
        printOutput("Variation de trésorerie", cashFlow.getVariationTresorerie());
        assertEquals("2023", cashFlow.getFiscalYear());
        assertAmount("16000", cashFlow.getTresorerieOuverture());
        assertAmount("24500", cashFlow.getTresorerieCloture());
        assertAmount("8500", cashFlow.getVariationTresorerie());

        assertEquals(5, pack.getEbitdaBridge().size());
        assertEquals("EBITDA 2022", pack.getEbitdaBridge().get(0).getLabel());
        assertEquals(2, pack.getPnlComparison().getPeriods().size());
        assertEquals(2, pack.getQoeBridge().getAnalyses().size());
        printSuccess("Statements derived for both years");
    }

    @Test
    @DisplayName("Suggestions are raised per year and only validated adjustments move adjusted EBITDA")
    void testQoeFlow() {
        DiligencePack pack = analysisService.analyze(twoYears(), List.of());

        assertTrue(pack.getYears().get(0).getSuggestions().isEmpty());
        List<SuggestedAdjustment> suggestions = pack.getYears().get(1).getSuggestions();
        assertEquals(2, suggestions.size());
        SuggestedAdjustment exceptional = suggestions.get(0);
        assertEquals(AdjustmentType.NON_RECURRING, exceptional.getType());
        assertAmount("1500", exceptional.getImpactEbitda());
        assertEquals(AdjustmentType.OWNER_COMPENSATION, suggestions.get(1).getType());
        assertAmount("5000", pack.getQoeBridge().getAnalyses().get(1).getEbitdaAjuste());

        QoeAdjustment pending = QoeAdjustment.fromSuggestion(exceptional, "2023");
        DiligencePack withPending = analysisService.analyze(twoYears(), List.of(pending));
        assertAmount("5000", withPending.getQoeBridge().getAnalyses().get(1).getEbitdaAjuste());

        DiligencePack withValidated = analysisService.analyze(twoYears(), List.of(pending.validate()));
        assertAmount("6500", withValidated.getQoeBridge().getAnalyses().get(1).getEbitdaAjuste());
        assertAmount("5000", withValidated.getQoeBridge().getAnalyses().get(0).getEbitdaAjuste());
    }

    @Test
    @DisplayName("A single year gives no cash flow and no EBITDA bridge")
    void testSingleYear() {
        DiligencePack pack = analysisService.analyze(
            List.of(new LedgerSource(FEC_2023, resource("/fec/" + FEC_2023))), null);

        assertEquals(1, pack.getYears().size());
        assertTrue(pack.getCashFlows().isEmpty());
        assertTrue(pack.getEbitdaBridge().isEmpty());
        assertTrue(pack.getPnlComparison().getVariations().isEmpty());
    }

    @Test
    @DisplayName("A file without usable entries aborts the analysis")
    void testRejectedLedger() {
        double rejectedBefore = counter("ledger.files.parsed", "outcome", "rejected");
        LedgerSource broken = new LedgerSource("broken.txt", "not a ledger".getBytes(StandardCharsets.UTF_8));

        LedgerRejectedException ex = assertThrows(LedgerRejectedException.class,
            () -> analysisService.analyze(List.of(broken), List.of()));

        assertEquals("broken.txt", ex.getFilename());
        assertFalse(ex.getErrors().isEmpty());
        assertTrue(ex.getMessage().startsWith("Ledger broken.txt rejected"));
        assertNull(MDC.get(DiligenceAnalysisService.LEDGER_FILE_MDC_KEY));
        assertEquals(rejectedBefore + 1, counter("ledger.files.parsed", "outcome", "rejected"));
    }

    @Test
    @DisplayName("A ledger unbalanced beyond the configured maximum is refused")
    void testUnbalancedLedger() {
        DiligenceAnalysisService strict = new DiligenceAnalysisService(parser, pnlEngine, balanceSheetEngine,
            cashFlowEngine, qoeEngine, bridgeAggregator, metrics, new BigDecimal("5"), "EUR");
        String content = String.join("\n",
            "JournalCode|JournalLib|EcritureNum|EcritureDate|CompteNum|CompteLib|CompAuxNum|CompAuxLib|PieceRef|"
                + "PieceDate|EcritureLib|Debit|Credit|EcritureLet|DateLet|ValidDate|Montantdevise|Idevise",
            "OD|Operations diverses|1|20230110|512000|Banque|||||Vente|100,00|0,00|||||",
            "OD|Operations diverses|1|20230110|706000|Ventes|||||Vente|0,00|90,00|||||");
        LedgerSource unbalanced = new LedgerSource("unbalanced.txt", content.getBytes(StandardCharsets.UTF_8));
        double unbalancedBefore = counter("ledger.files.unbalanced");

        UnbalancedLedgerException ex = assertThrows(UnbalancedLedgerException.class,
            () -> strict.analyze(List.of(unbalanced), List.of()));

        assertEquals("unbalanced.txt", ex.getFilename());
        assertAmount("10", ex.getImbalance());
        assertEquals("Ledger unbalanced.txt is unbalanced by 10.00 (maximum allowed 5.00)", ex.getMessage());
        assertEquals(unbalancedBefore + 1, counter("ledger.files.unbalanced"));
        assertNull(MDC.get(DiligenceAnalysisService.LEDGER_FILE_MDC_KEY));

        // Default configuration only warns
        DiligencePack pack = analysisService.analyze(List.of(unbalanced), List.of());
        assertFalse(pack.getYears().get(0).isBalanced());
        assertFalse(pack.getYears().get(0).getParseWarnings().isEmpty());
    }

    @Test
    @DisplayName("At least one ledger file is required")
    void testNoSources() {
        assertThrows(IllegalArgumentException.class, () -> analysisService.analyze(List.of(), List.of()));
    }

    @Test
    @DisplayName("Parsed files and suggestions are counted")
    void testMetrics() {
        double successBefore = counter("ledger.files.parsed", "outcome", "success");
        double nonRecurringBefore = counter("qoe.suggestions", "type", "non_recurring");

        analysisService.analyze(twoYears(), List.of());

        assertEquals(successBefore + 2, counter("ledger.files.parsed", "outcome", "success"));
        assertEquals(nonRecurringBefore + 1, counter("qoe.suggestions", "type", "non_recurring"));
        assertTrue(meterRegistry.get("diligence.analysis.duration").timer().count() > 0);
    }
}
