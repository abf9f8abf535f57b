package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.balance.BalanceSheet;
import com.flagship.fec_diligence.balance.BalanceSheetEngine;
import com.flagship.fec_diligence.cashflow.CashFlowEngine;
import com.flagship.fec_diligence.cashflow.CashFlowStatement;
import com.flagship.fec_diligence.ledger.LedgerParseResult;
import com.flagship.fec_diligence.ledger.LedgerParser;
import com.flagship.fec_diligence.ledger.ParsedLedgerFile;
import com.flagship.fec_diligence.pnl.EbitdaBridgeItem;
import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.pnl.PnlStatement;
import com.flagship.fec_diligence.qoe.QoeAdjustment;
import com.flagship.fec_diligence.qoe.QoeBridgeAggregator;
import com.flagship.fec_diligence.qoe.QoeEngine;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the whole derivation chain over a set of FEC files.
 *
 * Flow:
 * 1. Parse every file; a rejected or over-unbalanced file aborts the analysis
 * 2. Order the ledgers by period start
 * 3. P&L, closing balance sheet, working capital and QoE suggestions per year
 * 4. Cash flow for each pair of consecutive years
 * 5. Multi-year P&L comparison, EBITDA bridge and QoE bridge
 *
 * The ledger filename is put in the MDC under {@value #LEDGER_FILE_MDC_KEY} while
 * that file is being processed.
 */
@Slf4j
@Service
public class DiligenceAnalysisService {

    public static final String LEDGER_FILE_MDC_KEY = "ledgerFile";

    private final LedgerParser parser;
    private final PnlEngine pnlEngine;
    private final BalanceSheetEngine balanceSheetEngine;
    private final CashFlowEngine cashFlowEngine;
    private final QoeEngine qoeEngine;
    private final QoeBridgeAggregator bridgeAggregator;
    private final DiligenceMetrics metrics;
    private final BigDecimal maxImbalance;
    private final String currency;

    public DiligenceAnalysisService(LedgerParser parser,
                                    PnlEngine pnlEngine,
                                    BalanceSheetEngine balanceSheetEngine,
                                    CashFlowEngine cashFlowEngine,
                                    QoeEngine qoeEngine,
                                    QoeBridgeAggregator bridgeAggregator,
                                    DiligenceMetrics metrics,
                                    @Value("${fec.derivation.max-imbalance:-1}") BigDecimal maxImbalance,
                                    @Value("${fec.derivation.currency:EUR}") String currency) {
        this.parser = parser;
        this.pnlEngine = pnlEngine;
        this.balanceSheetEngine = balanceSheetEngine;
        this.cashFlowEngine = cashFlowEngine;
        this.qoeEngine = qoeEngine;
        this.bridgeAggregator = bridgeAggregator;
        this.metrics = metrics;
        this.maxImbalance = maxImbalance;
        this.currency = currency;
    }

    /**
     * @param sources      ledger files, in any order
     * @param adjustments  QoE adjustments known so far; only validated ones move adjusted EBITDA
     * @throws LedgerRejectedException   if a file has no usable entries
     * @throws UnbalancedLedgerException if a file exceeds the configured maximum imbalance
     */
    public DiligencePack analyze(List<LedgerSource> sources, List<QoeAdjustment> adjustments) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger file is required");
        }
        List<QoeAdjustment> knownAdjustments = adjustments != null ? adjustments : List.of();
        return metrics.timeAnalysis(() -> doAnalyze(sources, knownAdjustments));
    }

    private DiligencePack doAnalyze(List<LedgerSource> sources, List<QoeAdjustment> adjustments) {
        List<LedgerParseResult> parsed = new ArrayList<>();
        for (LedgerSource source : sources) {
            parsed.add(parseChecked(source));
        }
        parsed.sort(Comparator.comparing(result -> result.getFile().getStartDate()));

        List<FiscalYearAnalysis> years = new ArrayList<>();
        for (LedgerParseResult result : parsed) {
            years.add(analyzeYear(result));
        }

        List<CashFlowStatement> cashFlows = new ArrayList<>();
        for (int i = 1; i < years.size(); i++) {
            FiscalYearAnalysis previous = years.get(i - 1);
            FiscalYearAnalysis current = years.get(i);
            cashFlows.add(cashFlowEngine.generate(current.getPnl(), previous.getBalanceSheet(),
                current.getBalanceSheet()));
        }

        List<PnlStatement> statements = years.stream().map(FiscalYearAnalysis::getPnl).toList();
        List<EbitdaBridgeItem> ebitdaBridge = statements.size() < 2
            ? List.of()
            : pnlEngine.ebitdaBridge(statements.get(statements.size() - 1), statements.get(statements.size() - 2));

        log.info("Analysed {} fiscal year(s): {}", years.size(),
            years.stream().map(FiscalYearAnalysis::getFiscalYear).toList());

        return DiligencePack.builder()
            .generatedAt(Instant.now())
            .currency(currency)
            .years(years)
            .cashFlows(cashFlows)
            .pnlComparison(pnlEngine.compare(statements))
            .ebitdaBridge(ebitdaBridge)
            .qoeBridge(bridgeAggregator.bridge(statements, adjustments))
            .build();
    }

    private LedgerParseResult parseChecked(LedgerSource source) {
        MDC.put(LEDGER_FILE_MDC_KEY, source.getFilename());
        try {
            LedgerParseResult result = parser.parse(source.getContent(), source.getFilename());
            int rejectedRows = (int) result.getErrors().stream().filter(e -> e.getLine() > 0).count();
            metrics.recordFileParsed(result.isSuccess(), rejectedRows);

            if (!result.isSuccess()) {
                throw new LedgerRejectedException(source.getFilename(), result.getErrors());
            }

            ParsedLedgerFile file = result.getFile();
            if (!file.isBalanced()) {
                metrics.incrementUnbalancedFiles();
            }
            BigDecimal imbalance = file.imbalance().abs();
            if (maxImbalance.signum() >= 0 && imbalance.compareTo(maxImbalance) > 0) {
                throw new UnbalancedLedgerException(source.getFilename(), imbalance, maxImbalance);
            }
            return result;
        } finally {
            MDC.remove(LEDGER_FILE_MDC_KEY);
        }
    }

    private FiscalYearAnalysis analyzeYear(LedgerParseResult result) {
        ParsedLedgerFile file = result.getFile();
        MDC.put(LEDGER_FILE_MDC_KEY, file.getFilename());
        try {
            PnlStatement pnl = pnlEngine.generate(file.getEntries(), file.getFiscalYear(),
                file.getStartDate(), file.getEndDate());
            BalanceSheet balanceSheet = balanceSheetEngine.generate(file.getEntries(), file.getEndDate(),
                file.getFiscalYear());
            List<SuggestedAdjustment> suggestions = qoeEngine.detect(file.getEntries(), pnl);
            metrics.recordSuggestions(suggestions);

            log.debug("{}: EBITDA {}, total actif {}, {} QoE suggestion(s)", file.getFiscalYear(),
                pnl.getEbitda(), balanceSheet.getTotalActif(), suggestions.size());

            return FiscalYearAnalysis.builder()
                .filename(file.getFilename())
                .fiscalYear(file.getFiscalYear())
                .sourceYear(file.getSourceYear())
                .startDate(file.getStartDate())
                .endDate(file.getEndDate())
                .entryCount(file.getEntryCount())
                .totalDebit(file.getTotalDebit())
                .totalCredit(file.getTotalCredit())
                .balanced(file.isBalanced())
                .parseWarnings(result.getWarnings())
                .pnl(pnl)
                .balanceSheet(balanceSheet)
                .workingCapital(balanceSheetEngine.workingCapitalMetrics(balanceSheet, pnl))
                .suggestions(suggestions)
                .build();
        } finally {
            MDC.remove(LEDGER_FILE_MDC_KEY);
        }
    }
}
