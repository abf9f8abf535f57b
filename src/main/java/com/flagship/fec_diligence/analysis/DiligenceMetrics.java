package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Metrics for ledger ingestion and diligence analysis.
 *
 * Metrics exposed:
 * - ledger.files.parsed: Counter of parsed files, tagged by outcome (success / rejected)
 * - ledger.rows.rejected: Counter of rows dropped by the parser
 * - ledger.files.unbalanced: Counter of files whose debit and credit totals differ
 * - qoe.suggestions: Counter of QoE suggestions, tagged by adjustment type
 * - diligence.analysis.duration: Timer for a full multi-year analysis
 */
@Component
public class DiligenceMetrics {

    private final MeterRegistry registry;

    private final Counter rowsRejected;
    private final Counter filesUnbalanced;
    private final Timer analysisTimer;

    public DiligenceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rowsRejected = Counter.builder("ledger.rows.rejected")
                .description("Number of ledger rows rejected by the parser")
                .register(registry);

        this.filesUnbalanced = Counter.builder("ledger.files.unbalanced")
                .description("Number of ledger files whose total debit and credit differ")
                .register(registry);

        this.analysisTimer = Timer.builder("diligence.analysis.duration")
                .description("Time taken to analyse a set of ledger files")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordFileParsed(boolean success, int rejectedRows) {
        registry.counter("ledger.files.parsed", "outcome", success ? "success" : "rejected").increment();
        if (rejectedRows > 0) {
            rowsRejected.increment(rejectedRows);
        }
    }

    public void incrementUnbalancedFiles() {
        filesUnbalanced.increment();
    }

    public void recordSuggestions(List<SuggestedAdjustment> suggestions) {
        for (SuggestedAdjustment suggestion : suggestions) {
            registry.counter("qoe.suggestions",
                    "type", suggestion.getType().name().toLowerCase(Locale.ROOT)
            ).increment();
        }
    }

    public <T> T timeAnalysis(Supplier<T> analysis) {
        return analysisTimer.record(analysis);
    }
}
