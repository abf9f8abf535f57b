package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.qoe.AdjustmentType;
import com.flagship.fec_diligence.qoe.ConfidenceTier;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiligenceMetricsTest {

    private SimpleMeterRegistry registry;
    private DiligenceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DiligenceMetrics(registry);
    }

    private static SuggestedAdjustment suggestion(AdjustmentType type) {
        return SuggestedAdjustment.builder()
            .type(type)
            .ruleName("test")
            .confidence(ConfidenceTier.LOW)
            .label(type.getLabel())
            .impactEbitda(BigDecimal.ZERO)
            .build();
    }

    @Test
    @DisplayName("Parsed files are counted by outcome along with rejected rows")
    void testFilesParsed() {
        metrics.recordFileParsed(true, 3);
        metrics.recordFileParsed(true, 0);
        metrics.recordFileParsed(false, 0);

        assertEquals(2.0, registry.counter("ledger.files.parsed", "outcome", "success").count());
        assertEquals(1.0, registry.counter("ledger.files.parsed", "outcome", "rejected").count());
        assertEquals(3.0, registry.get("ledger.rows.rejected").counter().count());
    }

    @Test
    @DisplayName("Unbalanced files are counted")
    void testUnbalancedFiles() {
        metrics.incrementUnbalancedFiles();

        assertEquals(1.0, registry.get("ledger.files.unbalanced").counter().count());
    }

    @Test
    @DisplayName("Suggestions are counted per adjustment type")
    void testSuggestions() {
        metrics.recordSuggestions(List.of(
            suggestion(AdjustmentType.NON_RECURRING),
            suggestion(AdjustmentType.NON_RECURRING),
            suggestion(AdjustmentType.BAD_DEBT)));

        assertEquals(2.0, registry.counter("qoe.suggestions", "type", "non_recurring").count());
        assertEquals(1.0, registry.counter("qoe.suggestions", "type", "bad_debt").count());
    }

    @Test
    @DisplayName("Analysis duration is timed and the result passed through")
    void testTimeAnalysis() {
        String result = metrics.timeAnalysis(() -> "done");

        assertEquals("done", result);
        assertEquals(1, registry.get("diligence.analysis.duration").timer().count());
    }
}
