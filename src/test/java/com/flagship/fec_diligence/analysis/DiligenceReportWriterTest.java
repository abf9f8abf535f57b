package com.flagship.fec_diligence.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fec_diligence.balance.BalanceSheetEngine;
import com.flagship.fec_diligence.cashflow.CashFlowEngine;
import com.flagship.fec_diligence.config.JacksonConfig;
import com.flagship.fec_diligence.ledger.LedgerParser;
import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.qoe.QoeBridgeAggregator;
import com.flagship.fec_diligence.qoe.QoeEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.flagship.fec_diligence.LedgerFixtures.resource;
import static org.junit.jupiter.api.Assertions.*;

class DiligenceReportWriterTest {

    private ObjectMapper objectMapper;
    private DiligenceReportWriter writer;
    private DiligencePack pack;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        writer = new DiligenceReportWriter(objectMapper);

        DiligenceAnalysisService service = new DiligenceAnalysisService(new LedgerParser(), new PnlEngine(),
            new BalanceSheetEngine(), new CashFlowEngine(), new QoeEngine(), new QoeBridgeAggregator(),
            new DiligenceMetrics(new SimpleMeterRegistry()), new BigDecimal("-1"), "EUR");
        pack = service.analyze(List.of(
            new LedgerSource("123456789FEC20221231.xml", resource("/fec/123456789FEC20221231.xml")),
            new LedgerSource("123456789FEC20231231.txt", resource("/fec/123456789FEC20231231.txt"))), List.of());
    }

    @Test
    @DisplayName("Dates are ISO-8601 strings and amounts plain numbers")
    void testJsonShape() throws Exception {
        JsonNode json = objectMapper.readTree(writer.toJson(pack));

        assertTrue(json.get("generatedAt").isTextual());
        assertEquals("EUR", json.get("currency").asText());
        JsonNode year = json.get("years").get(1);
        assertEquals("2023", year.get("fiscalYear").asText());
        assertEquals("2023-12-31", year.get("endDate").asText());
        assertEquals("2023-12-31", year.get("balanceSheet").get("asOfDate").asText());
        assertEquals(0, new BigDecimal("5000").compareTo(year.get("pnl").get("ebitda").decimalValue()));
        assertEquals(1, json.get("cashFlows").size());
    }

    @Test
    @DisplayName("Suggestions carry an entry count, not the ledger entries themselves")
    void testSuggestionsWithoutEntries() throws Exception {
        JsonNode suggestion = objectMapper.readTree(writer.toJson(pack))
            .get("years").get(1).get("suggestions").get(0);

        assertEquals("NON_RECURRING", suggestion.get("type").asText());
        assertEquals(1, suggestion.get("entryCount").asInt());
        assertFalse(suggestion.has("entries"));
    }

    @Test
    @DisplayName("Writing to a stream leaves it open")
    void testWriteLeavesStreamOpen() throws Exception {
        TrackingOutputStream out = new TrackingOutputStream();

        writer.write(pack, out);

        assertFalse(out.closed);
        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.startsWith("{"));
        assertFalse(json.contains("E+"));
    }

    private static class TrackingOutputStream extends ByteArrayOutputStream {
        private boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
