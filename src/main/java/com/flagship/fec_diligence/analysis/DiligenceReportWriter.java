package com.flagship.fec_diligence.analysis;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serialises a {@link DiligencePack} to JSON (ISO-8601 dates).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiligenceReportWriter {

    private final ObjectMapper objectMapper;

    public String toJson(DiligencePack pack) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(pack);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize diligence pack", e);
            throw new IllegalStateException("Failed to serialize diligence pack", e);
        }
    }

    /**
     * Writes the pack to the stream, leaving the stream open.
     */
    public void write(DiligencePack pack, OutputStream out) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter()
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .writeValue(out, pack);
    }
}
