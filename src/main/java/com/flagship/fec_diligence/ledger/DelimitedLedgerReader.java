package com.flagship.fec_diligence.ledger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads pipe, semicolon, tab or comma separated FEC exports.
 */
@Slf4j
final class DelimitedLedgerReader {

    private static final char[] DELIMITERS = {'|', ';', '\t', ','};

    /** A FEC header has 18 columns; five fields is the least we accept as a real header. */
    private static final int MIN_HEADER_FIELDS = 5;

    private final LedgerRowMapper rowMapper;

    DelimitedLedgerReader(LedgerRowMapper rowMapper) {
        this.rowMapper = rowMapper;
    }

    List<LedgerEntry> read(String content, ParseDiagnostics diagnostics) throws LedgerFormatException {
        String[] lines = content.split("\\r?\\n");
        long nonBlankLines = Arrays.stream(lines).filter(line -> !line.isBlank()).count();
        String headerLine = Arrays.stream(lines).filter(line -> !line.isBlank()).findFirst().orElse("");

        Character delimiter = detectDelimiter(headerLine);
        if (delimiter == null) {
            throw new LedgerFormatException("Could not detect file delimiter");
        }
        if (nonBlankLines < 2) {
            throw new LedgerFormatException("File must contain header and at least one data row");
        }

        CSVFormat quoted = format(delimiter, '"');
        CSVFormat unquoted = format(delimiter, null);

        List<LedgerEntry> entries = new ArrayList<>();
        Map<FecColumn, Integer> columns = null;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            int line = i + 1;
            CSVRecord record = parseLine(line, lines[i], quoted, unquoted, diagnostics);
            if (columns == null) {
                if (record == null) {
                    throw new LedgerFormatException("Unreadable header line");
                }
                columns = mapColumns(record, diagnostics);
            } else if (record != null) {
                rowMapper.map(line, valuesOf(record, columns), diagnostics).ifPresent(entries::add);
            }
        }
        return entries;
    }

    private static CSVFormat format(char delimiter, Character quote) {
        return CSVFormat.RFC4180.builder()
            .setDelimiter(delimiter)
            .setQuote(quote)
            .setQuoteMode(quote != null ? QuoteMode.MINIMAL : null)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
    }

    /**
     * Each physical line is one record. A line whose quoting is malformed is read again with
     * quotes taken literally; a line that still cannot be read is rejected on its own.
     */
    private static CSVRecord parseLine(int line, String text, CSVFormat quoted, CSVFormat unquoted,
                                       ParseDiagnostics diagnostics) {
        try {
            return firstRecord(text, quoted);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Line {} has malformed quoting, reading quotes literally: {}", line, e.getMessage());
        }
        try {
            CSVRecord record = firstRecord(text, unquoted);
            diagnostics.warning(String.format("Line %d: Unbalanced quotes, quotes kept as text", line));
            return record;
        } catch (IOException | UncheckedIOException e) {
            diagnostics.error(line, "", text, "Unreadable line: " + e.getMessage());
            return null;
        }
    }

    private static CSVRecord firstRecord(String text, CSVFormat format) throws IOException {
        try (CSVParser parser = CSVParser.parse(text, format)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                throw new IOException("No record on line");
            }
            return records.get(0);
        }
    }

    static Character detectDelimiter(String headerLine) {
        for (char delimiter : DELIMITERS) {
            long separators = headerLine.chars().filter(c -> c == delimiter).count();
            if (separators + 1 >= MIN_HEADER_FIELDS) {
                return delimiter;
            }
        }
        return null;
    }

    /**
     * Exact normalized name first, then a header containing the column name.
     */
    private static Map<FecColumn, Integer> mapColumns(CSVRecord header, ParseDiagnostics diagnostics)
            throws LedgerFormatException {
        List<String> normalized = new ArrayList<>();
        for (String name : header) {
            normalized.add(LedgerValueParser.normalizeHeader(name));
        }

        Map<FecColumn, Integer> columns = new EnumMap<>(FecColumn.class);
        Set<Integer> claimed = new HashSet<>();
        for (FecColumn column : FecColumn.values()) {
            int index = normalized.indexOf(column.normalizedName());
            if (index >= 0) {
                columns.put(column, index);
                claimed.add(index);
            }
        }
        for (FecColumn column : FecColumn.values()) {
            if (columns.containsKey(column)) {
                continue;
            }
            for (int i = 0; i < normalized.size(); i++) {
                if (!claimed.contains(i) && normalized.get(i).contains(column.normalizedName())) {
                    columns.put(column, i);
                    claimed.add(i);
                    break;
                }
            }
        }

        List<LedgerValidationError> missing = new ArrayList<>();
        for (FecColumn required : FecColumn.requiredColumns()) {
            if (!columns.containsKey(required)) {
                missing.add(new LedgerValidationError(1, required.getHeaderName(), "",
                    String.format("Required column \"%s\" not found in header", required.getHeaderName())));
            }
        }
        if (!missing.isEmpty()) {
            throw new LedgerFormatException("Missing required columns", missing);
        }
        return columns;
    }

    private static Map<FecColumn, String> valuesOf(CSVRecord record, Map<FecColumn, Integer> columns) {
        Map<FecColumn, String> values = new EnumMap<>(FecColumn.class);
        columns.forEach((column, index) -> {
            if (index < record.size()) {
                values.put(column, record.get(index));
            }
        });
        return values;
    }
}
