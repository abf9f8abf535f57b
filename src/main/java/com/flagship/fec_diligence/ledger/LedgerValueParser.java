package com.flagship.fec_diligence.ledger;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Text-to-value conversions for ledger fields: headers, amounts and dates.
 */
final class LedgerValueParser {

    private static final DateTimeFormatter COMPACT_DATE =
        DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern DATE_SEPARATORS = Pattern.compile("[/.\\-]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u202F]");

    private LedgerValueParser() {
    }

    /**
     * Lower case, diacritics removed, only [a-z0-9] kept: "Écriture Date" becomes "ecrituredate".
     */
    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(header.trim().toLowerCase(), Normalizer.Form.NFD);
        String ascii = DIACRITICS.matcher(decomposed).replaceAll("");
        return NON_ALPHANUMERIC.matcher(ascii).replaceAll("");
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Parses a French or international decimal ("1 234,56", "1234.56", "1.234,56").
     * Blank input is zero; unparseable input returns null.
     */
    static BigDecimal parseAmount(String raw) {
        String value = clean(raw);
        if (value == null) {
            return BigDecimal.ZERO;
        }
        String compact = WHITESPACE.matcher(value).replaceAll("");
        int lastComma = compact.lastIndexOf(',');
        int lastDot = compact.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            // The right-most separator is the decimal one
            if (lastComma > lastDot) {
                compact = compact.replace(".", "").replace(',', '.');
            } else {
                compact = compact.replace(",", "");
            }
        } else if (lastComma >= 0) {
            compact = compact.replace(',', '.');
        }
        if (compact.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(compact);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static LocalDate parseDate(String raw, DateFormatOption format) {
        String value = clean(raw);
        if (value == null) {
            return null;
        }
        switch (format) {
            case YYYYMMDD:
                return parseCompact(value);
            case DD_MM_YYYY:
                return parseSeparated(value);
            default:
                LocalDate date = parseCompact(value);
                if (date == null) {
                    date = parseSeparated(value);
                }
                if (date == null) {
                    date = parseIso(value);
                }
                return date;
        }
    }

    private static LocalDate parseCompact(String value) {
        if (value.length() != 8) {
            return null;
        }
        try {
            return LocalDate.parse(value, COMPACT_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate parseSeparated(String value) {
        String[] parts = DATE_SEPARATORS.split(value.length() > 10 ? value.substring(0, 10) : value);
        if (parts.length != 3) {
            return null;
        }
        try {
            int first = Integer.parseInt(parts[0]);
            int second = Integer.parseInt(parts[1]);
            int third = Integer.parseInt(parts[2]);
            if (parts[0].length() == 4) {
                return LocalDate.of(first, second, third);
            }
            int year = parts[2].length() == 2 ? 2000 + third : third;
            return LocalDate.of(year, second, first);
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }

    private static LocalDate parseIso(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the date-time forms below
        }
        try {
            return LocalDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // try the offset form below
        }
        try {
            return OffsetDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
