package com.flagship.fec_diligence.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses FEC ledgers (delimited text or XML) into a {@link ParsedLedgerFile}.
 *
 * Rows with a missing account number or an unreadable entry date are dropped and
 * reported as errors; parsing carries on with the remaining rows. The file fails as
 * a whole only when its structure is unusable or no valid row is left.
 *
 * Stateless: one instance can parse any number of files concurrently.
 */
@Slf4j
@Service
public class LedgerParser {

    private static final Pattern SOURCE_YEAR = Pattern.compile("FEC(\\d{4})", Pattern.CASE_INSENSITIVE);

    private final BigDecimal balanceTolerance;

    @Autowired
    public LedgerParser(@Value("${fec.parser.balance-tolerance:0.01}") BigDecimal balanceTolerance) {
        this.balanceTolerance = balanceTolerance;
    }

    public LedgerParser() {
        this(new BigDecimal("0.01"));
    }

    public LedgerParseResult parse(byte[] content, String filename) {
        return parse(LedgerTextDecoder.decode(content), filename, DateFormatOption.AUTO);
    }

    public LedgerParseResult parse(String content, String filename) {
        return parse(content, filename, DateFormatOption.AUTO);
    }

    /**
     * Parses ledger text.
     *
     * @param content   full file content
     * @param filename  original file name, used for the source year and in diagnostics
     * @param dateFormat how entry dates are written
     * @return success with the parsed file, or failure with the errors found
     */
    public LedgerParseResult parse(String content, String filename, DateFormatOption dateFormat) {
        if (content == null || content.isBlank()) {
            log.info("Ledger {} rejected: empty content", filename);
            return LedgerParseResult.failure("File is empty");
        }
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;

        ParseDiagnostics diagnostics = new ParseDiagnostics();
        LedgerRowMapper rowMapper = new LedgerRowMapper(dateFormat);
        List<LedgerEntry> entries;
        try {
            entries = isXml(text)
                ? new XmlLedgerReader(rowMapper).read(text, diagnostics)
                : new DelimitedLedgerReader(rowMapper).read(text, diagnostics);
        } catch (LedgerFormatException e) {
            log.info("Ledger {} rejected: {}", filename, e.getMessage());
            return LedgerParseResult.failure(e.getErrors(), diagnostics.getWarnings());
        }

        if (entries.isEmpty()) {
            diagnostics.error(0, "file", "", "No valid entries found in file");
            log.info("Ledger {} rejected: no valid entries, {} errors", filename, diagnostics.getErrors().size());
            return LedgerParseResult.failure(diagnostics.getErrors(), diagnostics.getWarnings());
        }

        ParsedLedgerFile file = summarize(filename, entries, diagnostics);
        log.info("Ledger {} parsed: fiscalYear={}, entries={}, errors={}, warnings={}, balanced={}",
            filename, file.getFiscalYear(), file.getEntryCount(), diagnostics.getErrors().size(),
            diagnostics.getWarnings().size(), file.isBalanced());
        return LedgerParseResult.success(file, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    private ParsedLedgerFile summarize(String filename, List<LedgerEntry> entries, ParseDiagnostics diagnostics) {
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            totalDebit = totalDebit.add(entry.getDebit());
            totalCredit = totalCredit.add(entry.getCredit());
        }

        LocalDate startDate = entries.stream().map(LedgerEntry::getEntryDate)
            .min(Comparator.naturalOrder()).orElseThrow();
        LocalDate endDate = entries.stream().map(LedgerEntry::getEntryDate)
            .max(Comparator.naturalOrder()).orElseThrow();

        BigDecimal difference = totalDebit.subtract(totalCredit);
        boolean balanced = difference.abs().compareTo(balanceTolerance) < 0;
        if (!balanced) {
            diagnostics.warning(String.format(Locale.ROOT,
                "File is not balanced: Total Debit = %.2f, Total Credit = %.2f, Difference = %.2f",
                totalDebit, totalCredit, difference));
            log.warn("Ledger {} is not balanced: debit={}, credit={}, difference={}",
                filename, totalDebit, totalCredit, difference);
        }

        return ParsedLedgerFile.builder()
            .filename(filename)
            .fiscalYear(fiscalYearLabel(startDate, endDate))
            .sourceYear(sourceYear(filename))
            .startDate(startDate)
            .endDate(endDate)
            .entries(List.copyOf(entries))
            .entryCount(entries.size())
            .totalDebit(totalDebit)
            .totalCredit(totalCredit)
            .balanced(balanced)
            .build();
    }

    static boolean isXml(String content) {
        return content.stripLeading().startsWith("<");
    }

    static String fiscalYearLabel(LocalDate startDate, LocalDate endDate) {
        if (startDate.getYear() == endDate.getYear()) {
            return String.valueOf(startDate.getYear());
        }
        return startDate.getYear() + "/" + endDate.getYear();
    }

    static Integer sourceYear(String filename) {
        if (filename == null) {
            return null;
        }
        Matcher matcher = SOURCE_YEAR.matcher(filename);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
