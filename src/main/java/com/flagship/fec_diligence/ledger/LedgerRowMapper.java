package com.flagship.fec_diligence.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the raw field values of one ledger line into a {@link LedgerEntry}.
 * Shared by the delimited and XML readers so both apply the same row rules.
 */
final class LedgerRowMapper {

    private final DateFormatOption dateFormat;

    LedgerRowMapper(DateFormatOption dateFormat) {
        this.dateFormat = dateFormat;
    }

    /**
     * @return the entry, or empty when the row is rejected (the error is recorded)
     */
    Optional<LedgerEntry> map(int line, Map<FecColumn, String> raw, ParseDiagnostics diagnostics) {
        String accountNumber = LedgerValueParser.clean(raw.get(FecColumn.COMPTE_NUM));
        if (accountNumber == null) {
            diagnostics.error(line, FecColumn.COMPTE_NUM.getHeaderName(), "", "Account number is required");
            return Optional.empty();
        }

        String rawDate = raw.get(FecColumn.ECRITURE_DATE);
        LocalDate entryDate = LedgerValueParser.parseDate(rawDate, dateFormat);
        if (entryDate == null) {
            diagnostics.error(line, FecColumn.ECRITURE_DATE.getHeaderName(), rawDate,
                "Invalid or missing entry date");
            return Optional.empty();
        }

        BigDecimal debit = amount(line, FecColumn.DEBIT, raw, diagnostics);
        BigDecimal credit = amount(line, FecColumn.CREDIT, raw, diagnostics);

        // A negative amount is a reversal: it belongs on the opposite side
        if (debit.signum() < 0) {
            diagnostics.warning(String.format("Line %d: Negative Debit %s booked as Credit", line, debit.toPlainString()));
            credit = credit.add(debit.negate());
            debit = BigDecimal.ZERO;
        }
        if (credit.signum() < 0) {
            diagnostics.warning(String.format("Line %d: Negative Credit %s booked as Debit", line, credit.toPlainString()));
            debit = debit.add(credit.negate());
            credit = BigDecimal.ZERO;
        }

        if (debit.signum() == 0 && credit.signum() == 0) {
            diagnostics.warning(String.format("Line %d: Entry has zero debit and credit", line));
        } else if (debit.signum() != 0 && credit.signum() != 0) {
            diagnostics.warning(String.format("Line %d: Entry has both debit and credit - this is unusual", line));
        }

        String foreignAmount = LedgerValueParser.clean(raw.get(FecColumn.MONTANT_DEVISE));

        return Optional.of(LedgerEntry.builder()
            .journalCode(text(raw, FecColumn.JOURNAL_CODE))
            .journalLabel(text(raw, FecColumn.JOURNAL_LIB))
            .entryNumber(text(raw, FecColumn.ECRITURE_NUM))
            .entryDate(entryDate)
            .accountNumber(accountNumber)
            .accountLabel(text(raw, FecColumn.COMPTE_LIB))
            .auxiliaryAccountNumber(LedgerValueParser.clean(raw.get(FecColumn.COMP_AUX_NUM)))
            .auxiliaryAccountLabel(LedgerValueParser.clean(raw.get(FecColumn.COMP_AUX_LIB)))
            .pieceReference(LedgerValueParser.clean(raw.get(FecColumn.PIECE_REF)))
            .pieceDate(LedgerValueParser.parseDate(raw.get(FecColumn.PIECE_DATE), dateFormat))
            .entryLabel(text(raw, FecColumn.ECRITURE_LIB))
            .debit(debit)
            .credit(credit)
            .letteringCode(LedgerValueParser.clean(raw.get(FecColumn.ECRITURE_LET)))
            .letteringDate(LedgerValueParser.parseDate(raw.get(FecColumn.DATE_LET), dateFormat))
            .validationDate(LedgerValueParser.parseDate(raw.get(FecColumn.VALID_DATE), dateFormat))
            .foreignAmount(foreignAmount != null ? LedgerValueParser.parseAmount(foreignAmount) : null)
            .foreignCurrency(LedgerValueParser.clean(raw.get(FecColumn.IDEVISE)))
            .build());
    }

    private static BigDecimal amount(int line, FecColumn column, Map<FecColumn, String> raw,
                                     ParseDiagnostics diagnostics) {
        BigDecimal value = LedgerValueParser.parseAmount(raw.get(column));
        if (value == null) {
            diagnostics.warning(String.format("Line %d: Unreadable %s amount '%s', treated as 0",
                line, column.getHeaderName(), raw.get(column)));
            return BigDecimal.ZERO;
        }
        return value;
    }

    private static String text(Map<FecColumn, String> raw, FecColumn column) {
        String value = LedgerValueParser.clean(raw.get(column));
        return value != null ? value : "";
    }
}
