package com.flagship.fec_diligence.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One journal line of a FEC ledger.
 *
 * Immutable once parsed. Debit and credit are non-negative; a line normally carries
 * a value on exactly one side.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    String journalCode;
    String journalLabel;
    String entryNumber;
    LocalDate entryDate;
    String accountNumber;
    String accountLabel;
    String auxiliaryAccountNumber;
    String auxiliaryAccountLabel;
    String pieceReference;
    LocalDate pieceDate;
    String entryLabel;
    @Builder.Default
    BigDecimal debit = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal credit = BigDecimal.ZERO;
    String letteringCode;
    LocalDate letteringDate;
    LocalDate validationDate;
    BigDecimal foreignAmount;
    String foreignCurrency;

    /**
     * Debit minus credit.
     */
    public BigDecimal netAmount() {
        return debit.subtract(credit);
    }

    public boolean hasAuxiliaryAccount() {
        return auxiliaryAccountNumber != null && !auxiliaryAccountNumber.isBlank();
    }

    public boolean isOnAccount(String prefix) {
        return accountNumber != null && accountNumber.startsWith(prefix);
    }
}
