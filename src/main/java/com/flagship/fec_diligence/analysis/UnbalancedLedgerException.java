package com.flagship.fec_diligence.analysis;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Thrown when total debit and total credit of a ledger differ by more than the
 * configured maximum imbalance.
 */
@Getter
public class UnbalancedLedgerException extends RuntimeException {

    private final String filename;
    private final BigDecimal imbalance;
    private final BigDecimal maxImbalance;

    public UnbalancedLedgerException(String filename, BigDecimal imbalance, BigDecimal maxImbalance) {
        super(String.format(Locale.ROOT, "Ledger %s is unbalanced by %.2f (maximum allowed %.2f)",
            filename, imbalance, maxImbalance));
        this.filename = filename;
        this.imbalance = imbalance;
        this.maxImbalance = maxImbalance;
    }
}
