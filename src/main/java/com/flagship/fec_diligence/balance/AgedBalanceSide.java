package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.ledger.LedgerEntry;

import java.math.BigDecimal;

/**
 * Which third-party ledger an aged balance is built on.
 */
public enum AgedBalanceSide {
    CLIENTS("41", true),
    FOURNISSEURS("40", false);

    private final String accountPrefix;
    private final boolean debitNormal;

    AgedBalanceSide(String accountPrefix, boolean debitNormal) {
        this.accountPrefix = accountPrefix;
        this.debitNormal = debitNormal;
    }

    public String getAccountPrefix() {
        return accountPrefix;
    }

    BigDecimal signedAmount(LedgerEntry entry) {
        return debitNormal ? entry.netAmount() : entry.netAmount().negate();
    }
}
