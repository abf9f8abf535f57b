package com.flagship.fec_diligence.qoe.rules;

import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.LedgerEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class RuleSupport {

    private RuleSupport() {
        // Utility class
    }

    /**
     * Distinct account numbers in order of first appearance.
     */
    static List<String> distinctAccounts(List<LedgerEntry> entries) {
        Set<String> accounts = new LinkedHashSet<>();
        for (LedgerEntry entry : entries) {
            accounts.add(entry.getAccountNumber());
        }
        return new ArrayList<>(accounts);
    }

    static BigDecimal netDebit(List<LedgerEntry> entries) {
        return Amounts.sum(entries, LedgerEntry::netAmount);
    }
}
