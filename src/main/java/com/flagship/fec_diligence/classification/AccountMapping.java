package com.flagship.fec_diligence.classification;

import lombok.Value;

/**
 * One row of the chart-of-accounts classification table.
 * pnlSection and balanceSheetSection are null when the prefix has no target on that statement.
 */
@Value
public class AccountMapping {
    String accountPrefix;
    AccountCategory category;
    String label;
    PnlSection pnlSection;
    BalanceSheetSection balanceSheetSection;

    public static AccountMapping balanceSheet(String prefix, AccountCategory category, String label,
                                              BalanceSheetSection section) {
        return new AccountMapping(prefix, category, label, null, section);
    }

    public static AccountMapping pnl(String prefix, AccountCategory category, String label,
                                     PnlSection section) {
        return new AccountMapping(prefix, category, label, section, null);
    }

    public boolean matches(String accountNumber) {
        return accountNumber != null && accountNumber.startsWith(accountPrefix);
    }
}
