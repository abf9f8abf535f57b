package com.flagship.fec_diligence.ledger;

import com.flagship.fec_diligence.classification.AccountCategory;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Cumulated movements of one general-ledger account. balance is debit minus credit;
 * category is null for accounts outside the classification table.
 */
@Value
public class AccountBalance {
    String accountNumber;
    String accountLabel;
    AccountCategory category;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal balance;
    int entryCount;
}
