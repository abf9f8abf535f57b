package com.flagship.fec_diligence.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance of one auxiliary (customer or supplier) account under a general-ledger account.
 */
@Value
public class AuxiliaryBalance {
    String accountNumber;
    String auxiliaryAccountNumber;
    String auxiliaryAccountLabel;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal balance;
}
