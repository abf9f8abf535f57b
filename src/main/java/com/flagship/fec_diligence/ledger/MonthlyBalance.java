package com.flagship.fec_diligence.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class MonthlyBalance {
    YearMonth month;
    String accountPrefix;
    BigDecimal openingBalance;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal closingBalance;
}
