package com.flagship.fec_diligence.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class MonthlyWorkingCapital {
    YearMonth month;
    BigDecimal dso;
    BigDecimal dpo;
}
