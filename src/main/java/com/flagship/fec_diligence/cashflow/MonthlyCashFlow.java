package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * variationBfr is zero for the first month, which has no previous month-end to compare with.
 */
@Value
public class MonthlyCashFlow {
    YearMonth month;
    BigDecimal ebitda;
    BigDecimal variationBfr;
    BigDecimal fcf;
    BigDecimal tresorerieFinMois;
}
