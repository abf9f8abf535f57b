package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;

/**
 * FCF after tax as a percentage of EBITDA; zero when EBITDA is zero.
 */
@Value
public class CashConversion {
    String fiscalYear;
    BigDecimal ebitda;
    BigDecimal fcf;
    BigDecimal conversionRate;
}
