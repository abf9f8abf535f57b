package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class NetCashPosition {
    YearMonth month;
    BigDecimal netCash;
}
