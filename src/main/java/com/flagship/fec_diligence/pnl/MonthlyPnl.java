package com.flagship.fec_diligence.pnl;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class MonthlyPnl {
    YearMonth month;
    BigDecimal chiffreAffaires;
    BigDecimal achatsConsommes;
    BigDecimal production;
    BigDecimal ebitda;
    BigDecimal ebitdaMargin;
}
