package com.flagship.fec_diligence.cashflow;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class QualityOfDebt {
    LocalDate date;
    BigDecimal grossCash;
    List<AdjustmentItem> cashAdjustments;
    BigDecimal adjustedCash;
    BigDecimal grossDebt;
    List<AdjustmentItem> debtAdjustments;
    BigDecimal adjustedDebt;
    BigDecimal netCashDebt;
    BigDecimal adjustedNetCashDebt;
}
