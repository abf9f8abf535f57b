package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Month-end net cash (cash - overdrafts - financial debt) over a period and its average.
 */
@Value
public class AverageNetCash {
    List<NetCashPosition> monthlyPositions;
    BigDecimal average;
}
