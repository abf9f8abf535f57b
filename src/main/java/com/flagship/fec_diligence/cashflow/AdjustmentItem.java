package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A caller-supplied correction to the cash or debt position (trapped cash, debt-like item...).
 */
@Value
public class AdjustmentItem {
    String label;
    BigDecimal amount;
}
