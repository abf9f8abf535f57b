package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CashFlowLine {
    String code;
    String label;
    BigDecimal amount;
    boolean subtotal;
    boolean total;
    int indent;
}
