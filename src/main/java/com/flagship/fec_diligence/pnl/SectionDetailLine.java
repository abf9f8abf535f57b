package com.flagship.fec_diligence.pnl;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class SectionDetailLine {
    String accountNumber;
    String accountLabel;
    BigDecimal amount;
}
