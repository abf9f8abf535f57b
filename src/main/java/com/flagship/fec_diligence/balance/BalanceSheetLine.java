package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.classification.BalanceSheetSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One balance sheet line. gross and amortization are only set on fixed-asset lines.
 */
@Value
@Builder
public class BalanceSheetLine {
    String code;
    String label;
    BalanceSheetSection section;
    BigDecimal gross;
    BigDecimal amortization;
    BigDecimal net;
    boolean subtotal;
    boolean total;
    int indent;
}
