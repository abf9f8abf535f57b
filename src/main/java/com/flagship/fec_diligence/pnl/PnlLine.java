package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.PnlSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One presented P&L line. Revenue-like lines are credit minus debit, expense-like lines
 * debit minus credit; subtotals keep their computed sign. marginPercent is only set on
 * subtotal and total lines, and is null when production is zero.
 */
@Value
@Builder
public class PnlLine {
    String code;
    String label;
    PnlSection section;
    BigDecimal amount;
    BigDecimal marginPercent;
    boolean subtotal;
    boolean total;
    int indent;
}
