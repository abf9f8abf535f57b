package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.PnlSection;
import com.flagship.fec_diligence.ledger.LedgerAggregations;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A P&L section computed as charges net of a deduction rather than as a plain prefix sum.
 *
 * Charges are measured debit minus credit and added. Deductions are measured on their
 * own normal side and subtracted: a debit-normal deduction nested under a charge prefix
 * is a carve-out (611 inside 61), a credit-normal one is an offsetting income or
 * write-back (75 against 65, 78 against 68).
 */
@Value
public class NettingRule {
    PnlSection section;
    List<String> chargePrefixes;
    List<String> deductionPrefixes;
    boolean deductionCreditNormal;

    /**
     * Contribution of one entry to the section amount, expense-positive.
     */
    public BigDecimal contribution(LedgerEntry entry) {
        BigDecimal amount = BigDecimal.ZERO;
        if (LedgerAggregations.matchesAny(entry, chargePrefixes)) {
            amount = amount.add(entry.netAmount());
        }
        if (LedgerAggregations.matchesAny(entry, deductionPrefixes)) {
            BigDecimal deduction = deductionCreditNormal ? entry.netAmount().negate() : entry.netAmount();
            amount = amount.subtract(deduction);
        }
        return amount;
    }

    /**
     * True for an entry that matches both a charge and a deduction prefix and therefore nets out.
     */
    public boolean isCarvedOut(LedgerEntry entry) {
        return LedgerAggregations.matchesAny(entry, chargePrefixes)
            && LedgerAggregations.matchesAny(entry, deductionPrefixes);
    }

    public boolean appliesTo(LedgerEntry entry) {
        return LedgerAggregations.matchesAny(entry, chargePrefixes)
            || LedgerAggregations.matchesAny(entry, deductionPrefixes);
    }

    public BigDecimal apply(List<LedgerEntry> entries) {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            total = total.add(contribution(entry));
        }
        return total;
    }
}
