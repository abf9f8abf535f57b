package com.flagship.fec_diligence.qoe.rules;

import com.flagship.fec_diligence.classification.AccountGroups;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.PnlStatement;
import com.flagship.fec_diligence.qoe.AdjustmentDetectionRule;
import com.flagship.fec_diligence.qoe.AdjustmentType;
import com.flagship.fec_diligence.qoe.ConfidenceTier;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Exceptional charges (67x) and exceptional income (77x) booked on the curated
 * non-recurring accounts. Charges are added back, income is removed.
 */
@Component
@Order(1)
public class NonRecurringItemsRule implements AdjustmentDetectionRule {

    private final BigDecimal threshold;

    @Autowired
    public NonRecurringItemsRule(@Value("${fec.qoe.non-recurring.threshold:1000}") BigDecimal threshold) {
        this.threshold = threshold;
    }

    public NonRecurringItemsRule() {
        this(BigDecimal.valueOf(1000));
    }

    @Override
    public String name() {
        return "Non-recurring items";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.NON_RECURRING;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.HIGH;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        List<LedgerEntry> charges = new ArrayList<>();
        List<LedgerEntry> income = new ArrayList<>();
        for (LedgerEntry entry : entries) {
            if (!AccountGroups.matchesAny(entry.getAccountNumber(), AccountGroups.NON_RECURRING)) {
                continue;
            }
            if (entry.isOnAccount("67")) {
                charges.add(entry);
            } else if (entry.isOnAccount("77")) {
                income.add(entry);
            }
        }

        List<SuggestedAdjustment> suggestions = new ArrayList<>();

        BigDecimal chargesTotal = RuleSupport.netDebit(charges);
        if (Amounts.exceeds(chargesTotal, threshold)) {
            suggestions.add(suggestion()
                .label("Charges exceptionnelles")
                .description("Charges exceptionnelles à retraiter (pénalités, créances irrécouvrables, etc.)")
                .impactEbitda(chargesTotal)
                .relatedAccounts(RuleSupport.distinctAccounts(charges))
                .entries(charges)
                .build());
        }

        BigDecimal incomeTotal = RuleSupport.netDebit(income).negate();
        if (Amounts.exceeds(incomeTotal, threshold)) {
            suggestions.add(suggestion()
                .label("Produits exceptionnels")
                .description("Produits exceptionnels non récurrents à retraiter")
                .impactEbitda(incomeTotal.negate())
                .relatedAccounts(RuleSupport.distinctAccounts(income))
                .entries(income)
                .build());
        }
        return suggestions;
    }
}
