package com.flagship.fec_diligence.qoe.rules;

import com.flagship.fec_diligence.classification.AccountGroups;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.LedgerAggregations;
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
import java.util.List;

/**
 * Doubtful-debt provisions (491) and receivable write-offs (654, 6714), added back.
 */
@Component
@Order(5)
public class BadDebtRule implements AdjustmentDetectionRule {

    private final BigDecimal threshold;

    @Autowired
    public BadDebtRule(@Value("${fec.qoe.bad-debt.threshold:5000}") BigDecimal threshold) {
        this.threshold = threshold;
    }

    public BadDebtRule() {
        this(BigDecimal.valueOf(5000));
    }

    @Override
    public String name() {
        return "Bad debt write-offs";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.BAD_DEBT;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.HIGH;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        List<LedgerEntry> provisions = LedgerAggregations.filterByPrefixes(entries, AccountGroups.BAD_DEBT);
        BigDecimal total = RuleSupport.netDebit(provisions);
        if (!Amounts.exceeds(total, threshold)) {
            return List.of();
        }
        return List.of(suggestion()
            .label("Provisions/pertes sur créances")
            .description("Dotations aux provisions pour créances douteuses et pertes sur créances")
            .impactEbitda(total)
            .relatedAccounts(RuleSupport.distinctAccounts(provisions))
            .entries(provisions)
            .build());
    }
}
