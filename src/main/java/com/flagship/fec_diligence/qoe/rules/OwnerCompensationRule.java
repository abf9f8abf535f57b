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
import java.util.Locale;

/**
 * Director remuneration compared to a market benchmark. Only the excess over the
 * benchmark is proposed as an add-back; a below-market package yields a zero impact.
 */
@Component
@Order(3)
public class OwnerCompensationRule implements AdjustmentDetectionRule {

    private final BigDecimal benchmark;
    private final BigDecimal materiality;

    @Autowired
    public OwnerCompensationRule(
            @Value("${fec.qoe.owner-compensation.benchmark:80000}") BigDecimal benchmark,
            @Value("${fec.qoe.owner-compensation.materiality:10000}") BigDecimal materiality) {
        this.benchmark = benchmark;
        this.materiality = materiality;
    }

    public OwnerCompensationRule() {
        this(BigDecimal.valueOf(80000), BigDecimal.valueOf(10000));
    }

    @Override
    public String name() {
        return "Owner compensation";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.OWNER_COMPENSATION;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.MEDIUM;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        List<LedgerEntry> remuneration =
            LedgerAggregations.filterByPrefixes(entries, AccountGroups.REMUNERATION_DIRIGEANTS);
        BigDecimal total = RuleSupport.netDebit(remuneration);
        if (total.signum() <= 0) {
            return List.of();
        }

        BigDecimal gap = total.subtract(benchmark);
        if (!Amounts.exceeds(gap, materiality)) {
            return List.of();
        }

        return List.of(suggestion()
            .label("Rémunération dirigeant")
            .description(String.format(Locale.FRANCE,
                "Rémunération actuelle: %,.0f€. À comparer au taux marché (~%,.0f€)", total, benchmark))
            .impactEbitda(gap.max(BigDecimal.ZERO))
            .relatedAccounts(RuleSupport.distinctAccounts(remuneration))
            .entries(remuneration)
            .build());
    }
}
