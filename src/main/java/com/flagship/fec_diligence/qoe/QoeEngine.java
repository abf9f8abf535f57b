package com.flagship.fec_diligence.qoe;

import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.PnlStatement;
import com.flagship.fec_diligence.qoe.rules.AccountingMethodChangeRule;
import com.flagship.fec_diligence.qoe.rules.BadDebtRule;
import com.flagship.fec_diligence.qoe.rules.NonRecurringItemsRule;
import com.flagship.fec_diligence.qoe.rules.OwnerCompensationRule;
import com.flagship.fec_diligence.qoe.rules.ProfessionalFeesRule;
import com.flagship.fec_diligence.qoe.rules.RelatedPartyRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the battery of detection rules over one fiscal year.
 *
 * Suggestions are ordered by absolute EBITDA impact, largest first; ties keep the
 * rule order. Running twice on the same input gives the same list.
 */
@Slf4j
@Service
public class QoeEngine {

    private static final Comparator<SuggestedAdjustment> BY_ABSOLUTE_IMPACT_DESC =
        Comparator.comparing((SuggestedAdjustment s) -> s.getImpactEbitda().abs()).reversed();

    private final List<AdjustmentDetectionRule> rules;

    @Autowired
    public QoeEngine(List<AdjustmentDetectionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public QoeEngine() {
        this(List.of(
            new NonRecurringItemsRule(),
            new RelatedPartyRule(),
            new OwnerCompensationRule(),
            new AccountingMethodChangeRule(),
            new BadDebtRule(),
            new ProfessionalFeesRule()));
    }

    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        List<SuggestedAdjustment> suggestions = new ArrayList<>();
        for (AdjustmentDetectionRule rule : rules) {
            List<SuggestedAdjustment> found = rule.detect(entries, pnl);
            if (!found.isEmpty()) {
                log.debug("Rule '{}' raised {} suggestion(s)", rule.name(), found.size());
            }
            suggestions.addAll(found);
        }
        suggestions.sort(BY_ABSOLUTE_IMPACT_DESC);
        return suggestions;
    }

    public List<AdjustmentDetectionRule> getRules() {
        return rules;
    }
}
