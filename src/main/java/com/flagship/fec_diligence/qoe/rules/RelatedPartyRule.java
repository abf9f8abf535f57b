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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group and shareholder current-account flows, grouped by counterparty.
 * Informational only: the EBITDA impact stays at zero until someone assesses it.
 */
@Component
@Order(2)
public class RelatedPartyRule implements AdjustmentDetectionRule {

    private final BigDecimal threshold;

    @Autowired
    public RelatedPartyRule(@Value("${fec.qoe.related-party.threshold:5000}") BigDecimal threshold) {
        this.threshold = threshold;
    }

    public RelatedPartyRule() {
        this(BigDecimal.valueOf(5000));
    }

    @Override
    public String name() {
        return "Related party adjustments";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.RELATED_PARTY;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.MEDIUM;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        // Counterparty = auxiliary account when present, general account otherwise
        Map<String, List<LedgerEntry>> byCounterparty = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            if (!AccountGroups.matchesAny(entry.getAccountNumber(), AccountGroups.INTERCOMPANY)) {
                continue;
            }
            String key = entry.hasAuxiliaryAccount() ? entry.getAuxiliaryAccountNumber() : entry.getAccountNumber();
            byCounterparty.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }

        List<SuggestedAdjustment> suggestions = new ArrayList<>();
        for (Map.Entry<String, List<LedgerEntry>> group : byCounterparty.entrySet()) {
            BigDecimal net = RuleSupport.netDebit(group.getValue());
            if (Amounts.exceeds(net, threshold)) {
                suggestions.add(suggestion()
                    .label("Flux groupe/associés (" + group.getKey() + ")")
                    .description("Flux avec parties liées à analyser pour normalisation")
                    .impactEbitda(BigDecimal.ZERO)
                    .relatedAccounts(RuleSupport.distinctAccounts(group.getValue()))
                    .entries(group.getValue())
                    .build());
            }
        }
        return suggestions;
    }
}
