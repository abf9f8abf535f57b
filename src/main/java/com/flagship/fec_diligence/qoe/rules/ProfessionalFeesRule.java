package com.flagship.fec_diligence.qoe.rules;

import com.flagship.fec_diligence.classification.AccountGroups;
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
import java.util.Locale;
import java.util.Map;

/**
 * Large legal/advisory fees (6226, 6227) whose entry label points at a one-off operation.
 */
@Component
@Order(6)
public class ProfessionalFeesRule implements AdjustmentDetectionRule {

    static final List<String> ONE_OFF_KEYWORDS =
        List.of("acquisition", "cession", "due diligence", "audit", "restructur");

    private static final int LABEL_EXCERPT_LENGTH = 50;

    private final BigDecimal threshold;

    @Autowired
    public ProfessionalFeesRule(@Value("${fec.qoe.professional-fees.threshold:10000}") BigDecimal threshold) {
        this.threshold = threshold;
    }

    public ProfessionalFeesRule() {
        this(BigDecimal.valueOf(10000));
    }

    @Override
    public String name() {
        return "One-time professional fees";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.NON_RECURRING;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.MEDIUM;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        Map<String, List<LedgerEntry>> byLabel = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            if (AccountGroups.matchesAny(entry.getAccountNumber(), AccountGroups.PROFESSIONAL_FEES)) {
                String label = entry.getEntryLabel() != null ? entry.getEntryLabel().toLowerCase(Locale.ROOT) : "";
                byLabel.computeIfAbsent(label, k -> new ArrayList<>()).add(entry);
            }
        }

        List<SuggestedAdjustment> suggestions = new ArrayList<>();
        for (Map.Entry<String, List<LedgerEntry>> group : byLabel.entrySet()) {
            String label = group.getKey();
            BigDecimal amount = RuleSupport.netDebit(group.getValue());
            if (amount.compareTo(threshold) > 0 && looksOneOff(label)) {
                String excerpt = label.length() > LABEL_EXCERPT_LENGTH ? label.substring(0, LABEL_EXCERPT_LENGTH) : label;
                suggestions.add(suggestion()
                    .label("Honoraires exceptionnels: " + excerpt)
                    .description("Frais professionnels potentiellement liés à une opération exceptionnelle")
                    .impactEbitda(amount)
                    .relatedAccounts(RuleSupport.distinctAccounts(group.getValue()))
                    .entries(group.getValue())
                    .build());
            }
        }
        return suggestions;
    }

    private static boolean looksOneOff(String label) {
        return ONE_OFF_KEYWORDS.stream().anyMatch(label::contains);
    }
}
