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
import java.util.ArrayList;
import java.util.List;

/**
 * Significant work-in-progress on services (34) with almost no invoices-to-issue (418)
 * hints at a completed-contract revenue method. Needs investigation, so no impact.
 */
@Component
@Order(4)
public class AccountingMethodChangeRule implements AdjustmentDetectionRule {

    private final BigDecimal enCoursThreshold;
    private final BigDecimal faeCeiling;

    @Autowired
    public AccountingMethodChangeRule(
            @Value("${fec.qoe.method-change.encours-threshold:50000}") BigDecimal enCoursThreshold,
            @Value("${fec.qoe.method-change.fae-ceiling:1000}") BigDecimal faeCeiling) {
        this.enCoursThreshold = enCoursThreshold;
        this.faeCeiling = faeCeiling;
    }

    public AccountingMethodChangeRule() {
        this(BigDecimal.valueOf(50000), BigDecimal.valueOf(1000));
    }

    @Override
    public String name() {
        return "Accounting method changes";
    }

    @Override
    public AdjustmentType type() {
        return AdjustmentType.ACCOUNTING_METHOD_CHANGE;
    }

    @Override
    public ConfidenceTier confidence() {
        return ConfidenceTier.LOW;
    }

    @Override
    public List<SuggestedAdjustment> detect(List<LedgerEntry> entries, PnlStatement pnl) {
        List<LedgerEntry> enCours = LedgerAggregations.filterByPrefix(entries, AccountGroups.EN_COURS_SERVICES);
        List<LedgerEntry> fae = LedgerAggregations.filterByPrefix(entries, AccountGroups.FACTURES_A_ETABLIR);

        BigDecimal enCoursBalance = RuleSupport.netDebit(enCours);
        BigDecimal faeBalance = RuleSupport.netDebit(fae);

        boolean significantEnCours = Amounts.exceeds(enCoursBalance, enCoursThreshold);
        boolean negligibleFae = faeBalance.abs().compareTo(faeCeiling) < 0;
        if (!significantEnCours || !negligibleFae) {
            return List.of();
        }

        List<LedgerEntry> touched = new ArrayList<>(enCours);
        touched.addAll(fae);
        return List.of(suggestion()
            .label("Méthode comptable en-cours/FAE")
            .description("Présence d'en-cours significatifs sans FAE - vérifier la méthode de reconnaissance du CA")
            .impactEbitda(BigDecimal.ZERO)
            .relatedAccount(AccountGroups.EN_COURS_SERVICES)
            .relatedAccount(AccountGroups.FACTURES_A_ETABLIR)
            .entries(touched)
            .build());
    }
}
