package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.AccountGroups;
import com.flagship.fec_diligence.classification.PnlSection;

import java.util.List;
import java.util.Optional;

import static com.flagship.fec_diligence.pnl.PnlLineDefinition.expense;
import static com.flagship.fec_diligence.pnl.PnlLineDefinition.revenue;
import static com.flagship.fec_diligence.pnl.PnlLineDefinition.subtotal;
import static com.flagship.fec_diligence.pnl.PnlLineDefinition.total;

/**
 * Production-based P&L layout used for French service and trading companies.
 */
final class PnlStructure {

    static final List<PnlLineDefinition> LINES = List.of(
        revenue("CA", "Chiffre d'affaires", PnlSection.CHIFFRE_AFFAIRES, 0, "70", "72", "74"),
        revenue("VAR_EC", "Variation de stocks et en-cours", PnlSection.VARIATION_ENCOURS, 0, "71"),
        subtotal("PROD", "Production", PnlSection.PRODUCTION),
        expense("ACH", "Achats consommés (marchandises, matières)", PnlSection.ACHATS_CONSOMMES, 0, "60"),
        expense("ST", "Sous-traitance", PnlSection.SOUS_TRAITANCE, 1,
            AccountGroups.SOUS_TRAITANCE.toArray(String[]::new)),
        subtotal("MCD", "Marge sur coûts directs", PnlSection.MARGE_COUTS_DIRECTS),
        expense("AACE", "Autres achats et charges externes", PnlSection.AUTRES_ACHATS, 0),
        expense("IT", "Impôts et taxes", PnlSection.IMPOTS_TAXES, 0, "63"),
        expense("PERS", "Charges de personnel", PnlSection.CHARGES_PERSONNEL, 0, "64"),
        expense("ACGC", "Autres charges / produits de gestion", PnlSection.AUTRES_CHARGES_GESTION, 0),
        subtotal("EBITDA", "EBITDA", PnlSection.EBITDA),
        expense("DAP", "Dotations aux amortissements et provisions", PnlSection.DOTATIONS_AMORTISSEMENTS, 0),
        subtotal("REX", "Résultat d'exploitation", PnlSection.RESULTAT_EXPLOITATION),
        revenue("PF", "Produits financiers", PnlSection.PRODUITS_FINANCIERS, 1, "76"),
        expense("CF", "Charges financières", PnlSection.CHARGES_FINANCIERES, 1, "66"),
        subtotal("RFIN", "Résultat financier", PnlSection.RESULTAT_FINANCIER),
        subtotal("RCAI", "Résultat courant avant impôts", PnlSection.RESULTAT_COURANT),
        revenue("PEXC", "Produits exceptionnels", PnlSection.PRODUITS_EXCEPTIONNELS, 1, "77"),
        expense("CEXC", "Charges exceptionnelles", PnlSection.CHARGES_EXCEPTIONNELLES, 1, "67"),
        subtotal("REXC", "Résultat exceptionnel", PnlSection.RESULTAT_EXCEPTIONNEL),
        expense("PART", "Participation des salariés", PnlSection.PARTICIPATION_SALARIES, 1, "691"),
        expense("IS", "Impôt sur les sociétés", PnlSection.IMPOT_SOCIETES, 1, "695", "696", "697", "698", "699"),
        total("RN", "Résultat net", PnlSection.RESULTAT_NET)
    );

    static final List<NettingRule> NETTING_RULES = List.of(
        new NettingRule(PnlSection.AUTRES_ACHATS, List.of("61", "62"), AccountGroups.SOUS_TRAITANCE, false),
        new NettingRule(PnlSection.DOTATIONS_AMORTISSEMENTS, List.of("68"), List.of("78"), true),
        new NettingRule(PnlSection.AUTRES_CHARGES_GESTION, List.of("65"), List.of("75"), true)
    );

    private PnlStructure() {
    }

    static Optional<PnlLineDefinition> definitionOf(PnlSection section) {
        return LINES.stream().filter(line -> line.getSection() == section).findFirst();
    }

    static Optional<NettingRule> nettingRuleOf(PnlSection section) {
        return NETTING_RULES.stream().filter(rule -> rule.getSection() == section).findFirst();
    }
}
