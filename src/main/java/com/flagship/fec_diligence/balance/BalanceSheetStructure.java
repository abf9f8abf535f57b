package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.classification.BalanceSheetSection;

import java.util.List;
import java.util.Optional;

/**
 * Restated balance sheet layout (fixed assets / working capital / cash).
 * Every general-ledger account of classes 1 to 5 falls in at most one line.
 */
final class BalanceSheetStructure {

    static final List<BalanceSheetLineDefinition> LINES = List.of(
        // Actif
        asset("IMMO_INC", "Immobilisations incorporelles", BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET)
            .accountPrefix("20").grossAmortization(true).build(),
        asset("IMMO_CORP", "Immobilisations corporelles", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET)
            .accountPrefix("21").accountPrefix("22").accountPrefix("23").grossAmortization(true).build(),
        asset("IMMO_FIN", "Immobilisations financières", BalanceSheetSection.IMMOBILISATIONS_FINANCIERES)
            .accountPrefix("26").accountPrefix("27").build(),
        asset("ACTIF_IMMO", "Actif immobilisé", BalanceSheetSection.ACTIF_IMMOBILISE_TOTAL)
            .subtotal(true).build(),

        asset("STOCK_MAT", "Matières premières", BalanceSheetSection.STOCKS_MATIERES)
            .accountPrefix("31").accountPrefix("32").indent(1).build(),
        asset("STOCK_EC", "En-cours de production", BalanceSheetSection.STOCKS_ENCOURS)
            .accountPrefix("33").accountPrefix("34").indent(1).build(),
        asset("STOCK_PROD", "Produits finis", BalanceSheetSection.STOCKS_PRODUITS)
            .accountPrefix("35").indent(1).build(),
        asset("STOCK_MARCH", "Marchandises", BalanceSheetSection.STOCKS_MARCHANDISES)
            .accountPrefix("37").indent(1).build(),
        asset("STOCKS", "Total stocks", BalanceSheetSection.STOCKS_TOTAL)
            .subtotal(true).build(),

        asset("CLIENTS", "Clients et comptes rattachés", BalanceSheetSection.CLIENTS_NET)
            .accountPrefix("41").accountPrefix("491").excludePrefix("4181").build(),
        asset("FAE", "FAE et avances fournisseurs", BalanceSheetSection.FAE_AVANCES)
            .accountPrefix("409").accountPrefix("4181").build(),
        asset("AUTRES_CR", "Autres créances", BalanceSheetSection.AUTRES_CREANCES)
            .accountPrefix("44").accountPrefix("45")
            .excludePrefix("444").excludePrefix("445").excludePrefix("455").build(),
        asset("CCA", "Charges constatées d'avance", BalanceSheetSection.CHARGES_CONSTATEES_AVANCE)
            .accountPrefix("486").build(),
        asset("AC_EXPL", "Actif circulant d'exploitation", BalanceSheetSection.ACTIF_CIRCULANT_EXPLOITATION)
            .subtotal(true).build(),

        asset("VMP", "Valeurs mobilières de placement", BalanceSheetSection.VALEURS_MOBILIERES)
            .accountPrefix("50").build(),
        asset("DISPO", "Disponibilités", BalanceSheetSection.DISPONIBILITES)
            .accountPrefix("51").accountPrefix("53").excludePrefix("519").build(),
        asset("TRESO_ACTIF", "Trésorerie active", BalanceSheetSection.TRESORERIE_ACTIF)
            .subtotal(true).build(),
        asset("TOTAL_ACTIF", "TOTAL ACTIF", BalanceSheetSection.TOTAL_ACTIF)
            .total(true).build(),

        // Passif
        liability("CAPITAL", "Capital social", BalanceSheetSection.CAPITAL_SOCIAL)
            .accountPrefix("101").accountPrefix("104").accountPrefix("108").build(),
        liability("RESERVES", "Réserves", BalanceSheetSection.RESERVES)
            .accountPrefix("105").accountPrefix("106").build(),
        liability("RAN", "Report à nouveau", BalanceSheetSection.REPORT_NOUVEAU)
            .accountPrefix("11").build(),
        liability("RESULTAT", "Résultat de l'exercice", BalanceSheetSection.RESULTAT_EXERCICE)
            .accountPrefix("12").build(),
        liability("CP", "Capitaux propres", BalanceSheetSection.CAPITAUX_PROPRES)
            .subtotal(true).build(),

        liability("PROV", "Provisions pour risques et charges", BalanceSheetSection.PROVISIONS_RISQUES)
            .accountPrefix("15").build(),

        liability("EMPR_EC", "Emprunts auprès des établissements de crédit",
            BalanceSheetSection.EMPRUNTS_ETABLISSEMENTS)
            .accountPrefix("164").indent(1).build(),
        liability("EMPR_ASS", "Emprunts et dettes auprès des associés", BalanceSheetSection.EMPRUNTS_ASSOCIES)
            .accountPrefix("455").accountPrefix("168").indent(1).build(),
        liability("AUTRES_DF", "Autres emprunts et dettes financières",
            BalanceSheetSection.AUTRES_DETTES_FINANCIERES)
            .accountPrefix("16").accountPrefix("17").excludePrefix("164").excludePrefix("168").indent(1).build(),
        liability("DETTES_FIN", "Dettes financières", BalanceSheetSection.DETTES_FINANCIERES_TOTAL)
            .subtotal(true).build(),

        liability("FRS", "Fournisseurs et comptes rattachés", BalanceSheetSection.FOURNISSEURS)
            .accountPrefix("40").excludePrefix("409").build(),
        liability("DETTES_FS", "Dettes fiscales et sociales", BalanceSheetSection.DETTES_FISCALES_SOCIALES)
            .accountPrefix("42").accountPrefix("43").accountPrefix("444").accountPrefix("445").build(),
        liability("AUTRES_DETTES", "Autres dettes", BalanceSheetSection.AUTRES_DETTES)
            .accountPrefix("46").accountPrefix("47").build(),
        liability("PCA", "Produits constatés d'avance", BalanceSheetSection.PRODUITS_CONSTATES_AVANCE)
            .accountPrefix("487").build(),
        liability("PC_EXPL", "Passif circulant d'exploitation", BalanceSheetSection.PASSIF_CIRCULANT_EXPLOITATION)
            .subtotal(true).build(),

        liability("TRESO_PASSIF", "Concours bancaires courants", BalanceSheetSection.TRESORERIE_PASSIF)
            .accountPrefix("519").build(),
        liability("TOTAL_PASSIF", "TOTAL PASSIF", BalanceSheetSection.TOTAL_PASSIF)
            .total(true).build()
    );

    private BalanceSheetStructure() {
    }

    /**
     * The line an account is summed into, contra accounts of fixed assets included.
     * Empty for accounts the restated balance sheet leaves out (13, 14, 18, 39...).
     */
    static Optional<BalanceSheetSection> sectionOf(String accountNumber) {
        for (BalanceSheetLineDefinition definition : LINES) {
            if (definition.isCalculated()) {
                continue;
            }
            if (startsWithAny(accountNumber, definition.getAccountPrefixes())
                    && !startsWithAny(accountNumber, definition.getExcludePrefixes())) {
                return Optional.of(definition.getSection());
            }
            if (definition.isGrossAmortization()
                    && startsWithAny(accountNumber, FixedAssetPairing.contraPrefixesOf(definition.getAccountPrefixes()))) {
                return Optional.of(definition.getSection());
            }
        }
        return Optional.empty();
    }

    private static boolean startsWithAny(String accountNumber, List<String> prefixes) {
        return prefixes.stream().anyMatch(accountNumber::startsWith);
    }

    private static BalanceSheetLineDefinition.BalanceSheetLineDefinitionBuilder asset(
            String code, String label, BalanceSheetSection section) {
        return BalanceSheetLineDefinition.builder().code(code).label(label).section(section).debitNormal(true);
    }

    private static BalanceSheetLineDefinition.BalanceSheetLineDefinitionBuilder liability(
            String code, String label, BalanceSheetSection section) {
        return BalanceSheetLineDefinition.builder().code(code).label(label).section(section).debitNormal(false);
    }
}
