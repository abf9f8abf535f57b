package com.flagship.fec_diligence.classification;

/**
 * Sections of the restated balance sheet (asset / working capital / cash view).
 */
public enum BalanceSheetSection {
    // Actif
    IMMOBILISATIONS_INCORPORELLES_NET,
    IMMOBILISATIONS_CORPORELLES_NET,
    IMMOBILISATIONS_FINANCIERES,
    ACTIF_IMMOBILISE_TOTAL,
    STOCKS_MATIERES,
    STOCKS_ENCOURS,
    STOCKS_PRODUITS,
    STOCKS_MARCHANDISES,
    STOCKS_TOTAL,
    CLIENTS_NET,
    FAE_AVANCES,
    AUTRES_CREANCES,
    CHARGES_CONSTATEES_AVANCE,
    ACTIF_CIRCULANT_EXPLOITATION,
    VALEURS_MOBILIERES,
    DISPONIBILITES,
    TRESORERIE_ACTIF,
    TOTAL_ACTIF,

    // Passif
    CAPITAL_SOCIAL,
    RESERVES,
    REPORT_NOUVEAU,
    RESULTAT_EXERCICE,
    CAPITAUX_PROPRES,
    PROVISIONS_RISQUES,
    EMPRUNTS_ETABLISSEMENTS,
    EMPRUNTS_ASSOCIES,
    AUTRES_DETTES_FINANCIERES,
    DETTES_FINANCIERES_TOTAL,
    FOURNISSEURS,
    DETTES_FISCALES_SOCIALES,
    AUTRES_DETTES,
    PRODUITS_CONSTATES_AVANCE,
    PASSIF_CIRCULANT_EXPLOITATION,
    TRESORERIE_PASSIF,
    TOTAL_PASSIF
}
