package com.flagship.fec_diligence.classification;

/**
 * Sections of the restated P&L (production-based presentation).
 */
public enum PnlSection {
    CHIFFRE_AFFAIRES,
    VARIATION_ENCOURS,
    PRODUCTION,
    ACHATS_CONSOMMES,
    SOUS_TRAITANCE,
    MARGE_COUTS_DIRECTS,
    SERVICES_EXTERIEURS,
    AUTRES_ACHATS,
    IMPOTS_TAXES,
    CHARGES_PERSONNEL,
    AUTRES_CHARGES_GESTION,
    EBITDA,
    DOTATIONS_AMORTISSEMENTS,
    RESULTAT_EXPLOITATION,
    PRODUITS_FINANCIERS,
    CHARGES_FINANCIERES,
    RESULTAT_FINANCIER,
    RESULTAT_COURANT,
    PRODUITS_EXCEPTIONNELS,
    CHARGES_EXCEPTIONNELLES,
    RESULTAT_EXCEPTIONNEL,
    PARTICIPATION_SALARIES,
    IMPOT_SOCIETES,
    RESULTAT_NET
}
