package com.flagship.fec_diligence.classification;

/**
 * Semantic category of a PCG account prefix.
 */
public enum AccountCategory {
    // Classe 1
    CAPITAL,
    RESERVES,
    RESULTAT,
    SUBVENTIONS,
    PROVISIONS_REGLEMENTEES,
    PROVISIONS_RISQUES,
    EMPRUNTS,
    DETTES_RATTACHEES,
    COMPTES_LIAISON,

    // Classe 2
    IMMOBILISATIONS_INCORPORELLES,
    IMMOBILISATIONS_CORPORELLES,
    IMMOBILISATIONS_FINANCIERES,
    AMORTISSEMENTS,
    DEPRECIATIONS_IMMOBILISATIONS,

    // Classe 3
    STOCKS_MATIERES,
    STOCKS_ENCOURS,
    STOCKS_PRODUITS,
    STOCKS_MARCHANDISES,
    DEPRECIATIONS_STOCKS,

    // Classe 4
    FOURNISSEURS,
    CLIENTS,
    PERSONNEL,
    SECURITE_SOCIALE,
    ETAT_IMPOTS,
    GROUPE_ASSOCIES,
    DEBITEURS_CREDITEURS_DIVERS,
    COMPTES_TRANSITOIRES,
    CHARGES_CONSTATEES_AVANCE,
    DEPRECIATIONS_COMPTES_TIERS,

    // Classe 5
    VALEURS_MOBILIERES,
    BANQUES,
    CAISSE,

    // Classe 6
    ACHATS_STOCKES,
    SERVICES_EXTERIEURS,
    AUTRES_SERVICES_EXTERIEURS,
    IMPOTS_TAXES,
    CHARGES_PERSONNEL,
    AUTRES_CHARGES_GESTION,
    CHARGES_FINANCIERES,
    CHARGES_EXCEPTIONNELLES,
    DOTATIONS_AMORTISSEMENTS,
    PARTICIPATION_IMPOT,

    // Classe 7
    VENTES_PRODUITS,
    PRODUCTION_STOCKEE,
    PRODUCTION_IMMOBILISEE,
    PRODUITS_ANNEXES,
    PRODUITS_FINANCIERS,
    PRODUITS_EXCEPTIONNELS,
    REPRISES_PROVISIONS,
    TRANSFERTS_CHARGES
}
