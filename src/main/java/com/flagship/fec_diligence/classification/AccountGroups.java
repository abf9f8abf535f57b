package com.flagship.fec_diligence.classification;

import java.util.List;

/**
 * Curated account lists used by specific analyses (sub-contracting carve-out, QoE rules).
 */
public final class AccountGroups {

    public static final List<String> SOUS_TRAITANCE = List.of("611");

    public static final List<String> REMUNERATION_DIRIGEANTS = List.of("641", "6411", "6413");

    public static final List<String> INTERCOMPANY = List.of("451", "455", "458");

    public static final List<String> BAD_DEBT = List.of("491", "654", "6714");

    public static final List<String> PROFESSIONAL_FEES = List.of("6226", "6227");

    public static final List<String> NON_RECURRING = List.of(
        "67",   // Charges exceptionnelles
        "77",   // Produits exceptionnels
        "6712", // Pénalités et amendes
        "6713", // Dons et mécénat
        "6714", // Créances devenues irrécouvrables
        "6717", // Rappels d'impôts
        "6718", // Autres charges exceptionnelles sur opérations de gestion
        "675",  // VNC des éléments d'actif cédés
        "678",  // Autres charges exceptionnelles
        "7713", // Libéralités reçues
        "7714", // Rentrées sur créances amorties
        "7718", // Autres produits exceptionnels sur opérations de gestion
        "775",  // Produits des cessions d'éléments d'actif
        "778"   // Autres produits exceptionnels
    );

    public static final String EN_COURS_SERVICES = "34";

    public static final String FACTURES_A_ETABLIR = "418";

    public static final String PRODUITS_CESSIONS_ACTIFS = "775";

    private AccountGroups() {
        // Constants holder
    }

    public static boolean matchesAny(String accountNumber, List<String> prefixes) {
        if (accountNumber == null) {
            return false;
        }
        for (String prefix : prefixes) {
            if (accountNumber.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
