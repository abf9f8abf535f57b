package com.flagship.fec_diligence.classification;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.flagship.fec_diligence.classification.AccountCategory.*;
import static com.flagship.fec_diligence.classification.AccountMapping.balanceSheet;
import static com.flagship.fec_diligence.classification.AccountMapping.pnl;

/**
 * Plan Comptable Général classification table.
 *
 * Maps account-number prefixes to a semantic category and, where relevant, to a
 * P&L or balance sheet section. When several prefixes match an account number the
 * longest one wins. Balance sheet accounts left out of the restated balance sheet have
 * no section.
 *
 * The table is process-wide constant configuration: it is built once and never
 * mutated, so a single instance is safely shared by every engine.
 */
@Component
public class AccountClassificationTable {

    private static final List<AccountMapping> PCG_MAPPINGS = List.of(
        // Classe 1 - Capitaux
        balanceSheet("10", CAPITAL, "Capital et réserves", null),
        balanceSheet("101", CAPITAL, "Capital", BalanceSheetSection.CAPITAL_SOCIAL),
        balanceSheet("104", CAPITAL, "Primes liées au capital", BalanceSheetSection.CAPITAL_SOCIAL),
        balanceSheet("105", AccountCategory.RESERVES, "Écarts de réévaluation", BalanceSheetSection.RESERVES),
        balanceSheet("106", AccountCategory.RESERVES, "Réserves", BalanceSheetSection.RESERVES),
        balanceSheet("108", CAPITAL, "Compte de l'exploitant", BalanceSheetSection.CAPITAL_SOCIAL),
        balanceSheet("11", AccountCategory.RESERVES, "Report à nouveau", BalanceSheetSection.REPORT_NOUVEAU),
        balanceSheet("12", RESULTAT, "Résultat de l'exercice", BalanceSheetSection.RESULTAT_EXERCICE),
        balanceSheet("13", SUBVENTIONS, "Subventions d'investissement", null),
        balanceSheet("14", PROVISIONS_REGLEMENTEES, "Provisions réglementées", null),
        balanceSheet("15", AccountCategory.PROVISIONS_RISQUES, "Provisions pour risques et charges", BalanceSheetSection.PROVISIONS_RISQUES),
        balanceSheet("16", EMPRUNTS, "Emprunts et dettes assimilées", BalanceSheetSection.AUTRES_DETTES_FINANCIERES),
        balanceSheet("164", EMPRUNTS, "Emprunts auprès des établissements de crédit", BalanceSheetSection.EMPRUNTS_ETABLISSEMENTS),
        balanceSheet("168", EMPRUNTS, "Autres emprunts et dettes assimilées", BalanceSheetSection.EMPRUNTS_ASSOCIES),
        balanceSheet("17", DETTES_RATTACHEES, "Dettes rattachées à des participations", BalanceSheetSection.AUTRES_DETTES_FINANCIERES),
        balanceSheet("18", COMPTES_LIAISON, "Comptes de liaison", null),

        // Classe 2 - Immobilisations
        balanceSheet("20", IMMOBILISATIONS_INCORPORELLES, "Immobilisations incorporelles", BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET),
        balanceSheet("21", IMMOBILISATIONS_CORPORELLES, "Immobilisations corporelles", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET),
        balanceSheet("22", IMMOBILISATIONS_CORPORELLES, "Immobilisations mises en concession", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET),
        balanceSheet("23", IMMOBILISATIONS_CORPORELLES, "Immobilisations en cours", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET),
        balanceSheet("26", IMMOBILISATIONS_FINANCIERES, "Participations", BalanceSheetSection.IMMOBILISATIONS_FINANCIERES),
        balanceSheet("27", IMMOBILISATIONS_FINANCIERES, "Autres immobilisations financières", BalanceSheetSection.IMMOBILISATIONS_FINANCIERES),
        // Contra accounts are netted into the line of the asset they amortize
        balanceSheet("28", AMORTISSEMENTS, "Amortissements des immobilisations", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET),
        balanceSheet("280", AMORTISSEMENTS, "Amortissements des immobilisations incorporelles", BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET),
        balanceSheet("29", DEPRECIATIONS_IMMOBILISATIONS, "Dépréciations des immobilisations", BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET),
        balanceSheet("290", DEPRECIATIONS_IMMOBILISATIONS, "Dépréciations des immobilisations incorporelles", BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET),

        // Classe 3 - Stocks
        balanceSheet("31", AccountCategory.STOCKS_MATIERES, "Matières premières", BalanceSheetSection.STOCKS_MATIERES),
        balanceSheet("32", AccountCategory.STOCKS_MATIERES, "Autres approvisionnements", BalanceSheetSection.STOCKS_MATIERES),
        balanceSheet("33", AccountCategory.STOCKS_ENCOURS, "En-cours de production de biens", BalanceSheetSection.STOCKS_ENCOURS),
        balanceSheet("34", AccountCategory.STOCKS_ENCOURS, "En-cours de production de services", BalanceSheetSection.STOCKS_ENCOURS),
        balanceSheet("35", AccountCategory.STOCKS_PRODUITS, "Stocks de produits", BalanceSheetSection.STOCKS_PRODUITS),
        balanceSheet("37", AccountCategory.STOCKS_MARCHANDISES, "Stocks de marchandises", BalanceSheetSection.STOCKS_MARCHANDISES),
        balanceSheet("39", DEPRECIATIONS_STOCKS, "Dépréciations des stocks", null),

        // Classe 4 - Tiers
        balanceSheet("40", AccountCategory.FOURNISSEURS, "Fournisseurs et comptes rattachés", BalanceSheetSection.FOURNISSEURS),
        balanceSheet("409", AccountCategory.FOURNISSEURS, "Fournisseurs débiteurs", BalanceSheetSection.FAE_AVANCES),
        balanceSheet("41", CLIENTS, "Clients et comptes rattachés", BalanceSheetSection.CLIENTS_NET),
        balanceSheet("4181", CLIENTS, "Clients - factures à établir", BalanceSheetSection.FAE_AVANCES),
        balanceSheet("42", PERSONNEL, "Personnel et comptes rattachés", BalanceSheetSection.DETTES_FISCALES_SOCIALES),
        balanceSheet("43", SECURITE_SOCIALE, "Sécurité sociale et organismes sociaux", BalanceSheetSection.DETTES_FISCALES_SOCIALES),
        balanceSheet("44", ETAT_IMPOTS, "État et collectivités publiques", BalanceSheetSection.AUTRES_CREANCES),
        balanceSheet("444", ETAT_IMPOTS, "État - impôts sur les bénéfices", BalanceSheetSection.DETTES_FISCALES_SOCIALES),
        balanceSheet("445", ETAT_IMPOTS, "État - taxes sur le chiffre d'affaires", BalanceSheetSection.DETTES_FISCALES_SOCIALES),
        balanceSheet("45", GROUPE_ASSOCIES, "Groupe et associés", BalanceSheetSection.AUTRES_CREANCES),
        balanceSheet("455", GROUPE_ASSOCIES, "Associés - comptes courants", BalanceSheetSection.EMPRUNTS_ASSOCIES),
        balanceSheet("46", DEBITEURS_CREDITEURS_DIVERS, "Débiteurs et créditeurs divers", BalanceSheetSection.AUTRES_DETTES),
        balanceSheet("47", COMPTES_TRANSITOIRES, "Comptes transitoires", BalanceSheetSection.AUTRES_DETTES),
        balanceSheet("48", AccountCategory.CHARGES_CONSTATEES_AVANCE, "Comptes de régularisation", null),
        balanceSheet("486", AccountCategory.CHARGES_CONSTATEES_AVANCE, "Charges constatées d'avance", BalanceSheetSection.CHARGES_CONSTATEES_AVANCE),
        balanceSheet("487", AccountCategory.CHARGES_CONSTATEES_AVANCE, "Produits constatés d'avance", BalanceSheetSection.PRODUITS_CONSTATES_AVANCE),
        balanceSheet("49", DEPRECIATIONS_COMPTES_TIERS, "Dépréciations des comptes de tiers", null),
        balanceSheet("491", DEPRECIATIONS_COMPTES_TIERS, "Dépréciations des comptes clients", BalanceSheetSection.CLIENTS_NET),

        // Classe 5 - Financiers
        balanceSheet("50", AccountCategory.VALEURS_MOBILIERES, "Valeurs mobilières de placement", BalanceSheetSection.VALEURS_MOBILIERES),
        balanceSheet("51", BANQUES, "Banques, établissements financiers", BalanceSheetSection.DISPONIBILITES),
        balanceSheet("519", BANQUES, "Concours bancaires courants", BalanceSheetSection.TRESORERIE_PASSIF),
        balanceSheet("52", BANQUES, "Instruments de trésorerie", null),
        balanceSheet("53", CAISSE, "Caisse", BalanceSheetSection.DISPONIBILITES),
        balanceSheet("58", BANQUES, "Virements internes", null),
        balanceSheet("59", DEPRECIATIONS_COMPTES_TIERS, "Dépréciations des VMP", null),

        // Classe 6 - Charges
        pnl("60", ACHATS_STOCKES, "Achats", PnlSection.ACHATS_CONSOMMES),
        pnl("61", AccountCategory.SERVICES_EXTERIEURS, "Services extérieurs", PnlSection.AUTRES_ACHATS),
        pnl("611", AccountCategory.SERVICES_EXTERIEURS, "Sous-traitance générale", PnlSection.SOUS_TRAITANCE),
        pnl("62", AUTRES_SERVICES_EXTERIEURS, "Autres services extérieurs", PnlSection.AUTRES_ACHATS),
        pnl("63", AccountCategory.IMPOTS_TAXES, "Impôts, taxes et versements assimilés", PnlSection.IMPOTS_TAXES),
        pnl("64", AccountCategory.CHARGES_PERSONNEL, "Charges de personnel", PnlSection.CHARGES_PERSONNEL),
        pnl("65", AccountCategory.AUTRES_CHARGES_GESTION, "Autres charges de gestion courante", PnlSection.AUTRES_CHARGES_GESTION),
        pnl("66", AccountCategory.CHARGES_FINANCIERES, "Charges financières", PnlSection.CHARGES_FINANCIERES),
        pnl("67", AccountCategory.CHARGES_EXCEPTIONNELLES, "Charges exceptionnelles", PnlSection.CHARGES_EXCEPTIONNELLES),
        pnl("68", AccountCategory.DOTATIONS_AMORTISSEMENTS, "Dotations aux amortissements et provisions", PnlSection.DOTATIONS_AMORTISSEMENTS),
        pnl("69", PARTICIPATION_IMPOT, "Participation et impôt sur les bénéfices", PnlSection.IMPOT_SOCIETES),
        pnl("691", PARTICIPATION_IMPOT, "Participation des salariés", PnlSection.PARTICIPATION_SALARIES),

        // Classe 7 - Produits
        pnl("70", VENTES_PRODUITS, "Ventes de produits et prestations", PnlSection.CHIFFRE_AFFAIRES),
        pnl("71", PRODUCTION_STOCKEE, "Production stockée", PnlSection.VARIATION_ENCOURS),
        pnl("72", PRODUCTION_IMMOBILISEE, "Production immobilisée", PnlSection.CHIFFRE_AFFAIRES),
        pnl("74", PRODUITS_ANNEXES, "Subventions d'exploitation", PnlSection.CHIFFRE_AFFAIRES),
        pnl("75", PRODUITS_ANNEXES, "Autres produits de gestion courante", PnlSection.AUTRES_CHARGES_GESTION),
        pnl("76", AccountCategory.PRODUITS_FINANCIERS, "Produits financiers", PnlSection.PRODUITS_FINANCIERS),
        pnl("77", AccountCategory.PRODUITS_EXCEPTIONNELS, "Produits exceptionnels", PnlSection.PRODUITS_EXCEPTIONNELS),
        pnl("78", REPRISES_PROVISIONS, "Reprises sur provisions et amortissements", PnlSection.DOTATIONS_AMORTISSEMENTS),
        pnl("79", TRANSFERTS_CHARGES, "Transferts de charges", PnlSection.AUTRES_CHARGES_GESTION)
    );

    private final List<AccountMapping> mappings;
    private final List<AccountMapping> longestPrefixFirst;

    public AccountClassificationTable() {
        this(PCG_MAPPINGS);
    }

    AccountClassificationTable(List<AccountMapping> mappings) {
        this.mappings = List.copyOf(mappings);
        this.longestPrefixFirst = mappings.stream()
            .sorted(Comparator.comparingInt((AccountMapping m) -> m.getAccountPrefix().length()).reversed())
            .toList();
    }

    /**
     * Finds the mapping with the longest prefix matching the account number.
     */
    public Optional<AccountMapping> classify(String accountNumber) {
        if (accountNumber == null || accountNumber.isBlank()) {
            return Optional.empty();
        }
        return longestPrefixFirst.stream()
            .filter(mapping -> mapping.matches(accountNumber))
            .findFirst();
    }

    public Optional<AccountCategory> categoryOf(String accountNumber) {
        return classify(accountNumber).map(AccountMapping::getCategory);
    }

    public List<String> prefixesFor(PnlSection section) {
        return mappings.stream()
            .filter(mapping -> mapping.getPnlSection() == section)
            .map(AccountMapping::getAccountPrefix)
            .toList();
    }

    public List<String> prefixesFor(BalanceSheetSection section) {
        return mappings.stream()
            .filter(mapping -> mapping.getBalanceSheetSection() == section)
            .map(AccountMapping::getAccountPrefix)
            .toList();
    }

    /**
     * Classes 2, 3, 5 (assets) and 6 (expenses) carry a debit balance in normal operation.
     */
    public boolean isDebitNormal(String accountNumber) {
        if (accountNumber == null || accountNumber.isEmpty()) {
            return false;
        }
        char accountClass = accountNumber.charAt(0);
        return accountClass == '2' || accountClass == '3' || accountClass == '5' || accountClass == '6';
    }

    public List<AccountMapping> getMappings() {
        return mappings;
    }
}
