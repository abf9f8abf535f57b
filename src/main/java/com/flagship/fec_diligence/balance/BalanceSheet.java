package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.classification.BalanceSheetSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Point-in-time balance sheet. totalActif and totalPassif are not forced to match;
 * a gap is a data-quality signal (typically the unclosed result of the period).
 */
@Value
@Builder
public class BalanceSheet {
    LocalDate asOfDate;
    String fiscalYear;
    String currency;
    List<BalanceSheetLine> lines;

    // Actif
    BigDecimal immobilisationsIncorporellesBrutes;
    BigDecimal immobilisationsCorporellesBrutes;
    BigDecimal immobilisationsFinancieres;
    BigDecimal actifImmobilise;
    BigDecimal stocks;
    BigDecimal clientsNet;
    BigDecimal faeAvances;
    BigDecimal autresCreances;
    BigDecimal chargesConstateesAvance;
    BigDecimal actifCirculantExploitation;
    BigDecimal tresorerieActif;
    BigDecimal totalActif;

    // Passif
    BigDecimal capitalSocial;
    BigDecimal reserves;
    BigDecimal reportANouveau;
    BigDecimal resultatExercice;
    BigDecimal capitauxPropres;
    BigDecimal provisionsRisques;
    BigDecimal empruntsEtablissements;
    BigDecimal empruntsAssocies;
    BigDecimal autresDettesFinancieres;
    BigDecimal dettesFinancieres;
    BigDecimal fournisseurs;
    BigDecimal dettesFiscalesSociales;
    BigDecimal autresDettes;
    BigDecimal produitsConstatesAvance;
    BigDecimal passifCirculantExploitation;
    BigDecimal tresoreriePassif;
    BigDecimal totalPassif;

    // Working capital
    BigDecimal bfrOperationnel;
    BigDecimal bfrNonOperationnel;
    BigDecimal bfrTotal;
    BigDecimal endettementNet;

    public BigDecimal amountOf(BalanceSheetSection section) {
        return lines.stream()
            .filter(line -> line.getSection() == section)
            .map(BalanceSheetLine::getNet)
            .findFirst()
            .orElse(BigDecimal.ZERO);
    }

    /**
     * Cash net of bank overdrafts.
     */
    public BigDecimal tresorerieNette() {
        return tresorerieActif.subtract(tresoreriePassif);
    }
}
