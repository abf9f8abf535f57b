package com.flagship.fec_diligence.cashflow;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Indirect-method cash flow of one period, starting from EBITDA.
 *
 * Asset increases are negative flows, liability increases positive ones.
 * tresorerieCloture - tresorerieOuverture always equals variationTresorerie: whatever
 * the estimated flows do not explain is carried by ecartReconciliation, inside the
 * financing flows.
 */
@Value
@Builder
public class CashFlowStatement {
    String fiscalYear;
    LocalDate startDate;
    LocalDate endDate;
    String currency;
    List<CashFlowLine> lines;

    BigDecimal ebitda;
    BigDecimal variationBfrOperationnel;
    BigDecimal variationBfrNonOperationnel;
    BigDecimal fluxExploitation;
    BigDecimal capex;
    BigDecimal cessions;
    BigDecimal fluxInvestissement;
    BigDecimal fcfAvantIs;
    BigDecimal impotSocietes;
    BigDecimal fcfApresIs;
    BigDecimal dividendes;
    BigDecimal variationDettesFinancieres;
    BigDecimal ecartReconciliation;
    BigDecimal fluxFinancement;
    BigDecimal variationTresorerie;
    BigDecimal tresorerieOuverture;
    BigDecimal tresorerieCloture;

    public BigDecimal amountOf(String code) {
        return lines.stream()
            .filter(line -> line.getCode().equals(code))
            .map(CashFlowLine::getAmount)
            .findFirst()
            .orElse(BigDecimal.ZERO);
    }
}
