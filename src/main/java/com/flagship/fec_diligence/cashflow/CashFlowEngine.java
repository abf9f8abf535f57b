package com.flagship.fec_diligence.cashflow;

import com.flagship.fec_diligence.balance.BalanceSheet;
import com.flagship.fec_diligence.balance.BalanceSheetEngine;
import com.flagship.fec_diligence.classification.PnlSection;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.LedgerAggregations;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.PnlEngine;
import com.flagship.fec_diligence.pnl.PnlStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconstructs cash flows with the indirect method from one P&L and the balance sheets
 * opening and closing its period.
 *
 * Callers pass balance sheets in chronological order; the engine rejects a closing
 * sheet dated before the opening one.
 */
@Slf4j
@Service
public class CashFlowEngine {

    private final PnlEngine pnlEngine;
    private final BalanceSheetEngine balanceSheetEngine;
    private final CashFlowEstimator estimator;
    private final String currency;

    @Autowired
    public CashFlowEngine(PnlEngine pnlEngine,
                          BalanceSheetEngine balanceSheetEngine,
                          CashFlowEstimator estimator,
                          @Value("${fec.derivation.currency:EUR}") String currency) {
        this.pnlEngine = pnlEngine;
        this.balanceSheetEngine = balanceSheetEngine;
        this.estimator = estimator;
        this.currency = currency;
    }

    public CashFlowEngine() {
        this(new PnlEngine(), new BalanceSheetEngine(), new BalanceDeltaCashFlowEstimator(), "EUR");
    }

    public CashFlowStatement generate(PnlStatement pnl, BalanceSheet opening, BalanceSheet closing) {
        if (closing.getAsOfDate().isBefore(opening.getAsOfDate())) {
            throw new IllegalArgumentException(String.format(
                "Closing balance sheet (%s) is dated before the opening one (%s)",
                closing.getAsOfDate(), opening.getAsOfDate()));
        }
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        BigDecimal ebitda = pnl.getEbitda();
        amounts.put("EBITDA", ebitda);

        BigDecimal varStocks = assetFlow(opening.getStocks(), closing.getStocks());
        BigDecimal varClients = assetFlow(opening.getClientsNet(), closing.getClientsNet());
        BigDecimal varFae = assetFlow(opening.getFaeAvances(), closing.getFaeAvances());
        BigDecimal varFournisseurs = liabilityFlow(opening.getFournisseurs(), closing.getFournisseurs());
        BigDecimal varBfrOp = varStocks.add(varClients).add(varFae).add(varFournisseurs);
        amounts.put("VAR_STOCKS", varStocks);
        amounts.put("VAR_CLIENTS", varClients);
        amounts.put("VAR_FAE", varFae);
        amounts.put("VAR_FRS", varFournisseurs);
        amounts.put("VAR_BFR_OP", varBfrOp);

        BigDecimal varAutresCreances = assetFlow(opening.getAutresCreances(), closing.getAutresCreances())
            .add(assetFlow(opening.getChargesConstateesAvance(), closing.getChargesConstateesAvance()));
        BigDecimal varDettesFs = liabilityFlow(opening.getDettesFiscalesSociales(), closing.getDettesFiscalesSociales());
        BigDecimal varAutresDettes = liabilityFlow(opening.getAutresDettes(), closing.getAutresDettes())
            .add(liabilityFlow(opening.getProduitsConstatesAvance(), closing.getProduitsConstatesAvance()));
        BigDecimal varBfrNonOp = varAutresCreances.add(varDettesFs).add(varAutresDettes);
        amounts.put("VAR_AUTRES_CR", varAutresCreances);
        amounts.put("VAR_DETTES_FS", varDettesFs);
        amounts.put("VAR_AUTRES_DETTES", varAutresDettes);
        amounts.put("VAR_BFR_NON_OP", varBfrNonOp);

        BigDecimal fluxExploitation = ebitda.add(varBfrOp).add(varBfrNonOp);
        amounts.put("FLUX_EXPL", fluxExploitation);

        BigDecimal capex = estimator.estimateCapex(opening, closing);
        BigDecimal cessions = estimator.estimateDisposalProceeds(pnl);
        BigDecimal varImmoFin = assetFlow(opening.getImmobilisationsFinancieres(),
            closing.getImmobilisationsFinancieres());
        BigDecimal fluxInvestissement = capex.add(cessions).add(varImmoFin);
        amounts.put("CAPEX", capex);
        amounts.put("CESSIONS", cessions);
        amounts.put("VAR_IMMO_FIN", varImmoFin);
        amounts.put("FLUX_INVEST", fluxInvestissement);

        BigDecimal fcfAvantIs = fluxExploitation.add(fluxInvestissement);
        // A tax credit (negative charge) is a cash inflow
        BigDecimal impotSocietes = pnl.amountOf(PnlSection.IMPOT_SOCIETES);
        BigDecimal fcfApresIs = fcfAvantIs.subtract(impotSocietes);
        amounts.put("FCF_AVANT_IS", fcfAvantIs);
        amounts.put("IS_PAYE", impotSocietes.negate());
        amounts.put("FCF_APRES_IS", fcfApresIs);

        BigDecimal dividendes = estimator.estimateDividends(opening, closing);
        BigDecimal varEmprunts = liabilityFlow(
            opening.getEmpruntsEtablissements().add(opening.getAutresDettesFinancieres()),
            closing.getEmpruntsEtablissements().add(closing.getAutresDettesFinancieres()));
        BigDecimal varComptesCourants = liabilityFlow(opening.getEmpruntsAssocies(), closing.getEmpruntsAssocies());

        BigDecimal tresorerieOuverture = opening.tresorerieNette();
        BigDecimal tresorerieCloture = closing.tresorerieNette();
        BigDecimal variationTresorerie = tresorerieCloture.subtract(tresorerieOuverture);

        BigDecimal explained = fcfApresIs.add(dividendes).add(varEmprunts).add(varComptesCourants);
        BigDecimal ecart = variationTresorerie.subtract(explained);
        BigDecimal fluxFinancement = dividendes.add(varEmprunts).add(varComptesCourants).add(ecart);
        amounts.put("DIVIDENDES", dividendes);
        amounts.put("VAR_EMPRUNTS", varEmprunts);
        amounts.put("VAR_CC", varComptesCourants);
        amounts.put("ECART_RECONCILIATION", ecart);
        amounts.put("FLUX_FIN", fluxFinancement);
        amounts.put("VAR_TRESO", variationTresorerie);
        amounts.put("TRESO_OUVERTURE", tresorerieOuverture);
        amounts.put("TRESO_CLOTURE", tresorerieCloture);

        if (Amounts.exceeds(ecart, Amounts.CENT)) {
            log.debug("Cash flow {}: {} of the cash variation is not explained by the estimated flows",
                pnl.getFiscalYear(), ecart);
        }

        List<CashFlowLine> lines = CashFlowStructure.LINES.stream()
            .map(definition -> new CashFlowLine(definition.getCode(), definition.getLabel(),
                amounts.getOrDefault(definition.getCode(), BigDecimal.ZERO),
                definition.isSubtotal(), definition.isTotal(), definition.getIndent()))
            .toList();

        return CashFlowStatement.builder()
            .fiscalYear(pnl.getFiscalYear())
            .startDate(pnl.getStartDate())
            .endDate(pnl.getEndDate())
            .currency(currency)
            .lines(lines)
            .ebitda(ebitda)
            .variationBfrOperationnel(varBfrOp)
            .variationBfrNonOperationnel(varBfrNonOp)
            .fluxExploitation(fluxExploitation)
            .capex(capex)
            .cessions(cessions)
            .fluxInvestissement(fluxInvestissement)
            .fcfAvantIs(fcfAvantIs)
            .impotSocietes(impotSocietes)
            .fcfApresIs(fcfApresIs)
            .dividendes(dividendes)
            .variationDettesFinancieres(varEmprunts.add(varComptesCourants))
            .ecartReconciliation(ecart)
            .fluxFinancement(fluxFinancement)
            .variationTresorerie(variationTresorerie)
            .tresorerieOuverture(tresorerieOuverture)
            .tresorerieCloture(tresorerieCloture)
            .build();
    }

    /**
     * One row per calendar month between startDate and endDate: the month's EBITDA, the
     * change in total BFR against the previous month-end, and the month-end net cash.
     */
    public List<MonthlyCashFlow> generateMonthly(List<LedgerEntry> entries, String fiscalYear,
                                                 LocalDate startDate, LocalDate endDate) {
        List<MonthlyCashFlow> result = new ArrayList<>();
        BalanceSheet previous = null;
        for (YearMonth month = YearMonth.from(startDate); !month.isAfter(YearMonth.from(endDate));
             month = month.plusMonths(1)) {
            LocalDate monthStart = month.atDay(1);
            LocalDate monthEnd = month.atEndOfMonth();
            PnlStatement monthPnl = pnlEngine.generate(
                LedgerAggregations.filterByDateRange(entries, monthStart, monthEnd),
                month.toString(), monthStart, monthEnd);
            BalanceSheet monthBalance = balanceSheetEngine.generate(entries, monthEnd, fiscalYear);

            BigDecimal variationBfr = previous == null
                ? BigDecimal.ZERO
                : assetFlow(previous.getBfrTotal(), monthBalance.getBfrTotal());
            result.add(new MonthlyCashFlow(month, monthPnl.getEbitda(), variationBfr,
                monthPnl.getEbitda().add(variationBfr), monthBalance.tresorerieNette()));
            previous = monthBalance;
        }
        return result;
    }

    public List<CashConversion> cashConversion(List<CashFlowStatement> cashFlows) {
        return cashFlows.stream()
            .map(cashFlow -> new CashConversion(cashFlow.getFiscalYear(), cashFlow.getEbitda(),
                cashFlow.getFcfApresIs(),
                Amounts.percentOf(cashFlow.getFcfApresIs(), cashFlow.getEbitda())))
            .toList();
    }

    /**
     * Gross cash is the active treasury, gross debt the financial debt plus overdrafts;
     * the caller's items are added on top of each.
     */
    public QualityOfDebt qualityOfDebt(BalanceSheet balanceSheet, List<AdjustmentItem> cashAdjustments,
                                       List<AdjustmentItem> debtAdjustments) {
        BigDecimal grossCash = balanceSheet.getTresorerieActif();
        BigDecimal adjustedCash = grossCash.add(Amounts.sum(cashAdjustments, AdjustmentItem::getAmount));
        BigDecimal grossDebt = balanceSheet.getDettesFinancieres().add(balanceSheet.getTresoreriePassif());
        BigDecimal adjustedDebt = grossDebt.add(Amounts.sum(debtAdjustments, AdjustmentItem::getAmount));

        return QualityOfDebt.builder()
            .date(balanceSheet.getAsOfDate())
            .grossCash(grossCash)
            .cashAdjustments(List.copyOf(cashAdjustments))
            .adjustedCash(adjustedCash)
            .grossDebt(grossDebt)
            .debtAdjustments(List.copyOf(debtAdjustments))
            .adjustedDebt(adjustedDebt)
            .netCashDebt(grossCash.subtract(grossDebt))
            .adjustedNetCashDebt(adjustedCash.subtract(adjustedDebt))
            .build();
    }

    public AverageNetCash averageNetCash(List<LedgerEntry> entries, LocalDate startDate, LocalDate endDate) {
        List<NetCashPosition> positions = new ArrayList<>();
        for (YearMonth month = YearMonth.from(startDate); !month.isAfter(YearMonth.from(endDate));
             month = month.plusMonths(1)) {
            BalanceSheet balanceSheet = balanceSheetEngine.generate(entries, month.atEndOfMonth(), "");
            positions.add(new NetCashPosition(month,
                balanceSheet.tresorerieNette().subtract(balanceSheet.getDettesFinancieres())));
        }
        BigDecimal average = Amounts.ratio(Amounts.sum(positions, NetCashPosition::getNetCash),
            BigDecimal.valueOf(positions.size()), BigDecimal.ONE);
        return new AverageNetCash(positions, average);
    }

    /**
     * A growing asset consumes cash.
     */
    private static BigDecimal assetFlow(BigDecimal opening, BigDecimal closing) {
        return closing.subtract(opening).negate();
    }

    private static BigDecimal liabilityFlow(BigDecimal opening, BigDecimal closing) {
        return closing.subtract(opening);
    }
}
