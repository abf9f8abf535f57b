package com.flagship.fec_diligence.cashflow;

import com.flagship.fec_diligence.balance.BalanceSheet;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.pnl.PnlStatement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Estimates from balance sheet deltas:
 * <ul>
 *   <li>CAPEX: growth of gross intangible and tangible assets</li>
 *   <li>disposals: net credits on 775</li>
 *   <li>dividends: opening result not found in the growth of reserves and retained earnings</li>
 * </ul>
 */
@Component
public class BalanceDeltaCashFlowEstimator implements CashFlowEstimator {

    @Override
    public BigDecimal estimateCapex(BalanceSheet opening, BalanceSheet closing) {
        return grossFixedAssets(closing).subtract(grossFixedAssets(opening)).negate();
    }

    @Override
    public BigDecimal estimateDisposalProceeds(PnlStatement pnl) {
        return Amounts.nullToZero(pnl.getProduitsCessionsActifs()).max(BigDecimal.ZERO);
    }

    @Override
    public BigDecimal estimateDividends(BalanceSheet opening, BalanceSheet closing) {
        BigDecimal openingReserves = opening.getReserves().add(opening.getReportANouveau());
        BigDecimal closingReserves = closing.getReserves().add(closing.getReportANouveau());
        BigDecimal distributed = opening.getResultatExercice().subtract(closingReserves.subtract(openingReserves));
        return distributed.signum() > 0 ? distributed.negate() : BigDecimal.ZERO;
    }

    private static BigDecimal grossFixedAssets(BalanceSheet balanceSheet) {
        return Amounts.nullToZero(balanceSheet.getImmobilisationsIncorporellesBrutes())
            .add(Amounts.nullToZero(balanceSheet.getImmobilisationsCorporellesBrutes()));
    }
}
