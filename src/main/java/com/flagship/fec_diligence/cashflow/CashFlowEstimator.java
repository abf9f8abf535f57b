package com.flagship.fec_diligence.cashflow;

import com.flagship.fec_diligence.balance.BalanceSheet;
import com.flagship.fec_diligence.pnl.PnlStatement;

import java.math.BigDecimal;

/**
 * Cash flow figures that the ledger does not state directly and that are inferred
 * from balance movements. Returned amounts are already signed as cash flows.
 */
public interface CashFlowEstimator {

    /**
     * Investment outflow, negative when fixed assets grew.
     */
    BigDecimal estimateCapex(BalanceSheet opening, BalanceSheet closing);

    /**
     * Proceeds from asset disposals, positive.
     */
    BigDecimal estimateDisposalProceeds(PnlStatement pnl);

    /**
     * Dividends paid, negative or zero.
     */
    BigDecimal estimateDividends(BalanceSheet opening, BalanceSheet closing);
}
