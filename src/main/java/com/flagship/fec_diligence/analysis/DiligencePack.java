package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.cashflow.CashFlowStatement;
import com.flagship.fec_diligence.pnl.EbitdaBridgeItem;
import com.flagship.fec_diligence.pnl.PnlComparison;
import com.flagship.fec_diligence.qoe.QoeBridge;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of a multi-year analysis, oldest fiscal year first.
 *
 * Cash flows exist only for consecutive pairs of years, so there is one fewer cash flow
 * than years. The EBITDA bridge is between the last two years, empty with a single year.
 */
@Value
@Builder
public class DiligencePack {
    Instant generatedAt;
    String currency;
    List<FiscalYearAnalysis> years;
    List<CashFlowStatement> cashFlows;
    PnlComparison pnlComparison;
    List<EbitdaBridgeItem> ebitdaBridge;
    QoeBridge qoeBridge;
}
