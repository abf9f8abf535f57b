package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.balance.BalanceSheet;
import com.flagship.fec_diligence.balance.WorkingCapitalMetrics;
import com.flagship.fec_diligence.pnl.PnlStatement;
import com.flagship.fec_diligence.qoe.SuggestedAdjustment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything derived from one ledger file.
 */
@Value
@Builder
public class FiscalYearAnalysis {
    String filename;
    String fiscalYear;
    Integer sourceYear;
    LocalDate startDate;
    LocalDate endDate;
    int entryCount;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    boolean balanced;
    List<String> parseWarnings;
    PnlStatement pnl;
    BalanceSheet balanceSheet;
    WorkingCapitalMetrics workingCapital;
    List<SuggestedAdjustment> suggestions;
}
