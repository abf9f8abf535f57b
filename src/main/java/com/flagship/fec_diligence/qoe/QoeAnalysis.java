package com.flagship.fec_diligence.qoe;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reported vs. adjusted EBITDA for one fiscal year, built from validated adjustments only.
 */
@Value
@Builder
public class QoeAnalysis {
    String fiscalYear;
    BigDecimal ebitdaReporte;
    List<QoeAdjustment> adjustments;
    BigDecimal totalAdjustments;
    BigDecimal ebitdaAjuste;
    BigDecimal margeEbitdaAjustee;
    BigDecimal production;
}
