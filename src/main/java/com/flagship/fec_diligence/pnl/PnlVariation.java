package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.PnlSection;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Variation of one section between the last two compared periods.
 * percentVariation is relative to |previous| and zero when previous is zero.
 */
@Value
public class PnlVariation {
    PnlSection section;
    String label;
    List<BigDecimal> amounts;
    BigDecimal absoluteVariation;
    BigDecimal percentVariation;
}
