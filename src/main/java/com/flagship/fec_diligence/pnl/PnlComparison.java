package com.flagship.fec_diligence.pnl;

import lombok.Value;

import java.util.List;

@Value
public class PnlComparison {
    List<PnlStatement> periods;
    List<PnlVariation> variations;
}
