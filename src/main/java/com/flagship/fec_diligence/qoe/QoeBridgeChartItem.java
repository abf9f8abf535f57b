package com.flagship.fec_diligence.qoe;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One bar of the reported-to-adjusted EBITDA waterfall.
 */
@Value
public class QoeBridgeChartItem {

    public enum Type {
        START, ADJUSTMENT, END
    }

    String label;
    BigDecimal value;
    Type type;
}
