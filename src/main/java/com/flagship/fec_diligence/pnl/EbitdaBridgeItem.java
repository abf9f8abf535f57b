package com.flagship.fec_diligence.pnl;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One bar of the EBITDA waterfall between two periods.
 */
@Value
public class EbitdaBridgeItem {

    public enum Type {
        START, POSITIVE, NEGATIVE, END
    }

    String label;
    BigDecimal value;
    Type type;

    static EbitdaBridgeItem step(String label, BigDecimal value) {
        return new EbitdaBridgeItem(label, value, value.signum() >= 0 ? Type.POSITIVE : Type.NEGATIVE);
    }
}
