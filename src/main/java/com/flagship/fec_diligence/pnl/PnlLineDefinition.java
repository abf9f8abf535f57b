package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.PnlSection;
import lombok.Value;

import java.util.List;

/**
 * Static definition of one P&L line. Direct lines carry account prefixes; calculated
 * lines (subtotals, total) and netted lines carry none.
 */
@Value
class PnlLineDefinition {
    String code;
    String label;
    PnlSection section;
    List<String> accountPrefixes;
    boolean creditNormal;
    boolean subtotal;
    boolean total;
    int indent;

    static PnlLineDefinition revenue(String code, String label, PnlSection section, int indent, String... prefixes) {
        return new PnlLineDefinition(code, label, section, List.of(prefixes), true, false, false, indent);
    }

    static PnlLineDefinition expense(String code, String label, PnlSection section, int indent, String... prefixes) {
        return new PnlLineDefinition(code, label, section, List.of(prefixes), false, false, false, indent);
    }

    static PnlLineDefinition subtotal(String code, String label, PnlSection section) {
        return new PnlLineDefinition(code, label, section, List.of(), true, true, false, 0);
    }

    static PnlLineDefinition total(String code, String label, PnlSection section) {
        return new PnlLineDefinition(code, label, section, List.of(), true, false, true, 0);
    }

    boolean isCalculated() {
        return subtotal || total;
    }
}
