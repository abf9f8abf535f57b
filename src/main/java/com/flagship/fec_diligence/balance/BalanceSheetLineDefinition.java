package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.classification.BalanceSheetSection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
class BalanceSheetLineDefinition {
    String code;
    String label;
    BalanceSheetSection section;
    @Singular
    List<String> accountPrefixes;
    @Singular
    List<String> excludePrefixes;
    boolean debitNormal;
    boolean subtotal;
    boolean total;
    int indent;
    /** Gross / amortization / net presentation through {@link FixedAssetPairing}. */
    boolean grossAmortization;

    boolean isCalculated() {
        return accountPrefixes.isEmpty();
    }
}
