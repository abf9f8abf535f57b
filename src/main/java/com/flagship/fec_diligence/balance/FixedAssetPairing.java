package com.flagship.fec_diligence.balance;

import lombok.Value;

import java.util.List;

/**
 * Declared link between a gross fixed-asset prefix and its class 28/29 contra accounts.
 */
@Value
public class FixedAssetPairing {
    String grossPrefix;
    List<String> contraPrefixes;

    static final List<FixedAssetPairing> PCG_PAIRINGS = List.of(
        new FixedAssetPairing("20", List.of("280", "290")),
        new FixedAssetPairing("21", List.of("281", "291")),
        new FixedAssetPairing("22", List.of("282", "292")),
        new FixedAssetPairing("23", List.of("293"))
    );

    static List<String> contraPrefixesOf(List<String> grossPrefixes) {
        return PCG_PAIRINGS.stream()
            .filter(pairing -> grossPrefixes.contains(pairing.getGrossPrefix()))
            .flatMap(pairing -> pairing.getContraPrefixes().stream())
            .toList();
    }

    /**
     * Account digits after the prefix with trailing zeros removed: under prefix 21,
     * 218300 gives "83"; under prefix 281, 281830 gives "83" as well.
     */
    static String suffixOf(String accountNumber, String prefix) {
        String suffix = accountNumber.substring(prefix.length());
        int end = suffix.length();
        while (end > 0 && suffix.charAt(end - 1) == '0') {
            end--;
        }
        return suffix.substring(0, end);
    }
}
