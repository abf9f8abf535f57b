package com.flagship.fec_diligence.ledger;

import lombok.Value;

import java.util.List;

/**
 * Outcome of parsing one ledger file. The parser never throws for data problems;
 * it reports them here.
 */
@Value
public class LedgerParseResult {
    boolean success;
    ParsedLedgerFile file;
    List<LedgerValidationError> errors;
    List<String> warnings;

    public static LedgerParseResult success(ParsedLedgerFile file, List<LedgerValidationError> errors,
                                            List<String> warnings) {
        return new LedgerParseResult(true, file, List.copyOf(errors), List.copyOf(warnings));
    }

    public static LedgerParseResult failure(List<LedgerValidationError> errors, List<String> warnings) {
        return new LedgerParseResult(false, null, List.copyOf(errors), List.copyOf(warnings));
    }

    public static LedgerParseResult failure(String message) {
        return failure(List.of(LedgerValidationError.fileLevel(message)), List.of());
    }
}
