package com.flagship.fec_diligence.ledger;

import lombok.Value;

/**
 * A field-level parse error. Line 0 denotes a file-level problem.
 */
@Value
public class LedgerValidationError {
    int line;
    String field;
    String value;
    String message;

    public static LedgerValidationError fileLevel(String message) {
        return new LedgerValidationError(0, "file", "", message);
    }
}
