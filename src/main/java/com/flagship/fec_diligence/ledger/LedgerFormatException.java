package com.flagship.fec_diligence.ledger;

import java.util.List;

/**
 * File-level structural failure raised by a ledger reader; the parser turns it into
 * an unsuccessful {@link LedgerParseResult}.
 */
class LedgerFormatException extends Exception {

    private final transient List<LedgerValidationError> errors;

    LedgerFormatException(String message) {
        super(message);
        this.errors = List.of(LedgerValidationError.fileLevel(message));
    }

    LedgerFormatException(String message, List<LedgerValidationError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    LedgerFormatException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(LedgerValidationError.fileLevel(message));
    }

    List<LedgerValidationError> getErrors() {
        return errors;
    }
}
