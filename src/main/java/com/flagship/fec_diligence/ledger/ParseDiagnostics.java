package com.flagship.fec_diligence.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings collected while reading one file.
 */
final class ParseDiagnostics {

    private final List<LedgerValidationError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void error(int line, String field, String value, String message) {
        errors.add(new LedgerValidationError(line, field, value != null ? value : "", message));
    }

    void warning(String message) {
        warnings.add(message);
    }

    List<LedgerValidationError> getErrors() {
        return errors;
    }

    List<String> getWarnings() {
        return warnings;
    }
}
