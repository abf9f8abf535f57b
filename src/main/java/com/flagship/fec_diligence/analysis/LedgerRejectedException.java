package com.flagship.fec_diligence.analysis;

import com.flagship.fec_diligence.ledger.LedgerValidationError;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a ledger file could not be parsed into a usable set of entries.
 */
@Getter
public class LedgerRejectedException extends RuntimeException {

    private final String filename;
    private final List<LedgerValidationError> errors;

    public LedgerRejectedException(String filename, List<LedgerValidationError> errors) {
        super(String.format("Ledger %s rejected: %s", filename, summarize(errors)));
        this.filename = filename;
        this.errors = List.copyOf(errors);
    }

    private static String summarize(List<LedgerValidationError> errors) {
        if (errors.isEmpty()) {
            return "no usable entries";
        }
        LedgerValidationError first = errors.get(0);
        String more = errors.size() > 1 ? String.format(" (+%d more)", errors.size() - 1) : "";
        return String.format("line %d: %s%s", first.getLine(), first.getMessage(), more);
    }
}
