package com.flagship.fec_diligence.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A validated ledger: metadata plus the ordered, read-only entry sequence.
 * Created once per file and never mutated by the statement engines.
 */
@Value
@Builder
public class ParsedLedgerFile {
    String filename;
    String fiscalYear;
    /** Year encoded in the statutory filename ({@code ...FEC20231231...}), null when absent. */
    Integer sourceYear;
    LocalDate startDate;
    LocalDate endDate;
    List<LedgerEntry> entries;
    int entryCount;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    boolean balanced;

    public BigDecimal imbalance() {
        return totalDebit.subtract(totalCredit);
    }
}
