package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.PnlSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class PnlStatement {
    String fiscalYear;
    LocalDate startDate;
    LocalDate endDate;
    String currency;
    List<PnlLine> lines;

    BigDecimal chiffreAffaires;
    BigDecimal production;
    BigDecimal achatsConsommes;
    BigDecimal margeCoutsDirects;
    BigDecimal ebitda;
    BigDecimal ebitdaMargin;
    BigDecimal resultatExploitation;
    BigDecimal resultatNet;
    /** Memo: net proceeds booked on 775, not a presented line. */
    BigDecimal produitsCessionsActifs;

    /**
     * Amount of a section's line, zero when the statement has no such line.
     */
    public BigDecimal amountOf(PnlSection section) {
        return lines.stream()
            .filter(line -> line.getSection() == section)
            .map(PnlLine::getAmount)
            .findFirst()
            .orElse(BigDecimal.ZERO);
    }
}
