package com.flagship.fec_diligence.ledger;

import java.util.Arrays;
import java.util.List;

/**
 * The 18 columns of the statutory FEC layout, in their canonical order.
 */
public enum FecColumn {
    JOURNAL_CODE("JournalCode", true),
    JOURNAL_LIB("JournalLib", true),
    ECRITURE_NUM("EcritureNum", true),
    ECRITURE_DATE("EcritureDate", true),
    COMPTE_NUM("CompteNum", true),
    COMPTE_LIB("CompteLib", true),
    COMP_AUX_NUM("CompAuxNum", false),
    COMP_AUX_LIB("CompAuxLib", false),
    PIECE_REF("PieceRef", false),
    PIECE_DATE("PieceDate", false),
    ECRITURE_LIB("EcritureLib", true),
    DEBIT("Debit", true),
    CREDIT("Credit", true),
    ECRITURE_LET("EcritureLet", false),
    DATE_LET("DateLet", false),
    VALID_DATE("ValidDate", false),
    MONTANT_DEVISE("Montantdevise", false),
    IDEVISE("Idevise", false);

    private final String headerName;
    private final boolean required;

    FecColumn(String headerName, boolean required) {
        this.headerName = headerName;
        this.required = required;
    }

    public String getHeaderName() {
        return headerName;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Header name in the normalized form used for matching (lower case, alphanumerics only).
     */
    public String normalizedName() {
        return LedgerValueParser.normalizeHeader(headerName);
    }

    public static List<FecColumn> requiredColumns() {
        return Arrays.stream(values()).filter(FecColumn::isRequired).toList();
    }
}
