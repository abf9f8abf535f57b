package com.flagship.fec_diligence.ledger;

/**
 * How entry dates are read from the ledger text.
 */
public enum DateFormatOption {
    /** Try YYYYMMDD, then day-first separated dates, then ISO. */
    AUTO,
    YYYYMMDD,
    DD_MM_YYYY
}
