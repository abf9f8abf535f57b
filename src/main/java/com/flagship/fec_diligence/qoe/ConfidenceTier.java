package com.flagship.fec_diligence.qoe;

/**
 * Confidence attached to a detection rule. Fixed per rule, never computed from the data.
 */
public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
