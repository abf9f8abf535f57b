package com.flagship.fec_diligence.qoe;

public enum AdjustmentSource {
    AUTO_DETECTED,
    MANUAL
}
