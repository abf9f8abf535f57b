package com.flagship.fec_diligence.qoe;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Input for an analyst-entered QoE adjustment.
 */
@Value
@Builder
public class ManualAdjustmentRequest {

    @NotNull(message = "Adjustment type is required")
    AdjustmentType type;

    @NotBlank(message = "Label is required")
    String label;

    String description;

    @NotBlank(message = "Fiscal year is required")
    String fiscalYear;

    @NotNull(message = "EBITDA impact must be a valid number")
    BigDecimal impactEbitda;

    BigDecimal impactResultatNet;
}
