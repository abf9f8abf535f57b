package com.flagship.fec_diligence.qoe;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Multi-year QoE view: one analysis per fiscal year, a per-type summary and the
 * suspected double counts among validated adjustments.
 */
@Value
@Builder
public class QoeBridge {
    List<QoeAnalysis> analyses;
    List<QoeTypeSummary> summary;
    List<AdjustmentCollision> collisions;
}
