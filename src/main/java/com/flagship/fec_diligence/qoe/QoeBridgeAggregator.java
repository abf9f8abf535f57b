package com.flagship.fec_diligence.qoe;

import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.pnl.PnlStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns validated QoE adjustments into per-year analyses and a multi-year bridge.
 *
 * Unvalidated adjustments never reach adjusted EBITDA. Possible double counts are
 * reported as {@link AdjustmentCollision}s, never merged.
 */
@Slf4j
@Service
public class QoeBridgeAggregator {

    private final BigDecimal duplicateTolerance;

    @Autowired
    public QoeBridgeAggregator(@Value("${fec.qoe.duplicate-tolerance:0.10}") BigDecimal duplicateTolerance) {
        this.duplicateTolerance = duplicateTolerance;
    }

    public QoeBridgeAggregator() {
        this(new BigDecimal("0.10"));
    }

    public QoeAnalysis analyze(PnlStatement pnl, List<QoeAdjustment> adjustments) {
        List<QoeAdjustment> yearAdjustments = adjustments.stream()
            .filter(QoeAdjustment::isValidated)
            .filter(a -> pnl.getFiscalYear().equals(a.getFiscalYear()))
            .toList();

        BigDecimal total = Amounts.sum(yearAdjustments, QoeAdjustment::getImpactEbitda);
        BigDecimal ebitdaAjuste = pnl.getEbitda().add(total);

        return QoeAnalysis.builder()
            .fiscalYear(pnl.getFiscalYear())
            .ebitdaReporte(pnl.getEbitda())
            .adjustments(yearAdjustments)
            .totalAdjustments(total)
            .ebitdaAjuste(ebitdaAjuste)
            .margeEbitdaAjustee(Amounts.percentOf(ebitdaAjuste, pnl.getProduction()))
            .production(pnl.getProduction())
            .build();
    }

    public QoeBridge bridge(List<PnlStatement> statements, List<QoeAdjustment> adjustments) {
        List<QoeAnalysis> analyses = new ArrayList<>();
        for (PnlStatement pnl : statements) {
            analyses.add(analyze(pnl, adjustments));
        }

        List<AdjustmentCollision> collisions = collisions(adjustments);
        if (!collisions.isEmpty()) {
            log.debug("{} possible double count(s) among validated adjustments", collisions.size());
        }

        return QoeBridge.builder()
            .analyses(analyses)
            .summary(summarizeByType(adjustments))
            .collisions(collisions)
            .build();
    }

    /**
     * Validated adjustments grouped by type, largest average impact first.
     */
    public List<QoeTypeSummary> summarizeByType(List<QoeAdjustment> adjustments) {
        Map<AdjustmentType, List<QoeAdjustment>> byType = new EnumMap<>(AdjustmentType.class);
        for (QoeAdjustment adjustment : adjustments) {
            if (adjustment.isValidated()) {
                byType.computeIfAbsent(adjustment.getType(), t -> new ArrayList<>()).add(adjustment);
            }
        }

        List<QoeTypeSummary> summary = new ArrayList<>();
        for (Map.Entry<AdjustmentType, List<QoeAdjustment>> group : byType.entrySet()) {
            List<QoeAdjustment> items = group.getValue();
            BigDecimal total = Amounts.sum(items, QoeAdjustment::getImpactEbitda);
            BigDecimal average = total.divide(BigDecimal.valueOf(items.size()), 2, RoundingMode.HALF_UP);
            summary.add(new QoeTypeSummary(group.getKey(), group.getKey().getLabel(), items.size(), total, average));
        }
        summary.sort(Comparator.comparing((QoeTypeSummary s) -> s.getAverageImpact().abs()).reversed());
        return summary;
    }

    /**
     * First existing adjustment the candidate would double count, if any.
     */
    public Optional<AdjustmentCollision> findDuplicate(QoeAdjustment candidate, List<QoeAdjustment> existing) {
        for (QoeAdjustment other : existing) {
            if (other.getId() != null && other.getId().equals(candidate.getId())) {
                continue;
            }
            if (similarAmount(candidate, other)) {
                return Optional.of(new AdjustmentCollision(candidate, other, AdjustmentCollision.Reason.SIMILAR_AMOUNT));
            }
            if (coversAccounts(candidate, other)) {
                return Optional.of(new AdjustmentCollision(candidate, other, AdjustmentCollision.Reason.OVERLAPPING_ACCOUNTS));
            }
        }
        return Optional.empty();
    }

    /**
     * Waterfall from reported to adjusted EBITDA for one year.
     */
    public List<QoeBridgeChartItem> chart(QoeAnalysis analysis) {
        List<QoeBridgeChartItem> items = new ArrayList<>();
        items.add(new QoeBridgeChartItem("EBITDA reporté", analysis.getEbitdaReporte(), QoeBridgeChartItem.Type.START));
        for (QoeAdjustment adjustment : analysis.getAdjustments()) {
            items.add(new QoeBridgeChartItem(adjustment.getLabel(), adjustment.getImpactEbitda(),
                QoeBridgeChartItem.Type.ADJUSTMENT));
        }
        items.add(new QoeBridgeChartItem("EBITDA ajusté", analysis.getEbitdaAjuste(), QoeBridgeChartItem.Type.END));
        return items;
    }

    private List<AdjustmentCollision> collisions(List<QoeAdjustment> adjustments) {
        List<QoeAdjustment> validated = adjustments.stream().filter(QoeAdjustment::isValidated).toList();
        List<AdjustmentCollision> collisions = new ArrayList<>();
        for (int i = 1; i < validated.size(); i++) {
            findDuplicate(validated.get(i), validated.subList(0, i)).ifPresent(collisions::add);
        }
        return collisions;
    }

    private boolean similarAmount(QoeAdjustment candidate, QoeAdjustment other) {
        if (!candidate.getFiscalYear().equals(other.getFiscalYear()) || candidate.getType() != other.getType()) {
            return false;
        }
        BigDecimal allowed = candidate.getImpactEbitda().abs().multiply(duplicateTolerance);
        return Amounts.withinTolerance(candidate.getImpactEbitda(), other.getImpactEbitda(), allowed);
    }

    private static boolean coversAccounts(QoeAdjustment candidate, QoeAdjustment other) {
        List<String> existingAccounts = other.getRelatedAccounts();
        return !existingAccounts.isEmpty() && candidate.getRelatedAccounts().containsAll(existingAccounts);
    }
}
