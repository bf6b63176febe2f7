package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.HistoricalDeal;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.StageHistoryEntry;
import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.VelocityTrend;
import com.jay.dealintel.util.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layer 4 — Pipeline velocity.
 * Average dwell time per active stage, from stage-entry history where available and
 * the baseline table otherwise. Flags bottleneck stages (dwell time above
 * multiplier × mean, strictly), congested stages and the cycle-time trend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineVelocityAnalyzer {

    private final DealIntelConfig config;

    public PipelineVelocity analyze(List<PipelineDeal> activeDeals, List<HistoricalDeal> history) {
        DealIntelConfig.Pipeline cfg = config.pipeline();
        List<HistoricalDeal> past = history != null ? history : List.of();

        Map<PipelineStage, List<Double>> observed = observedDurations(past);
        Map<PipelineStage, Double> durations = new EnumMap<>(PipelineStage.class);
        Set<PipelineStage> fromHistory = EnumSet.noneOf(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.activeStages()) {
            List<Double> samples = observed.get(stage);
            if (samples != null && !samples.isEmpty()) {
                durations.put(stage, NumericUtils.mean(samples));
                fromHistory.add(stage);
            } else {
                durations.put(stage, cfg.getBaselineDays().getOrDefault(stage, 30.0));
            }
        }

        double total = durations.values().stream().mapToDouble(Double::doubleValue).sum();
        double efficiency = NumericUtils.clamp(cfg.getEfficiencyCeiling() - total / 7,
            cfg.getEfficiencyMin(), cfg.getEfficiencyMax());

        PipelineVelocity velocity = PipelineVelocity.builder()
            .averageDaysPerStage(durations)
            .stagesFromHistory(fromHistory)
            .totalPipelineDuration(total)
            .velocityTrend(trend(past))
            .bottleneckStages(detectBottlenecks(durations))
            .congestedStages(congestedStages(activeDeals != null ? activeDeals : List.of()))
            .efficiencyScore(efficiency)
            .build();

        log.info("Pipeline velocity: total={}d efficiency={} trend={} bottlenecks={} congested={} ({} stages from history)",
            String.format("%.1f", total), String.format("%.0f", efficiency), velocity.getVelocityTrend(),
            velocity.getBottleneckStages(), velocity.getCongestedStages(), fromHistory.size());
        return velocity;
    }

    /**
     * Stages whose duration is strictly greater than multiplier × mean of all durations.
     * Computed as sum × multiplier / count so a value sitting exactly on the threshold compares equal.
     */
    public List<PipelineStage> detectBottlenecks(Map<PipelineStage, Double> durations) {
        if (durations.isEmpty()) return List.of();
        double sum = durations.values().stream().mapToDouble(Double::doubleValue).sum();
        double threshold = sum * config.pipeline().getBottleneckMultiplier() / durations.size();
        List<PipelineStage> bottlenecks = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            Double d = durations.get(stage);
            if (d != null && d > threshold) bottlenecks.add(stage);
        }
        return bottlenecks;
    }

    /** Stages holding more than the configured share of active deals. */
    public List<PipelineStage> congestedStages(List<PipelineDeal> deals) {
        List<PipelineDeal> active = deals.stream().filter(PipelineDeal::isActive).toList();
        if (active.isEmpty()) return List.of();
        Map<PipelineStage, Integer> counts = new EnumMap<>(PipelineStage.class);
        active.forEach(d -> counts.merge(d.getStage(), 1, Integer::sum));
        double share = config.pipeline().getCongestionShare();
        List<PipelineStage> congested = new ArrayList<>();
        counts.forEach((stage, count) -> {
            if ((double) count / active.size() > share) congested.add(stage);
        });
        return congested;
    }

    // ── History ───────────────────────────────────────────────────────────────

    /** Days between entering a non-terminal stage and entering the next recorded stage. */
    Map<PipelineStage, List<Double>> observedDurations(List<HistoricalDeal> history) {
        Map<PipelineStage, List<Double>> observed = new EnumMap<>(PipelineStage.class);
        for (HistoricalDeal deal : history) {
            List<StageHistoryEntry> entries = deal.stageHistory();
            for (int i = 0; i < entries.size() - 1; i++) {
                StageHistoryEntry entry = entries.get(i);
                if (entry.stage().isTerminal()) continue;
                double days = HistoricalDeal.days(entry.timestamp(), entries.get(i + 1).timestamp());
                observed.computeIfAbsent(entry.stage(), k -> new ArrayList<>()).add(days);
            }
        }
        return observed;
    }

    /**
     * Least-squares slope of cycle time against completion date. The drift across the
     * observed span, relative to the mean cycle time, decides the trend.
     */
    VelocityTrend trend(List<HistoricalDeal> history) {
        DealIntelConfig.Pipeline cfg = config.pipeline();
        List<HistoricalDeal> completed = history.stream()
            .filter(d -> d.stageHistory().size() >= 2)
            .toList();
        if (completed.size() < cfg.getTrendMinDeals()) return VelocityTrend.STABLE;

        double[] x = new double[completed.size()];
        double[] y = new double[completed.size()];
        for (int i = 0; i < completed.size(); i++) {
            LocalDateTime done = completed.get(i).completedAt();
            x[i] = done.toEpochSecond(ZoneOffset.UTC) / 86_400.0;
            y[i] = completed.get(i).cycleDays();
        }
        double meanCycle = 0;
        for (double v : y) meanCycle += v;
        meanCycle /= y.length;
        if (meanCycle <= 0) return VelocityTrend.STABLE;

        double minX = x[0], maxX = x[0];
        for (double v : x) { minX = Math.min(minX, v); maxX = Math.max(maxX, v); }
        double drift = NumericUtils.linearSlope(x, y) * (maxX - minX) / meanCycle;

        if (drift > cfg.getTrendBand()) return VelocityTrend.DECREASING;
        if (drift < -cfg.getTrendBand()) return VelocityTrend.INCREASING;
        return VelocityTrend.STABLE;
    }
}
