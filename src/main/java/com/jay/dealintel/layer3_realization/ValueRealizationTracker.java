package com.jay.dealintel.layer3_realization;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.entity.SynergyRealizationRecord;
import com.jay.dealintel.model.MeasurementWindow;
import com.jay.dealintel.model.PaybackPeriod;
import com.jay.dealintel.model.PerformanceVsPlan;
import com.jay.dealintel.model.RealizationPeriod;
import com.jay.dealintel.model.SynergyOpportunity;
import com.jay.dealintel.model.SynergyRealization;
import com.jay.dealintel.model.ValueCreationMetrics;
import com.jay.dealintel.model.enums.SynergyType;
import com.jay.dealintel.repository.SynergyRealizationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Layer 3 — Value realization tracking.
 * Appends period actuals per synergy and rolls the history up into portfolio metrics.
 *
 * Writes for the same synergy are serialized and must arrive in period order, because
 * the cumulative realization rate is recomputed from the full stored history each time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValueRealizationTracker {

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final int LOCK_STRIPES = 64;

    private final DealIntelConfig config;
    private final SynergyRealizationRepository repository;

    // Fixed lock stripes: one synergy always maps to the same stripe
    private final Object[] synergyLocks = newLockStripes();

    private static Object[] newLockStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) stripes[i] = new Object();
        return stripes;
    }

    private Object lockFor(String synergyId) {
        return synergyLocks[Math.floorMod(synergyId.hashCode(), LOCK_STRIPES)];
    }

    // ── Recording ─────────────────────────────────────────────────────────────

    /**
     * Appends one period for a synergy.
     * @throws IllegalArgumentException if the period does not start after the last recorded one
     */
    public SynergyRealization record(String synergyId, RealizationPeriod period) {
        if (synergyId == null || synergyId.isBlank()) {
            throw new IllegalArgumentException("Synergy id is required");
        }
        if (synergyId.length() > SynergyRealizationRecord.MAX_SYNERGY_ID_LENGTH) {
            throw new IllegalArgumentException(String.format("Synergy id longer than %d characters: %s",
                SynergyRealizationRecord.MAX_SYNERGY_ID_LENGTH, synergyId));
        }
        synchronized (lockFor(synergyId)) {
            List<SynergyRealizationRecord> history = repository.findBySynergyIdOrderByPeriodStartAsc(synergyId);
            if (!history.isEmpty()) {
                LocalDate lastStart = history.get(history.size() - 1).getPeriodStart();
                if (!period.periodStart().isAfter(lastStart)) {
                    throw new IllegalArgumentException(String.format(
                        "Period starting %s is out of order for synergy %s (last period started %s)",
                        period.periodStart(), synergyId, lastStart));
                }
            }

            double totalRealized = period.realizedValue();
            double totalPlanned = period.plannedValue();
            for (SynergyRealizationRecord r : history) {
                totalRealized += r.getRealizedValue();
                totalPlanned += r.getPlannedValue();
            }

            double variance = period.realizedValue() - period.plannedValue();
            double variancePct = period.plannedValue() != 0 ? variance / period.plannedValue() * 100 : 0;

            SynergyRealizationRecord saved = repository.save(SynergyRealizationRecord.builder()
                .realizationId("realization_" + synergyId + "_" + period.periodStart())
                .synergyId(synergyId)
                .periodStart(period.periodStart())
                .periodEnd(period.periodEnd())
                .realizedValue(period.realizedValue())
                .plannedValue(period.plannedValue())
                .variance(variance)
                .variancePercentage(variancePct)
                .realizationRate(cumulativeRate(totalRealized, totalPlanned))
                .contributingFactors(new ArrayList<>(period.contributingFactors()))
                .challengesEncountered(new ArrayList<>(period.challengesEncountered()))
                .lessonsLearned(new ArrayList<>(period.lessonsLearned()))
                .recordedAt(LocalDateTime.now())
                .build());

            log.info("Recorded realization for {} [{} .. {}]: realized={} planned={} cumulative rate={}",
                synergyId, period.periodStart(), period.periodEnd(), period.realizedValue(),
                period.plannedValue(), String.format("%.3f", saved.getRealizationRate()));
            return toModel(saved);
        }
    }

    public List<SynergyRealization> history(String synergyId) {
        return repository.findBySynergyIdOrderByPeriodStartAsc(synergyId).stream()
            .map(ValueRealizationTracker::toModel)
            .toList();
    }

    /** Cumulative realized / planned over the synergy's whole stored history. 0 when nothing is planned. */
    public double realizationRate(String synergyId) {
        double realized = 0, planned = 0;
        for (SynergyRealizationRecord r : repository.findBySynergyIdOrderByPeriodStartAsc(synergyId)) {
            realized += r.getRealizedValue();
            planned += r.getPlannedValue();
        }
        return cumulativeRate(realized, planned);
    }

    /** Number of distinct synergies with at least one recorded period. */
    public long trackedSynergyCount() {
        return repository.countTrackedSynergies();
    }

    private static double cumulativeRate(double realized, double planned) {
        return planned > 0 ? realized / planned : 0;
    }

    // ── Portfolio metrics ─────────────────────────────────────────────────────

    public ValueCreationMetrics portfolioMetrics(String integrationId, List<SynergyOpportunity> synergies,
                                                 MeasurementWindow window) {
        return portfolioMetrics(integrationId, synergies, window, config.synergy().getIntegrationCostRatio());
    }

    /**
     * Rolls up realizations whose period starts inside the window.
     * The integration cost is estimated as integrationCostRatio × total identified value.
     */
    public ValueCreationMetrics portfolioMetrics(String integrationId, List<SynergyOpportunity> synergies,
                                                 MeasurementWindow window, double integrationCostRatio) {
        DealIntelConfig.Synergy cfg = config.synergy();
        Map<String, List<SynergyRealizationRecord>> histories = loadHistories(synergies);

        double totalIdentified = 0;
        double totalRealized = 0;
        Map<SynergyType, Double> breakdown = new EnumMap<>(SynergyType.class);
        for (SynergyOpportunity s : synergies) {
            totalIdentified += s.getEstimatedValue();
            double realized = histories.getOrDefault(s.getSynergyId(), List.of()).stream()
                .filter(r -> window.contains(r.getPeriodStart()))
                .mapToDouble(SynergyRealizationRecord::getRealizedValue)
                .sum();
            totalRealized += realized;
            breakdown.merge(s.getSynergyType(), realized, Double::sum);
        }

        double integrationCost = totalIdentified * integrationCostRatio;
        double roi = integrationCost > 0 ? (totalRealized - integrationCost) / integrationCost * 100 : 0;

        ValueCreationMetrics metrics = ValueCreationMetrics.builder()
            .metricsId("metrics_" + integrationId + "_" + UUID.randomUUID().toString().substring(0, 8))
            .integrationId(integrationId)
            .windowStart(window.start())
            .windowEnd(window.end())
            .totalSynergiesIdentified(totalIdentified)
            .totalSynergiesRealized(totalRealized)
            .realizationRate(totalIdentified > 0 ? totalRealized / totalIdentified : 0)
            .integrationCost(integrationCost)
            .roiPercentage(roi)
            .valueCreationTimeline(valueTimeline(synergies, window))
            .synergyBreakdown(breakdown)
            .performanceVsPlan(performanceVsPlan(synergies, histories, totalIdentified))
            .riskAdjustedValue(riskAdjustedValue(synergies, totalRealized))
            .netPresentValue(portfolioNpv(synergies, totalRealized, cfg.getPortfolioDiscountBase()))
            .paybackPeriod(paybackPeriod(totalRealized, integrationCost, cfg.getPaybackCapMonths()))
            .build();

        log.info("Portfolio {} metrics [{} .. {}]: identified={} realized={} ROI={}% payback={}",
            integrationId, window.start(), window.end(), Math.round(totalIdentified), Math.round(totalRealized),
            String.format("%.1f", roi), metrics.getPaybackPeriod());
        return metrics;
    }

    private Map<String, List<SynergyRealizationRecord>> loadHistories(List<SynergyOpportunity> synergies) {
        if (synergies.isEmpty()) return Map.of();
        List<String> ids = synergies.stream().map(SynergyOpportunity::getSynergyId).toList();
        return repository.findBySynergyIdInOrderByPeriodStartAsc(ids).stream()
            .collect(Collectors.groupingBy(SynergyRealizationRecord::getSynergyId, Collectors.toList()));
    }

    /** Month by month, the monthly value of every synergy due to be realized by then. */
    Map<String, Double> valueTimeline(List<SynergyOpportunity> synergies, MeasurementWindow window) {
        Map<String, Double> timeline = new LinkedHashMap<>();
        LocalDate current = window.start();
        while (!current.isAfter(window.end())) {
            double monthValue = 0;
            for (SynergyOpportunity s : synergies) {
                LocalDate due = s.getTargetRealizationDate();
                if (due != null && !due.isAfter(current)) {
                    monthValue += s.getEstimatedValue() / Math.max(1, s.getRealizationTimelineMonths());
                }
            }
            timeline.put(current.format(MONTH_KEY), monthValue);
            current = current.withDayOfMonth(1).plusMonths(1);
        }
        return timeline;
    }

    private PerformanceVsPlan performanceVsPlan(List<SynergyOpportunity> synergies,
                                                Map<String, List<SynergyRealizationRecord>> histories,
                                                double totalPlanned) {
        if (synergies.isEmpty()) return new PerformanceVsPlan(0, 0, 0);
        double floor = config.synergy().getOnTrackVarianceFloorPct();
        double latestRealized = 0;
        int onTrack = 0, delayed = 0;
        for (SynergyOpportunity s : synergies) {
            List<SynergyRealizationRecord> history = histories.getOrDefault(s.getSynergyId(), List.of());
            if (history.isEmpty()) continue;
            SynergyRealizationRecord latest = history.get(history.size() - 1);
            latestRealized += latest.getRealizedValue();
            if (latest.getVariancePercentage() >= floor) onTrack++;
            else delayed++;
        }
        int n = synergies.size();
        return new PerformanceVsPlan(
            totalPlanned > 0 ? latestRealized / totalPlanned : 0,
            (double) onTrack / n,
            (double) delayed / n);
    }

    /** Realized value scaled by the value-weighted mean confidence of the portfolio. */
    static double riskAdjustedValue(List<SynergyOpportunity> synergies, double totalRealized) {
        double weighted = 0, total = 0;
        for (SynergyOpportunity s : synergies) {
            weighted += s.getEstimatedValue() * s.getConfidenceLevel();
            total += s.getEstimatedValue();
        }
        return total > 0 ? totalRealized * (weighted / total) : 0;
    }

    static double portfolioNpv(List<SynergyOpportunity> synergies, double totalRealized, double discountBase) {
        double meanYears = synergies.isEmpty() ? 1 : synergies.stream()
            .mapToDouble(s -> s.getRealizationTimelineMonths() / 12.0)
            .average().orElse(1);
        return totalRealized / Math.pow(discountBase, meanYears);
    }

    /** Linear realization assumed: realized value is treated as a 12-month run rate. */
    static PaybackPeriod paybackPeriod(double totalRealized, double integrationCost, double capMonths) {
        if (totalRealized <= 0) return PaybackPeriod.unbounded();
        double monthly = totalRealized / 12;
        return PaybackPeriod.of(Math.min(integrationCost / monthly, capMonths));
    }

    private static SynergyRealization toModel(SynergyRealizationRecord r) {
        return new SynergyRealization(r.getRealizationId(), r.getSynergyId(), r.getPeriodStart(), r.getPeriodEnd(),
            r.getRealizedValue(), r.getPlannedValue(), r.getVariance(), r.getVariancePercentage(),
            r.getRealizationRate(), List.copyOf(r.getContributingFactors()),
            List.copyOf(r.getChallengesEncountered()), List.copyOf(r.getLessonsLearned()), r.getRecordedAt());
    }
}
