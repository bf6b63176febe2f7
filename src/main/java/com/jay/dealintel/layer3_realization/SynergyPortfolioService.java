package com.jay.dealintel.layer3_realization;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.exception.PortfolioNotFoundException;
import com.jay.dealintel.layer2_synergy.SynergyIdentificationEngine;
import com.jay.dealintel.layer2_synergy.SynergyValuationEngine;
import com.jay.dealintel.model.CompanyProfile;
import com.jay.dealintel.model.IntegrationCostProfile;
import com.jay.dealintel.model.MarketData;
import com.jay.dealintel.model.MeasurementWindow;
import com.jay.dealintel.model.RealizationPeriod;
import com.jay.dealintel.model.RoiAnalysis;
import com.jay.dealintel.model.SynergyOpportunity;
import com.jay.dealintel.model.SynergyRealization;
import com.jay.dealintel.model.ValueCreationMetrics;
import com.jay.dealintel.model.ValueDistribution;
import com.jay.dealintel.model.enums.RealizationStatus;
import com.jay.dealintel.model.enums.SynergyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Layer 3 — Synergy portfolio management.
 * Keeps each integration's identified synergies in memory and ties identification,
 * valuation, realization tracking and ROI together per integration id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynergyPortfolioService {

    static final int DASHBOARD_LOOKBACK_DAYS = 90;
    static final int DASHBOARD_ROI_PERIOD_MONTHS = 24;
    static final double HIGH_CONFIDENCE = 0.8;

    private static final List<String> NEXT_STEPS = List.of(
        "Review and approve synergy opportunities",
        "Assign synergy owners and teams",
        "Develop detailed realization plans",
        "Set up tracking and monitoring"
    );

    private final DealIntelConfig config;
    private final SynergyIdentificationEngine identificationEngine;
    private final SynergyValuationEngine valuationEngine;
    private final ValueRealizationTracker tracker;
    private final RoiAnalyzer roiAnalyzer;

    private final Map<String, IntegrationPortfolio> portfolios = new ConcurrentHashMap<>();

    public record InitiationRequest(CompanyProfile target, CompanyProfile acquirer,
                                    MarketData marketData, String industry) {}

    public record IntegrationPortfolio(String integrationId, String industry, List<SynergyOpportunity> synergies,
                                       Map<String, ValueDistribution> valuations, LocalDateTime initiatedAt) {}

    public record PortfolioInitiation(String integrationId, int synergiesIdentified, double totalSynergyValue,
                                      int highConfidenceSynergies, Map<SynergyType, Long> synergyBreakdown,
                                      List<ValueDistribution> valuations, ValueCreationMetrics initialMetrics,
                                      List<String> nextSteps) {}

    public record SynergyDashboard(String integrationId, LocalDateTime generatedAt, int totalSynergies,
                                   ValueCreationMetrics metrics, RoiAnalysis roiAnalysis,
                                   Map<RealizationStatus, Long> statusBreakdown) {}

    // ── Initiation ────────────────────────────────────────────────────────────

    public PortfolioInitiation initiate(String integrationId, InitiationRequest request) {
        List<SynergyOpportunity> synergies = identificationEngine.identify(request.target(), request.acquirer());
        Map<String, ValueDistribution> valuations = synergies.stream()
            .collect(Collectors.toMap(SynergyOpportunity::getSynergyId,
                s -> valuationEngine.quantify(s, request.marketData()),
                (a, b) -> a, LinkedHashMap::new));

        String industry = request.industry() != null ? request.industry()
            : request.target() != null ? request.target().getIndustry() : null;
        IntegrationPortfolio portfolio = new IntegrationPortfolio(integrationId, industry,
            List.copyOf(synergies), valuations, LocalDateTime.now());
        if (portfolios.put(integrationId, portfolio) != null) {
            log.warn("Integration {} re-initiated, previous synergy portfolio replaced", integrationId);
        }

        ValueCreationMetrics initial = tracker.portfolioMetrics(integrationId, synergies, MeasurementWindow.nextDays(30));

        Map<SynergyType, Long> breakdown = new EnumMap<>(SynergyType.class);
        Arrays.stream(SynergyType.values()).forEach(t -> breakdown.put(t, 0L));
        synergies.forEach(s -> breakdown.merge(s.getSynergyType(), 1L, Long::sum));

        double total = synergies.stream().mapToDouble(SynergyOpportunity::getEstimatedValue).sum();
        int highConfidence = (int) synergies.stream().filter(s -> s.getConfidenceLevel() >= HIGH_CONFIDENCE).count();
        log.info("Integration {} initiated: {} synergies worth {}", integrationId, synergies.size(), Math.round(total));
        return new PortfolioInitiation(integrationId, synergies.size(), total, highConfidence, breakdown,
            List.copyOf(valuations.values()), initial, NEXT_STEPS);
    }

    // ── Lifecycle & tracking ──────────────────────────────────────────────────

    public IntegrationPortfolio portfolio(String integrationId) {
        IntegrationPortfolio portfolio = portfolios.get(integrationId);
        if (portfolio == null) throw new PortfolioNotFoundException(integrationId);
        return portfolio;
    }

    public Set<String> integrationIds() {
        return Set.copyOf(portfolios.keySet());
    }

    public SynergyOpportunity transition(String integrationId, String synergyId, RealizationStatus next) {
        SynergyOpportunity synergy = synergy(integrationId, synergyId);
        RealizationStatus previous = synergy.getStatus();
        synergy.transitionTo(next);
        log.info("Synergy {} in {}: {} -> {}", synergyId, integrationId, previous, next);
        return synergy;
    }

    public SynergyRealization record(String integrationId, String synergyId, RealizationPeriod period) {
        synergy(integrationId, synergyId);
        return tracker.record(synergyId, period);
    }

    private SynergyOpportunity synergy(String integrationId, String synergyId) {
        return portfolio(integrationId).synergies().stream()
            .filter(s -> s.getSynergyId().equals(synergyId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Synergy " + synergyId + " is not part of integration " + integrationId));
    }

    // ── Dashboard ─────────────────────────────────────────────────────────────

    public SynergyDashboard dashboard(String integrationId) {
        return dashboard(integrationId, MeasurementWindow.lastDays(DASHBOARD_LOOKBACK_DAYS));
    }

    public SynergyDashboard dashboard(String integrationId, MeasurementWindow window) {
        IntegrationPortfolio portfolio = portfolio(integrationId);
        ValueCreationMetrics metrics = tracker.portfolioMetrics(integrationId, portfolio.synergies(), window);

        IntegrationCostProfile costProfile = new IntegrationCostProfile(
            metrics.getTotalSynergiesIdentified() * config.synergy().getIntegrationCostRatio(),
            null, DASHBOARD_ROI_PERIOD_MONTHS, portfolio.industry());
        RoiAnalysis roi = roiAnalyzer.analyze(costProfile, metrics);

        Map<RealizationStatus, Long> statuses = portfolio.synergies().stream()
            .collect(Collectors.groupingBy(SynergyOpportunity::getStatus,
                () -> new EnumMap<>(RealizationStatus.class), Collectors.counting()));

        return new SynergyDashboard(integrationId, LocalDateTime.now(), portfolio.synergies().size(),
            metrics, roi, statuses);
    }
}
