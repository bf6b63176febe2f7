package com.jay.dealintel.controller;

import com.jay.dealintel.cache.ScoreReportCache;
import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.layer1_scoring.DealScoringEngine;
import com.jay.dealintel.layer2_synergy.SynergyIdentificationEngine;
import com.jay.dealintel.layer2_synergy.SynergyValuationEngine;
import com.jay.dealintel.layer3_realization.SynergyPortfolioService;
import com.jay.dealintel.layer3_realization.ValueRealizationTracker;
import com.jay.dealintel.layer4_pipeline.PipelineIntelligenceService;
import com.jay.dealintel.layer4_pipeline.RevenueForecastEngine;
import com.jay.dealintel.model.CompanyProfile;
import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;
import com.jay.dealintel.model.HistoricalDeal;
import com.jay.dealintel.model.MarketData;
import com.jay.dealintel.model.MeasurementWindow;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelinePredictions;
import com.jay.dealintel.model.RealizationPeriod;
import com.jay.dealintel.model.RevenueForecast;
import com.jay.dealintel.model.ScoringWeights;
import com.jay.dealintel.model.SynergyOpportunity;
import com.jay.dealintel.model.SynergyRealization;
import com.jay.dealintel.model.ValueDistribution;
import com.jay.dealintel.model.enums.RealizationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST API — deal scoring, synergy management and pipeline intelligence.
 * Request and response bodies use snake_case keys.
 *
 * Endpoints:
 *   GET  /api/status                                             — Service and configuration summary
 *   POST /api/deals/score?profile=                               — Score one deal attribute bag
 *   POST /api/deals/rank?profile=                                — Score and rank many deals
 *   POST /api/synergies/identify                                 — Identify synergies for a target/acquirer pair
 *   POST /api/synergies/quantify                                 — Value one synergy opportunity
 *   GET  /api/synergies/{synergyId}/realizations                 — Realization history of one synergy
 *   POST /api/integrations/{id}                                  — Start tracking an integration
 *   POST /api/integrations/{id}/synergies/{synergyId}/status     — Move a synergy through its lifecycle
 *   POST /api/integrations/{id}/synergies/{synergyId}/realizations — Record one period of actuals
 *   GET  /api/integrations/{id}/dashboard?from=&to=              — Metrics, ROI and status breakdown
 *   POST /api/pipeline/analyze                                   — Velocity, transitions, forecast, bottlenecks
 *   POST /api/pipeline/forecast                                  — Revenue forecast only
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DealIntelligenceController {

    private final DealIntelConfig config;
    private final DealScoringEngine scoringEngine;
    private final ScoreReportCache scoreCache;
    private final SynergyIdentificationEngine identificationEngine;
    private final SynergyValuationEngine valuationEngine;
    private final ValueRealizationTracker realizationTracker;
    private final SynergyPortfolioService portfolioService;
    private final PipelineIntelligenceService pipelineService;
    private final RevenueForecastEngine forecastEngine;

    public record IdentifyRequest(Map<String, Object> target, Map<String, Object> acquirer) {}

    public record QuantifyRequest(SynergyOpportunity opportunity, MarketData marketData) {}

    public record PipelineRequest(List<Map<String, Object>> deals, List<HistoricalDeal> history) {}

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
            "status", "RUNNING",
            "timestamp", LocalDateTime.now().toString(),
            "weight_profiles", config.scoring().getWeightProfiles().keySet(),
            "default_profile", config.scoring().getDefaultProfile(),
            "cached_score_reports", scoreCache.size(),
            "integrations", portfolioService.integrationIds().size(),
            "tracked_synergies", realizationTracker.trackedSynergyCount()
        ));
    }

    // ── Deal scoring ───────────────────────────────────────────────────────────

    @PostMapping("/deals/score")
    public ResponseEntity<DealScore> scoreDeal(@RequestBody Map<String, Object> attributes,
                                               @RequestParam(required = false) String profile) {
        DealAttributes deal = DealAttributes.fromMap(attributes);
        ScoringWeights weights = weights(profile);
        return ResponseEntity.ok(scoreCache.getOrCompute(deal, weights, () -> scoringEngine.score(deal, weights)));
    }

    @PostMapping("/deals/rank")
    public ResponseEntity<List<DealScore>> rankDeals(@RequestBody List<Map<String, Object>> deals,
                                                     @RequestParam(required = false) String profile) {
        List<DealAttributes> attrs = deals.stream().map(DealAttributes::fromMap).toList();
        return ResponseEntity.ok(scoringEngine.rankDeals(attrs, weights(profile)));
    }

    private ScoringWeights weights(String profile) {
        return profile == null || profile.isBlank() ? config.weights() : config.weightProfile(profile);
    }

    // ── Synergies ──────────────────────────────────────────────────────────────

    @PostMapping("/synergies/identify")
    public ResponseEntity<List<SynergyOpportunity>> identifySynergies(@RequestBody IdentifyRequest request) {
        return ResponseEntity.ok(identificationEngine.identify(
            CompanyProfile.fromMap(request.target()), CompanyProfile.fromMap(request.acquirer())));
    }

    @PostMapping("/synergies/quantify")
    public ResponseEntity<ValueDistribution> quantifySynergy(@RequestBody QuantifyRequest request) {
        if (request.opportunity() == null) {
            throw new IllegalArgumentException("opportunity is required");
        }
        return ResponseEntity.ok(valuationEngine.quantify(request.opportunity(), request.marketData()));
    }

    @GetMapping("/synergies/{synergyId}/realizations")
    public ResponseEntity<List<SynergyRealization>> realizationHistory(@PathVariable String synergyId) {
        return ResponseEntity.ok(realizationTracker.history(synergyId));
    }

    // ── Integrations ───────────────────────────────────────────────────────────

    @PostMapping("/integrations/{integrationId}")
    public ResponseEntity<SynergyPortfolioService.PortfolioInitiation> initiate(
            @PathVariable String integrationId,
            @RequestBody SynergyPortfolioService.InitiationRequest request) {
        return ResponseEntity.ok(portfolioService.initiate(integrationId, request));
    }

    @PostMapping("/integrations/{integrationId}/synergies/{synergyId}/status")
    public ResponseEntity<SynergyOpportunity> transition(@PathVariable String integrationId,
                                                         @PathVariable String synergyId,
                                                         @RequestParam RealizationStatus status) {
        return ResponseEntity.ok(portfolioService.transition(integrationId, synergyId, status));
    }

    @PostMapping("/integrations/{integrationId}/synergies/{synergyId}/realizations")
    public ResponseEntity<SynergyRealization> recordRealization(@PathVariable String integrationId,
                                                                @PathVariable String synergyId,
                                                                @RequestBody RealizationPeriod period) {
        return ResponseEntity.ok(portfolioService.record(integrationId, synergyId, period));
    }

    @GetMapping("/integrations/{integrationId}/dashboard")
    public ResponseEntity<SynergyPortfolioService.SynergyDashboard> dashboard(
            @PathVariable String integrationId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (from == null && to == null) {
            return ResponseEntity.ok(portfolioService.dashboard(integrationId));
        }
        LocalDate end = to != null ? to : LocalDate.now();
        LocalDate start = from != null ? from : end.minusDays(90);
        return ResponseEntity.ok(portfolioService.dashboard(integrationId, new MeasurementWindow(start, end)));
    }

    // ── Pipeline ───────────────────────────────────────────────────────────────

    @PostMapping("/pipeline/analyze")
    public ResponseEntity<PipelinePredictions> analyzePipeline(@RequestBody PipelineRequest request) {
        List<PipelineDeal> deals = toDeals(request.deals());
        return ResponseEntity.ok(pipelineService.analyze(deals, request.history()));
    }

    @PostMapping("/pipeline/forecast")
    public ResponseEntity<RevenueForecast> forecast(@RequestBody List<Map<String, Object>> deals) {
        return ResponseEntity.ok(forecastEngine.forecast(toDeals(deals)));
    }

    private static List<PipelineDeal> toDeals(List<Map<String, Object>> raw) {
        return raw == null ? List.of() : raw.stream().map(PipelineDeal::fromMap).toList();
    }
}
