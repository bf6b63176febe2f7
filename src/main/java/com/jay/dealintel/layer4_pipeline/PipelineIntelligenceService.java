package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.model.BottleneckAnalysis;
import com.jay.dealintel.model.HistoricalDeal;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelinePredictions;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.RevenueForecast;
import com.jay.dealintel.model.StageTransitionPrediction;
import com.jay.dealintel.model.enums.VelocityTrend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Orchestrates velocity, transitions, forecast and bottlenecks for one
 * snapshot of the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineIntelligenceService {

    static final int MAX_OPPORTUNITIES = 5;

    private final PipelineVelocityAnalyzer velocityAnalyzer;
    private final StageTransitionPredictor transitionPredictor;
    private final RevenueForecastEngine forecastEngine;
    private final BottleneckAnalyzer bottleneckAnalyzer;

    public PipelinePredictions analyze(List<PipelineDeal> deals, List<HistoricalDeal> history) {
        List<PipelineDeal> snapshot = deals != null ? deals : List.of();
        log.info("Analysing pipeline: {} deals, {} historical", snapshot.size(), history != null ? history.size() : 0);

        PipelineVelocity velocity = velocityAnalyzer.analyze(snapshot, history);
        List<StageTransitionPrediction> transitions = transitionPredictor.predictAll(snapshot, velocity);
        RevenueForecast forecast = forecastEngine.forecast(snapshot);
        List<BottleneckAnalysis> bottlenecks = bottleneckAnalyzer.analyze(snapshot, velocity);

        return new PipelinePredictions(velocity, transitions, forecast, bottlenecks,
            optimizationOpportunities(velocity, bottlenecks), LocalDateTime.now());
    }

    List<String> optimizationOpportunities(PipelineVelocity velocity, List<BottleneckAnalysis> bottlenecks) {
        List<String> opportunities = new ArrayList<>();
        if (velocity.getEfficiencyScore() < 70) {
            opportunities.add("Implement pipeline automation tools");
            opportunities.add("Standardize stage transition criteria");
        }
        if (bottlenecks.size() > 2) {
            opportunities.add("Conduct comprehensive process review");
            opportunities.add("Rebalance team resources across stages");
        }
        if (velocity.getVelocityTrend() == VelocityTrend.DECREASING) {
            opportunities.add("Investigate process degradation causes");
            opportunities.add("Refresh team training and tools");
        }
        if (velocity.getTotalPipelineDuration() > 150) {
            opportunities.add("Parallel process development");
            opportunities.add("Early stakeholder engagement");
        }
        return opportunities.size() > MAX_OPPORTUNITIES
            ? List.copyOf(opportunities.subList(0, MAX_OPPORTUNITIES))
            : opportunities;
    }
}
