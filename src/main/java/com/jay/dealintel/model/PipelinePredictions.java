package com.jay.dealintel.model;

import java.time.LocalDateTime;
import java.util.List;

public record PipelinePredictions(
    PipelineVelocity velocity,
    List<StageTransitionPrediction> stageTransitions,
    RevenueForecast revenueForecast,
    List<BottleneckAnalysis> bottlenecks,
    List<String> optimizationOpportunities,
    LocalDateTime generatedAt
) {}
