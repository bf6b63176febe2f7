package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.PredictionConfidence;

import java.util.List;

public record StageTransitionPrediction(
    String dealId,
    PipelineStage currentStage,
    PipelineStage nextStage,
    double probability,
    int estimatedDays,
    PredictionConfidence confidence,
    List<String> keyFactors
) {}
