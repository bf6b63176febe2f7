package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.PipelineStage;

import java.util.List;

public record BottleneckAnalysis(
    PipelineStage stage,
    int dealsAffected,
    double averageDelayDays,      // dwell time beyond the baseline for this stage
    double valueAtStake,
    Level urgency,
    List<String> suggestedActions
) {}
