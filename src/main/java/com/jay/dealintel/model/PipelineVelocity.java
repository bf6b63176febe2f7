package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.VelocityTrend;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class PipelineVelocity {

    Map<PipelineStage, Double> averageDaysPerStage;   // active stages only
    Set<PipelineStage> stagesFromHistory;              // the rest came from the baseline table
    double totalPipelineDuration;
    VelocityTrend velocityTrend;
    List<PipelineStage> bottleneckStages;              // dwell time above the mean-based threshold
    List<PipelineStage> congestedStages;               // holding too large a share of active deals
    double efficiencyScore;

    public double daysIn(PipelineStage stage, double fallback) {
        Double days = averageDaysPerStage.get(stage);
        return days != null ? days : fallback;
    }
}
