package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.SynergyType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Portfolio roll-up over a measurement window. Recomputed on demand, never stored.
 */
@Value
@Builder
public class ValueCreationMetrics {

    String metricsId;
    String integrationId;
    LocalDate windowStart;
    LocalDate windowEnd;

    double totalSynergiesIdentified;
    double totalSynergiesRealized;
    double realizationRate;
    double integrationCost;
    double roiPercentage;

    // "yyyy-MM" → value expected to be flowing that month
    Map<String, Double> valueCreationTimeline;
    Map<SynergyType, Double> synergyBreakdown;
    PerformanceVsPlan performanceVsPlan;

    double riskAdjustedValue;
    double netPresentValue;
    PaybackPeriod paybackPeriod;
}
