package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.RoiCategory;
import com.jay.dealintel.model.enums.SynergyType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Integration ROI against cost, industry benchmark and cost/benefit scenarios. Percentages throughout. */
@Value
@Builder
public class RoiAnalysis {

    double basicRoiPercentage;
    double riskAdjustedRoiPercentage;
    double annualizedRoiPercentage;
    double roiVsBenchmark;
    double industryBenchmark;
    double netValueCreated;
    PaybackPeriod paybackPeriod;
    ValueDrivers valueDrivers;
    Sensitivity sensitivity;
    RoiCategory roiCategory;

    public record Contribution(double absoluteValue, double percentageContribution) {}

    /** Empty contributions when nothing has been realized. */
    public record ValueDrivers(Map<SynergyType, Contribution> contributions,
                               List<SynergyType> topDrivers,
                               int diversificationScore) {
        public static ValueDrivers none() {
            return new ValueDrivers(Map.of(), List.of(), 0);
        }
    }

    public record Sensitivity(double baseCaseRoi,
                              Map<String, Double> scenarios,
                              Map<String, Double> variables,
                              double minimumRoi,
                              double maximumRoi) {}
}
