package com.jay.dealintel.model;

/**
 * Quantified value range for one synergy. The most likely value doubles as the
 * risk-adjusted value; NPV discounts it over the realization timeline.
 */
public record ValueDistribution(
    String synergyId,
    double baseValue,
    double conservativeValue,
    double mostLikelyValue,
    double optimisticValue,
    double netPresentValue,
    double riskAdjustment,
    double timelineAdjustment,
    double marketAdjustment
) {
    public double riskAdjustedValue() {
        return mostLikelyValue;
    }
}
