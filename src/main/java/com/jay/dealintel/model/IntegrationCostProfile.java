package com.jay.dealintel.model;

/**
 * Cost side of an integration for ROI analysis. Null fields fall back to a 0.2 risk
 * factor, a 12-month integration period and the "technology" industry.
 */
public record IntegrationCostProfile(
    double totalIntegrationCost,
    Double riskFactor,
    Integer integrationPeriodMonths,
    String industry
) {
    public IntegrationCostProfile {
        if (riskFactor == null) riskFactor = 0.2;
        if (integrationPeriodMonths == null) integrationPeriodMonths = 12;
        if (industry == null || industry.isBlank()) industry = "technology";
    }
}
