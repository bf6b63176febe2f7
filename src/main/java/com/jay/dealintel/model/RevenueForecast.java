package com.jay.dealintel.model;

import java.util.List;

/**
 * Probability-weighted revenue from the active pipeline, spread evenly over the next twelve months.
 */
public record RevenueForecast(
    List<MonthlyForecast> monthly,
    List<QuarterlyForecast> quarterly,
    AnnualForecast annual,
    List<String> keyAssumptions
) {
    public record MonthlyForecast(int month, double expectedRevenue, double bestCase, double worstCase) {}

    public record QuarterlyForecast(int quarter, double expectedRevenue, int dealsExpected) {}

    public record AnnualForecast(double expectedRevenue, double pipelineValue, double conversionRate,
                                 double lowerBound, double upperBound) {}
}
