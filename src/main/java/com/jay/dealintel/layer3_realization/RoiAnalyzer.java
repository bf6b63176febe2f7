package com.jay.dealintel.layer3_realization;

import com.jay.dealintel.model.IntegrationCostProfile;
import com.jay.dealintel.model.RoiAnalysis;
import com.jay.dealintel.model.ValueCreationMetrics;
import com.jay.dealintel.model.enums.RoiCategory;
import com.jay.dealintel.model.enums.SynergyType;
import com.jay.dealintel.util.NumericUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Layer 3 — Integration ROI.
 * Compares realized synergy value with integration cost, adjusts for risk and
 * duration, benchmarks against the industry and runs cost/benefit scenarios.
 */
@Slf4j
@Service
public class RoiAnalyzer {

    static final double DEFAULT_BENCHMARK = 12.5;

    private static final Map<String, Double> INDUSTRY_BENCHMARKS = Map.of(
        "technology", 15.5,
        "healthcare", 12.8,
        "financial_services", 11.2,
        "manufacturing", 13.5,
        "retail", 10.8,
        "energy", 14.2
    );

    // scenario → {investment change, benefits change}
    private static final Map<String, double[]> SCENARIOS = scenarios();

    public RoiAnalysis analyze(IntegrationCostProfile profile, ValueCreationMetrics metrics) {
        double investment = profile.totalIntegrationCost();
        double benefits = metrics.getTotalSynergiesRealized();

        double basicRoi = roi(benefits, investment);
        double riskAdjusted = basicRoi * (1 - profile.riskFactor());
        double years = profile.integrationPeriodMonths() / 12.0;
        double annualized = years > 0 ? basicRoi / years : basicRoi;
        double benchmark = industryBenchmark(profile.industry());

        RoiAnalysis analysis = RoiAnalysis.builder()
            .basicRoiPercentage(NumericUtils.round(basicRoi, 2))
            .riskAdjustedRoiPercentage(NumericUtils.round(riskAdjusted, 2))
            .annualizedRoiPercentage(NumericUtils.round(annualized, 2))
            .roiVsBenchmark(NumericUtils.round(basicRoi - benchmark, 2))
            .industryBenchmark(benchmark)
            .netValueCreated(benefits - investment)
            .paybackPeriod(metrics.getPaybackPeriod())
            .valueDrivers(valueDrivers(metrics))
            .sensitivity(sensitivity(investment, benefits))
            .roiCategory(RoiCategory.classify(basicRoi, benchmark))
            .build();

        log.info("ROI for {}: basic={}% vs {} benchmark {}% -> {}", metrics.getIntegrationId(),
            analysis.getBasicRoiPercentage(), profile.industry(), benchmark, analysis.getRoiCategory());
        return analysis;
    }

    public static double industryBenchmark(String industry) {
        if (industry == null) return DEFAULT_BENCHMARK;
        String key = industry.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return INDUSTRY_BENCHMARKS.getOrDefault(key, DEFAULT_BENCHMARK);
    }

    /** Percentage return; 0 when there is no investment to measure against. */
    static double roi(double benefits, double investment) {
        return investment > 0 ? (benefits - investment) / investment * 100 : 0;
    }

    RoiAnalysis.ValueDrivers valueDrivers(ValueCreationMetrics metrics) {
        double total = metrics.getTotalSynergiesRealized();
        if (total <= 0 || metrics.getSynergyBreakdown() == null) return RoiAnalysis.ValueDrivers.none();

        Map<SynergyType, RoiAnalysis.Contribution> contributions = new EnumMap<>(SynergyType.class);
        metrics.getSynergyBreakdown().forEach((type, value) ->
            contributions.put(type, new RoiAnalysis.Contribution(value, value / total * 100)));

        List<SynergyType> top = contributions.entrySet().stream()
            .sorted(Map.Entry.<SynergyType, RoiAnalysis.Contribution>comparingByValue(
                Comparator.comparingDouble(RoiAnalysis.Contribution::absoluteValue)).reversed())
            .limit(3)
            .map(Map.Entry::getKey)
            .toList();
        int diversification = (int) contributions.values().stream()
            .filter(c -> c.percentageContribution() > 10)
            .count();
        return new RoiAnalysis.ValueDrivers(contributions, top, diversification);
    }

    RoiAnalysis.Sensitivity sensitivity(double investment, double benefits) {
        Map<String, Double> scenarioRois = new LinkedHashMap<>();
        SCENARIOS.forEach((name, change) -> scenarioRois.put(name, NumericUtils.round(
            roi(benefits * (1 + change[1]), investment * (1 + change[0])), 2)));

        double baseRoi = roi(benefits, investment);
        Map<String, Double> variables = new LinkedHashMap<>();
        variables.put("investment_10pct_increase", NumericUtils.round(roi(benefits, investment * 1.1), 2));
        variables.put("benefits_10pct_decrease", NumericUtils.round(roi(benefits * 0.9, investment), 2));
        variables.put("timeline_delay_6months", NumericUtils.round(baseRoi * 0.9, 2));

        double min = scenarioRois.values().stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = scenarioRois.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        return new RoiAnalysis.Sensitivity(NumericUtils.round(baseRoi, 2), scenarioRois, variables, min, max);
    }

    private static Map<String, double[]> scenarios() {
        Map<String, double[]> s = new LinkedHashMap<>();
        s.put("optimistic",  new double[] {-0.10,  0.20});
        s.put("pessimistic", new double[] { 0.20, -0.30});
        s.put("realistic",   new double[] { 0.05, -0.10});
        return s;
    }
}
