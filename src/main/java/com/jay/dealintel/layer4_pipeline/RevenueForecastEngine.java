package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.RevenueForecast;
import com.jay.dealintel.util.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Revenue forecast.
 * Each active deal contributes valuation × close probability of its stage. The total is
 * spread evenly over twelve months with a symmetric best/worst-case band.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevenueForecastEngine {

    static final int MONTHS = 12;
    static final int QUARTERS = 4;

    private static final List<String> KEY_ASSUMPTIONS = List.of(
        "Historical conversion rates apply",
        "No major market disruptions",
        "Current deal velocity maintained"
    );

    private final DealIntelConfig config;

    public RevenueForecast forecast(List<PipelineDeal> deals) {
        DealIntelConfig.Pipeline cfg = config.pipeline();
        List<PipelineDeal> active = deals.stream().filter(PipelineDeal::isActive).toList();

        double pipelineValue = 0;
        double expected = 0;
        for (PipelineDeal deal : active) {
            pipelineValue += deal.getValuation();
            expected += deal.getValuation() * cfg.getCloseProbability().getOrDefault(deal.getStage(), 0.3);
        }

        double spread = cfg.getForecastSpread();
        double perMonth = expected / MONTHS;
        List<RevenueForecast.MonthlyForecast> monthly = new ArrayList<>(MONTHS);
        for (int m = 1; m <= MONTHS; m++) {
            monthly.add(new RevenueForecast.MonthlyForecast(m, perMonth, perMonth * (1 + spread), perMonth * (1 - spread)));
        }

        int monthsPerQuarter = MONTHS / QUARTERS;
        List<RevenueForecast.QuarterlyForecast> quarterly = new ArrayList<>(QUARTERS);
        for (int q = 0; q < QUARTERS; q++) {
            double quarterRevenue = monthly.subList(q * monthsPerQuarter, (q + 1) * monthsPerQuarter).stream()
                .mapToDouble(RevenueForecast.MonthlyForecast::expectedRevenue)
                .sum();
            quarterly.add(new RevenueForecast.QuarterlyForecast(q + 1, quarterRevenue, active.size() / QUARTERS));
        }

        RevenueForecast.AnnualForecast annual = new RevenueForecast.AnnualForecast(expected, pipelineValue,
            NumericUtils.safeDivide(expected, pipelineValue, 0), expected * (1 - spread), expected * (1 + spread));

        log.info("Revenue forecast: {} active deals, pipeline={} expected={}",
            active.size(), Math.round(pipelineValue), Math.round(expected));
        return new RevenueForecast(monthly, quarterly, annual, KEY_ASSUMPTIONS);
    }
}
