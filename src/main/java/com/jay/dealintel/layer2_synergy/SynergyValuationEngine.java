package com.jay.dealintel.layer2_synergy;

import com.jay.dealintel.model.MarketData;
import com.jay.dealintel.model.SynergyOpportunity;
import com.jay.dealintel.model.ValueDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Layer 2 — Synergy valuation.
 * Turns a synergy's estimated value into a conservative / most-likely / optimistic
 * range and discounts the most-likely value to an NPV over its realization timeline.
 */
@Slf4j
@Service
public class SynergyValuationEngine {

    public ValueDistribution quantify(SynergyOpportunity opportunity, MarketData marketData) {
        MarketData market = marketData != null ? marketData : MarketData.defaults();
        double base = opportunity.getEstimatedValue();
        double confidence = opportunity.getConfidenceLevel();
        int months = opportunity.getRealizationTimelineMonths();

        double riskAdj = riskAdjustment(opportunity.riskCount());
        double timelineAdj = timelineAdjustment(months);
        double marketAdj = 1 + market.marketGrowthRate();

        double conservative = base * confidence * riskAdj * timelineAdj;
        double optimistic = base * marketAdj * 1.2;
        double mostLikely = base * confidence * riskAdj;
        double npv = npv(mostLikely, months, market.discountRate());

        log.debug("Synergy {} valued: conservative={} likely={} optimistic={} npv={}",
            opportunity.getSynergyId(), Math.round(conservative), Math.round(mostLikely),
            Math.round(optimistic), Math.round(npv));
        return new ValueDistribution(opportunity.getSynergyId(), base, conservative, mostLikely,
            optimistic, npv, riskAdj, timelineAdj, marketAdj);
    }

    public static double riskAdjustment(int riskCount) {
        return Math.max(0.7, 1.0 - riskCount * 0.05);
    }

    public static double timelineAdjustment(int timelineMonths) {
        return Math.max(0.8, 1.0 - (timelineMonths / 60.0) * 0.2);
    }

    /**
     * Discounts an annual value paid in equal monthly installments over the timeline,
     * at annualDiscountRate / 12 per month. Zero or negative timelines yield 0.
     */
    public static double npv(double annualValue, int timelineMonths, double annualDiscountRate) {
        if (timelineMonths <= 0) return 0;
        double monthlyValue = annualValue / 12;
        double monthlyRate = annualDiscountRate / 12;
        double npv = 0;
        for (int month = 1; month <= timelineMonths; month++) {
            npv += monthlyValue / Math.pow(1 + monthlyRate, month);
        }
        return npv;
    }

    /**
     * NPV per unit of undiscounted value over the timeline. Falls as the timeline or the
     * discount rate grows; 1.0 at a zero rate.
     */
    public static double effectiveDiscountFactor(int timelineMonths, double annualDiscountRate) {
        if (timelineMonths <= 0) return 0;
        return npv(12, timelineMonths, annualDiscountRate) / timelineMonths;
    }
}
