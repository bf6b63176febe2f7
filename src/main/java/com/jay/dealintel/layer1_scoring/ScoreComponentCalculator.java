package com.jay.dealintel.layer1_scoring;

import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.ScoreComponent;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

import static com.jay.dealintel.util.NumericUtils.clampScore;
import static com.jay.dealintel.util.NumericUtils.valueOr;

/**
 * Layer 1 — Component scores.
 * Each dimension starts from a fixed base and applies additive threshold ladders
 * over the deal attributes, then clamps to 0 – 100. Absent attributes take neutral
 * defaults and never raise. Risk is reported as-is (higher = riskier).
 */
@Component
public class ScoreComponentCalculator {

    static final double FINANCIAL_BASE = 50;
    static final double STRATEGIC_BASE = 50;
    static final double MARKET_BASE = 50;
    static final double RISK_BASE = 30;
    static final double EXECUTION_BASE = 60;
    static final double TEAM_BASE = 50;

    public Map<ScoreComponent, Double> scoreAll(DealAttributes deal) {
        Map<ScoreComponent, Double> scores = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent c : ScoreComponent.values()) {
            scores.put(c, score(c, deal));
        }
        return scores;
    }

    public double score(ScoreComponent component, DealAttributes deal) {
        return switch (component) {
            case FINANCIAL -> financial(deal);
            case STRATEGIC -> strategic(deal);
            case MARKET    -> market(deal);
            case RISK      -> risk(deal);
            case EXECUTION -> execution(deal);
            case TEAM      -> team(deal);
        };
    }

    public double financial(DealAttributes deal) {
        double score = FINANCIAL_BASE;

        // ── Revenue growth ────────────────────────────────────────────────────
        double growth = valueOr(deal.getRevenueGrowthRate(), 0);
        if (growth > 20) score += 20;
        else if (growth > 10) score += 10;
        else if (growth < 0) score -= 15;

        // ── Profitability ─────────────────────────────────────────────────────
        double margin = valueOr(deal.getEbitdaMargin(), 0);
        if (margin > 15) score += 15;
        else if (margin > 5) score += 8;
        else if (margin < 0) score -= 20;

        // ── Leverage ──────────────────────────────────────────────────────────
        double debtToEquity = valueOr(deal.getDebtToEquity(), 1.0);
        if (debtToEquity < 0.5) score += 10;
        else if (debtToEquity > 2.0) score -= 15;

        return clampScore(score);
    }

    public double strategic(DealAttributes deal) {
        double score = STRATEGIC_BASE;

        // Rating is 1 – 5; anything outside is pinned to the nearest end
        int fit = deal.getStrategicFit() != null ? Math.max(1, Math.min(5, deal.getStrategicFit())) : 3;
        score += (fit - 3) * 15;

        if (deal.getMarketPosition() != null) {
            score += switch (deal.getMarketPosition()) {
                case LEADER     -> 20;
                case CHALLENGER -> 10;
                case NICHE      -> 5;
                case FOLLOWER, UNKNOWN -> 0;
            };
        }

        if (deal.getSynergyPotential() == Level.HIGH) score += 15;
        else if (deal.getSynergyPotential() == Level.LOW) score -= 10;

        return clampScore(score);
    }

    public double market(DealAttributes deal) {
        double score = MARKET_BASE;

        if (deal.getMarketSize() != null) {
            score += switch (deal.getMarketSize()) {
                case LARGE   -> 20;
                case MEDIUM  -> 10;
                case SMALL   -> -5;
                case UNKNOWN -> 0;
            };
        }

        double growth = valueOr(deal.getMarketGrowth(), 5);
        if (growth > 15) score += 15;
        else if (growth > 5) score += 8;
        else if (growth < 0) score -= 15;

        Level competition = deal.getCompetitiveIntensity() != null ? deal.getCompetitiveIntensity() : Level.MEDIUM;
        if (competition == Level.LOW) score += 15;
        else if (competition == Level.HIGH) score -= 10;

        return clampScore(score);
    }

    /** Higher = riskier. Inverted by the scoring engine before weighting. */
    public double risk(DealAttributes deal) {
        double score = RISK_BASE;

        if (valueOr(deal.getRevenueConcentration(), 0) > 50) score += 15;
        if (valueOr(deal.getDebtToEquity(), 1.0) > 2.0) score += 20;

        if (deal.getManagementRisk() == Level.HIGH) score += 15;
        else if (deal.getManagementRisk() == Level.LOW) score -= 5;

        if (deal.getRegulatoryRisk() == Level.HIGH) score += 20;
        else if (deal.getRegulatoryRisk() == Level.LOW) score -= 10;

        if (deal.getMarketVolatility() == Level.HIGH) score += 10;

        return clampScore(score);
    }

    public double execution(DealAttributes deal) {
        double score = EXECUTION_BASE;

        Level complexity = deal.getDealComplexity() != null ? deal.getDealComplexity() : Level.MEDIUM;
        if (complexity == Level.LOW) score += 15;
        else if (complexity == Level.HIGH) score -= 20;

        if (deal.getIntegrationRisk() == Level.LOW) score += 10;
        else if (deal.getIntegrationRisk() == Level.HIGH) score -= 15;

        if (deal.getTimelinePressure() == Level.LOW) score += 10;
        else if (deal.getTimelinePressure() == Level.HIGH) score -= 10;

        return clampScore(score);
    }

    public double team(DealAttributes deal) {
        double score = TEAM_BASE;

        if (deal.getManagementExperience() == Level.HIGH) score += 25;
        else if (deal.getManagementExperience() == Level.LOW) score -= 15;

        score += valueOr(deal.getTrackRecordScore(), 0.5) * 20;
        score += valueOr(deal.getCulturalFitScore(), 0.5) * 10;

        return clampScore(score);
    }
}
