package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.DealRecommendation;
import com.jay.dealintel.model.enums.DealRiskLevel;
import com.jay.dealintel.model.enums.ScoreComponent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of scoring one deal. Built once by DealScoringEngine and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class DealScore {

    String dealId;

    // Component scores (0 – 100). Risk: higher = riskier.
    double financialScore;
    double strategicScore;
    double marketScore;
    double riskScore;
    double executionScore;
    double teamScore;

    // Weighted contribution of each component to the overall score
    Map<ScoreComponent, Double> contributions;

    double overallScore;
    double confidence;
    DealRiskLevel riskLevel;
    DealRecommendation recommendation;
    @Singular List<String> keyStrengths;
    @Singular List<String> keyConcerns;
    @Singular List<String> nextActions;
    ScoringWeights weights;

    public double component(ScoreComponent component) {
        return switch (component) {
            case FINANCIAL -> financialScore;
            case STRATEGIC -> strategicScore;
            case MARKET    -> marketScore;
            case RISK      -> riskScore;
            case EXECUTION -> executionScore;
            case TEAM      -> teamScore;
        };
    }

    public String breakdownString() {
        return String.format("F:%.0f S:%.0f M:%.0f R:%.0f E:%.0f T:%.0f -> %.1f",
            financialScore, strategicScore, marketScore, riskScore, executionScore, teamScore, overallScore);
    }
}
