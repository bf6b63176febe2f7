package com.jay.dealintel.layer1_scoring;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;
import com.jay.dealintel.model.ScoringWeights;
import com.jay.dealintel.model.enums.DealRecommendation;
import com.jay.dealintel.model.enums.DealRiskLevel;
import com.jay.dealintel.model.enums.ScoreComponent;
import com.jay.dealintel.util.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Layer 1 — Deal scoring.
 * Combines the six component scores into an overall 0 – 100 score using a weight
 * profile, derives the risk level and recommendation, and measures confidence from
 * how much of the deal's data was actually supplied.
 *
 * Incomplete input never throws; it lowers confidence. Invalid weights do throw.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DealScoringEngine {

    // Field groups whose presence drives confidence
    static final int EXPECTED_FIELD_GROUPS = 6;

    private final DealIntelConfig config;
    private final ScoreComponentCalculator calculator;
    private final List<DealInsightSource> insightSources;

    /** Scores with the configured default weight profile. */
    public DealScore score(DealAttributes deal) {
        return score(deal, config.weights());
    }

    public DealScore score(DealAttributes deal, ScoringWeights weights) {
        weights.validate();
        DealAttributes attrs = deal != null ? deal : new DealAttributes();

        Map<ScoreComponent, Double> components = calculator.scoreAll(attrs);
        Map<ScoreComponent, Double> contributions = contributions(components, weights);
        double overall = NumericUtils.clampScore(NumericUtils.round(
            contributions.values().stream().mapToDouble(Double::doubleValue).sum(), 1));

        double confidence = confidence(attrs);
        DealRiskLevel riskLevel = DealRiskLevel.fromRiskScore(components.get(ScoreComponent.RISK));
        DealRecommendation recommendation = recommend(overall, riskLevel, confidence);

        DealScore ruleBased = DealScore.builder()
            .dealId(attrs.getDealId())
            .financialScore(components.get(ScoreComponent.FINANCIAL))
            .strategicScore(components.get(ScoreComponent.STRATEGIC))
            .marketScore(components.get(ScoreComponent.MARKET))
            .riskScore(components.get(ScoreComponent.RISK))
            .executionScore(components.get(ScoreComponent.EXECUTION))
            .teamScore(components.get(ScoreComponent.TEAM))
            .contributions(contributions)
            .overallScore(overall)
            .confidence(confidence)
            .riskLevel(riskLevel)
            .recommendation(recommendation)
            .keyStrengths(strengths(components))
            .keyConcerns(concerns(components))
            .nextActions(nextActions(components, riskLevel))
            .weights(weights)
            .build();

        DealScore result = enrich(attrs, ruleBased);
        log.debug("Deal {} scored: {} | {} ({})", attrs.getDealId(), result.breakdownString(),
            recommendation, riskLevel);
        return result;
    }

    /** Scores every deal and returns them best first. Equal scores keep input order. */
    public List<DealScore> rankDeals(List<DealAttributes> deals, ScoringWeights weights) {
        ScoringWeights w = weights != null ? weights : config.weights();
        List<DealScore> scores = new ArrayList<>(deals.size());
        for (DealAttributes deal : deals) {
            scores.add(score(deal, w));
        }
        scores.sort(Comparator.comparingDouble(DealScore::getOverallScore).reversed());
        log.info("Ranked {} deals with weights [{}]", scores.size(), w.breakdownString());
        return scores;
    }

    // ── Overall score ─────────────────────────────────────────────────────────

    Map<ScoreComponent, Double> contributions(Map<ScoreComponent, Double> components, ScoringWeights weights) {
        Map<ScoreComponent, Double> contributions = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent c : ScoreComponent.values()) {
            double value = components.get(c);
            if (c == ScoreComponent.RISK) value = 100 - value;
            contributions.put(c, value * weights.weight(c));
        }
        return Collections.unmodifiableMap(contributions);
    }

    /**
     * Threshold ladder, evaluated top-down. Boundary scores fall into the higher bracket.
     */
    public DealRecommendation recommend(double overallScore, DealRiskLevel riskLevel, double confidence) {
        DealIntelConfig.Scoring cfg = config.scoring();
        if (overallScore >= cfg.getProceedThreshold()
                && (riskLevel == DealRiskLevel.LOW || riskLevel == DealRiskLevel.MEDIUM)) {
            return DealRecommendation.PROCEED;
        }
        if (overallScore >= cfg.getCautionThreshold() && riskLevel != DealRiskLevel.CRITICAL) {
            return DealRecommendation.PROCEED_WITH_CAUTION;
        }
        if (overallScore >= cfg.getInvestigateThreshold()) {
            return DealRecommendation.INVESTIGATE_FURTHER;
        }
        if (overallScore < cfg.getDeclineThreshold() && confidence > cfg.getDeclineMinConfidence()) {
            return DealRecommendation.DECLINE;
        }
        return DealRecommendation.NEGOTIATE_TERMS;
    }

    /**
     * Share of expected field groups present, plus a bonus for completed due
     * diligence and for third-party validation. Capped at 1.0.
     */
    public double confidence(DealAttributes deal) {
        int present = 0;
        if (deal.hasFinancials()) present++;
        if (deal.getIndustry() != null && !deal.getIndustry().isBlank()) present++;
        if (deal.getMarketSize() != null) present++;
        if (deal.getManagementExperience() != null) present++;
        if (deal.getCompetitiveIntensity() != null) present++;
        if (deal.getStrategicFit() != null || deal.getMarketPosition() != null) present++;

        double confidence = (double) present / EXPECTED_FIELD_GROUPS;
        double bonus = config.scoring().getVerificationBonus();
        if (deal.dueDiligenceDone()) confidence += bonus;
        if (deal.validatedByThirdParty()) confidence += bonus;
        return Math.min(1.0, NumericUtils.round(confidence, 4));
    }

    // ── Narrative lists ───────────────────────────────────────────────────────

    private List<String> strengths(Map<ScoreComponent, Double> components) {
        double threshold = config.scoring().getStrengthThreshold();
        List<String> strengths = new ArrayList<>();
        for (ScoreComponent c : ScoreComponent.values()) {
            double favourable = c == ScoreComponent.RISK ? 100 - components.get(c) : components.get(c);
            if (favourable >= threshold) strengths.add(strengthText(c));
        }
        return strengths;
    }

    private List<String> concerns(Map<ScoreComponent, Double> components) {
        double threshold = config.scoring().getConcernThreshold();
        List<String> concerns = new ArrayList<>();
        for (ScoreComponent c : ScoreComponent.values()) {
            double favourable = c == ScoreComponent.RISK ? 100 - components.get(c) : components.get(c);
            if (favourable <= threshold) concerns.add(concernText(c));
        }
        return concerns;
    }

    private static String strengthText(ScoreComponent c) {
        return switch (c) {
            case FINANCIAL -> "Strong financial performance";
            case STRATEGIC -> "High strategic fit";
            case MARKET    -> "Attractive market opportunity";
            case RISK      -> "Low overall risk profile";
            case EXECUTION -> "Straightforward execution";
            case TEAM      -> "Experienced management team";
        };
    }

    private static String concernText(ScoreComponent c) {
        return switch (c) {
            case FINANCIAL -> "Deteriorating financial metrics";
            case STRATEGIC -> "Weak strategic alignment";
            case MARKET    -> "Limited market opportunity";
            case RISK      -> "Elevated deal risk";
            case EXECUTION -> "Complex execution and integration";
            case TEAM      -> "Management capability gaps";
        };
    }

    private List<String> nextActions(Map<ScoreComponent, Double> components, DealRiskLevel riskLevel) {
        List<String> actions = new ArrayList<>();
        if (components.get(ScoreComponent.FINANCIAL) < 60) {
            actions.add("Conduct detailed financial due diligence");
            actions.add("Request additional financial documentation");
        }
        if (riskLevel == DealRiskLevel.HIGH || riskLevel == DealRiskLevel.CRITICAL) {
            actions.add("Prepare a risk mitigation plan before proceeding");
        }
        if (components.get(ScoreComponent.STRATEGIC) < 70) {
            actions.add("Reassess strategic alignment and synergies");
            actions.add("Meet with management team for strategic discussion");
        }
        if (components.get(ScoreComponent.MARKET) < 60) {
            actions.add("Conduct comprehensive market analysis");
            actions.add("Validate market assumptions with third-party research");
        }
        return limit(actions);
    }

    private List<String> limit(List<String> actions) {
        int max = config.scoring().getMaxNextActions();
        return actions.size() > max ? new ArrayList<>(actions.subList(0, max)) : actions;
    }

    // ── Enrichment ────────────────────────────────────────────────────────────

    private DealScore enrich(DealAttributes deal, DealScore ruleBased) {
        Set<String> strengths = new LinkedHashSet<>(ruleBased.getKeyStrengths());
        Set<String> concerns = new LinkedHashSet<>(ruleBased.getKeyConcerns());
        Set<String> actions = new LinkedHashSet<>(ruleBased.getNextActions());
        boolean changed = false;

        for (DealInsightSource source : insightSources) {
            Optional<DealInsight> insight;
            try {
                insight = source.enrich(deal, ruleBased);
            } catch (RuntimeException e) {
                log.warn("Insight source {} failed for deal {}, keeping rule-based result: {}",
                    source.getClass().getSimpleName(), deal.getDealId(), e.getMessage());
                continue;
            }
            if (insight == null || insight.isEmpty()) continue;
            changed |= strengths.addAll(insight.get().strengths());
            changed |= concerns.addAll(insight.get().concerns());
            changed |= actions.addAll(insight.get().actions());
        }
        if (!changed) return ruleBased;

        return ruleBased.toBuilder()
            .clearKeyStrengths().keyStrengths(strengths)
            .clearKeyConcerns().keyConcerns(concerns)
            .clearNextActions().nextActions(limit(new ArrayList<>(actions)))
            .build();
    }
}
