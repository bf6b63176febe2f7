package com.jay.dealintel.layer1_scoring;

import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;

import java.util.Optional;

/**
 * Optional enrichment for a rule-based deal score, e.g. a model-backed analyst.
 * Implementations may fail or return nothing; scoring then keeps the rule-based result.
 */
public interface DealInsightSource {

    Optional<DealInsight> enrich(DealAttributes deal, DealScore ruleBasedScore);
}
