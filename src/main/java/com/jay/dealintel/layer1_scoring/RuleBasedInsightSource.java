package com.jay.dealintel.layer1_scoring;

import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Built-in source: contributes nothing, so the rule-based path stands alone. */
@Component
public class RuleBasedInsightSource implements DealInsightSource {

    @Override
    public Optional<DealInsight> enrich(DealAttributes deal, DealScore ruleBasedScore) {
        return Optional.empty();
    }
}
