package com.jay.dealintel.model;

import java.util.List;

/**
 * Caller-supplied prediction for a deal's next transition, e.g. from a scoring model.
 * Replaces the baseline tables when present. confidence (0 – 1) is bucketed into HIGH/MEDIUM/LOW.
 */
public record TransitionSignal(double probability, int estimatedDays, double confidence, List<String> keyFactors) {

    public TransitionSignal {
        probability = Double.isNaN(probability) ? 0 : Math.max(0, Math.min(1, probability));
        confidence = Double.isNaN(confidence) ? 0 : confidence;
        estimatedDays = Math.max(0, estimatedDays);
        keyFactors = keyFactors != null ? List.copyOf(keyFactors) : List.of();
    }
}
