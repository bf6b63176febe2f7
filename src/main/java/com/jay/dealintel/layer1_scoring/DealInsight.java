package com.jay.dealintel.layer1_scoring;

import java.util.List;

/** Extra strengths, concerns and actions contributed by an external insight source. */
public record DealInsight(List<String> strengths, List<String> concerns, List<String> actions) {

    public DealInsight {
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        concerns = concerns != null ? List.copyOf(concerns) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static DealInsight empty() {
        return new DealInsight(List.of(), List.of(), List.of());
    }
}
