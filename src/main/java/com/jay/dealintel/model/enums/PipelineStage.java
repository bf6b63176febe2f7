package com.jay.dealintel.model.enums;

import java.util.Arrays;
import java.util.List;

/**
 * Deal pipeline stages in their fixed order. The last two are absorbing.
 */
public enum PipelineStage {
    SOURCING,
    INITIAL_REVIEW,
    VALUATION,
    DUE_DILIGENCE,
    NEGOTIATION,
    CLOSING,
    CLOSED_WON,
    CLOSED_LOST;

    private static final List<PipelineStage> ACTIVE = Arrays.stream(values())
        .filter(s -> !s.isTerminal())
        .toList();

    public boolean isTerminal() {
        return this == CLOSED_WON || this == CLOSED_LOST;
    }

    /** Non-terminal stages, in pipeline order. */
    public static List<PipelineStage> activeStages() {
        return ACTIVE;
    }
}
