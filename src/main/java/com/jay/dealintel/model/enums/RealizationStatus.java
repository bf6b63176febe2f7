package com.jay.dealintel.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a synergy opportunity.
 * AT_RISK and DELAYED can recover to IN_PROGRESS. REALIZED and CANCELLED are terminal.
 */
public enum RealizationStatus {
    IDENTIFIED,
    PLANNED,
    IN_PROGRESS,
    AT_RISK,
    DELAYED,
    REALIZED,
    CANCELLED;

    public boolean isTerminal() {
        return this == REALIZED || this == CANCELLED;
    }

    public Set<RealizationStatus> allowedTransitions() {
        return switch (this) {
            case IDENTIFIED  -> EnumSet.of(PLANNED, CANCELLED);
            case PLANNED     -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(REALIZED, AT_RISK, CANCELLED);
            case AT_RISK     -> EnumSet.of(DELAYED, IN_PROGRESS, CANCELLED);
            case DELAYED     -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case REALIZED, CANCELLED -> EnumSet.noneOf(RealizationStatus.class);
        };
    }

    public boolean canTransitionTo(RealizationStatus next) {
        return allowedTransitions().contains(next);
    }
}
