package com.jay.dealintel.model;

import java.time.LocalDate;
import java.util.List;

/** Actual vs planned synergy value for one reporting period, as submitted by the caller. */
public record RealizationPeriod(
    LocalDate periodStart,
    LocalDate periodEnd,
    double realizedValue,
    double plannedValue,
    List<String> contributingFactors,
    List<String> challengesEncountered,
    List<String> lessonsLearned
) {
    public RealizationPeriod {
        if (periodStart == null || periodEnd == null) {
            throw new IllegalArgumentException("Realization period needs both a start and an end date");
        }
        if (periodEnd.isBefore(periodStart)) {
            throw new IllegalArgumentException("Period end " + periodEnd + " is before start " + periodStart);
        }
        contributingFactors = contributingFactors != null ? List.copyOf(contributingFactors) : List.of();
        challengesEncountered = challengesEncountered != null ? List.copyOf(challengesEncountered) : List.of();
        lessonsLearned = lessonsLearned != null ? List.copyOf(lessonsLearned) : List.of();
    }

    public static RealizationPeriod of(LocalDate start, LocalDate end, double realized, double planned) {
        return new RealizationPeriod(start, end, realized, planned, List.of(), List.of(), List.of());
    }
}
