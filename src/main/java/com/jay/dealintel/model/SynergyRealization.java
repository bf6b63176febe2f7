package com.jay.dealintel.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One recorded period for a synergy. realizationRate is cumulative over the synergy's
 * whole history up to and including this period.
 */
public record SynergyRealization(
    String realizationId,
    String synergyId,
    LocalDate periodStart,
    LocalDate periodEnd,
    double realizedValue,
    double plannedValue,
    double variance,
    double variancePercentage,
    double realizationRate,
    List<String> contributingFactors,
    List<String> challengesEncountered,
    List<String> lessonsLearned,
    LocalDateTime recordedAt
) {}
