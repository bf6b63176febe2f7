package com.jay.dealintel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only realization history. One row per synergy per reporting period.
 */
@Entity
@Table(name = "synergy_realizations",
       indexes = @Index(name = "idx_realization_synergy", columnList = "synergy_id, period_start"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynergyRealizationRecord {

    public static final int MAX_SYNERGY_ID_LENGTH = 60;

    @Id
    @Column(name = "realization_id", length = 120)
    private String realizationId;

    @Column(name = "synergy_id", nullable = false, length = MAX_SYNERGY_ID_LENGTH)
    private String synergyId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;
    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    private double realizedValue;
    private double plannedValue;
    private double variance;
    private double variancePercentage;
    private double realizationRate;     // cumulative, as of this period

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "realization_factors", joinColumns = @JoinColumn(name = "realization_id"))
    @Column(name = "factor", length = 300)
    private List<String> contributingFactors = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "realization_challenges", joinColumns = @JoinColumn(name = "realization_id"))
    @Column(name = "challenge", length = 300)
    private List<String> challengesEncountered = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "realization_lessons", joinColumns = @JoinColumn(name = "realization_id"))
    @Column(name = "lesson", length = 300)
    private List<String> lessonsLearned = new ArrayList<>();

    private LocalDateTime recordedAt;
}
