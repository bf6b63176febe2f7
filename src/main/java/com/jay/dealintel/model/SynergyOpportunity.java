package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.RealizationStatus;
import com.jay.dealintel.model.enums.SynergyCategory;
import com.jay.dealintel.model.enums.SynergyType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A single identified synergy. Created by SynergyIdentificationEngine; only its status
 * changes afterwards, through {@link #transitionTo}. Never deleted, only cancelled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynergyOpportunity {

    private String synergyId;
    private String name;
    private SynergyType synergyType;
    private SynergyCategory category;
    private double estimatedValue;
    private int realizationTimelineMonths;
    private double confidenceLevel;           // 0 – 1

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private RealizationStatus status = RealizationStatus.IDENTIFIED;
    private String owner;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    @Builder.Default
    private List<String> risks = new ArrayList<>();

    // Set by prioritization
    private double priorityScore;

    private LocalDate identifiedDate;
    private LocalDate targetRealizationDate;

    /**
     * Moves to the next lifecycle state.
     * @throws IllegalStateException if the move is not allowed from the current state
     */
    public synchronized void transitionTo(RealizationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                "Synergy %s cannot move from %s to %s", synergyId, status, next));
        }
        this.status = next;
    }

    public int riskCount() {
        return risks != null ? risks.size() : 0;
    }
}
