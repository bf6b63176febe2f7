package com.jay.dealintel.model;

import com.jay.dealintel.exception.InvalidConfigurationException;
import com.jay.dealintel.model.enums.ScoreComponent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-component weights for the overall deal score. Must sum to 1.0.
 * The risk weight is applied to the inverted risk score (100 - risk).
 * Immutable: profiles loaded from config are shared by every score that uses them.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class ScoringWeights {

    private static final double TOLERANCE = 1e-6;

    double financial;
    double strategic;
    double market;
    double risk;
    double execution;
    double team;

    public double weight(ScoreComponent component) {
        return switch (component) {
            case FINANCIAL -> financial;
            case STRATEGIC -> strategic;
            case MARKET    -> market;
            case RISK      -> risk;
            case EXECUTION -> execution;
            case TEAM      -> team;
        };
    }

    public double sum() {
        return financial + strategic + market + risk + execution + team;
    }

    /** Throws InvalidConfigurationException unless every weight is non-negative and they sum to 1. */
    public void validate() {
        for (ScoreComponent c : ScoreComponent.values()) {
            double w = weight(c);
            if (Double.isNaN(w) || w < 0) {
                throw new InvalidConfigurationException("Negative or NaN weight for " + c + ": " + w);
            }
        }
        if (Math.abs(sum() - 1.0) > TOLERANCE) {
            throw new InvalidConfigurationException(
                String.format("Scoring weights must sum to 1.0 but sum to %.4f", sum()));
        }
    }

    public String breakdownString() {
        return String.format("F:%.2f S:%.2f M:%.2f R:%.2f E:%.2f T:%.2f",
            financial, strategic, market, risk, execution, team);
    }
}
