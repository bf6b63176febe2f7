package com.jay.dealintel.model.enums;

public enum DealRiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps a 0-100 risk component score (higher = riskier) onto a level.
     * The score is inverted first: a safety of 80+ is LOW risk.
     */
    public static DealRiskLevel fromRiskScore(double riskScore) {
        double safety = 100 - riskScore;
        if (safety >= 80) return LOW;
        if (safety >= 60) return MEDIUM;
        if (safety >= 40) return HIGH;
        return CRITICAL;
    }
}
