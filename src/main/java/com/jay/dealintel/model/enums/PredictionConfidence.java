package com.jay.dealintel.model.enums;

public enum PredictionConfidence {
    HIGH,
    MEDIUM,
    LOW;

    public static PredictionConfidence fromScore(double confidence) {
        if (confidence > 0.8) return HIGH;
        if (confidence > 0.6) return MEDIUM;
        return LOW;
    }
}
