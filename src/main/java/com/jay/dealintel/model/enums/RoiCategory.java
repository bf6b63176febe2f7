package com.jay.dealintel.model.enums;

public enum RoiCategory {
    EXCEPTIONAL,
    STRONG,
    ABOVE_AVERAGE,
    AVERAGE,
    BELOW_AVERAGE;

    public static RoiCategory classify(double roi, double benchmark) {
        if (roi >= benchmark * 1.5) return EXCEPTIONAL;
        if (roi >= benchmark * 1.2) return STRONG;
        if (roi >= benchmark) return ABOVE_AVERAGE;
        if (roi >= benchmark * 0.8) return AVERAGE;
        return BELOW_AVERAGE;
    }
}
