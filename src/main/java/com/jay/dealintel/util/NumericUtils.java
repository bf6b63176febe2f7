package com.jay.dealintel.util;

import java.util.List;

/**
 * Small numeric helpers shared by the scoring, synergy and pipeline engines.
 * Division helpers never throw; a zero denominator yields the supplied fallback.
 */
public final class NumericUtils {

    private NumericUtils() {}

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Clamps to the 0 – 100 score range. NaN collapses to 0. */
    public static double clampScore(double score) {
        if (Double.isNaN(score)) return 0;
        return clamp(score, 0, 100);
    }

    public static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }

    public static double safeDivide(double numerator, double denominator, double fallback) {
        if (denominator == 0 || Double.isNaN(denominator)) return fallback;
        return numerator / denominator;
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0;
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    public static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    /**
     * Least-squares slope of y against x. Returns 0 for fewer than two points
     * or when all x values coincide.
     */
    public static double linearSlope(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) return 0;
        double sumX = 0, sumY = 0;
        for (int i = 0; i < n; i++) { sumX += x[i]; sumY += y[i]; }
        double meanX = sumX / n;
        double meanY = sumY / n;
        double num = 0, den = 0;
        for (int i = 0; i < n; i++) {
            num += (x[i] - meanX) * (y[i] - meanY);
            den += (x[i] - meanX) * (x[i] - meanX);
        }
        return den == 0 ? 0 : num / den;
    }
}
