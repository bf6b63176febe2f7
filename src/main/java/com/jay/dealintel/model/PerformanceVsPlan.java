package com.jay.dealintel.model;

/**
 * valueRealization: latest-period realized value across synergies over identified value.
 * onTrackShare / delayedShare: fraction of synergies whose latest variance is within / beyond tolerance.
 */
public record PerformanceVsPlan(double valueRealization, double onTrackShare, double delayedShare) {}
