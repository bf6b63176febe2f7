package com.jay.dealintel.model.enums;

public enum VelocityTrend {
    INCREASING, // deals are moving through the pipeline faster
    DECREASING, // cycle times are growing
    STABLE
}
