package com.jay.dealintel.model.enums;

/** Three-step qualitative rating used by deal attributes and bottleneck urgency. */
public enum Level {
    LOW,
    MEDIUM,
    HIGH
}
