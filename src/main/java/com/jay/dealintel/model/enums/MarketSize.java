package com.jay.dealintel.model.enums;

public enum MarketSize {
    SMALL,
    MEDIUM,
    LARGE,
    UNKNOWN
}
