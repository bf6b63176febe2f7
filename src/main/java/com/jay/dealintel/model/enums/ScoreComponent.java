package com.jay.dealintel.model.enums;

public enum ScoreComponent {
    FINANCIAL,
    STRATEGIC,
    MARKET,
    RISK,       // higher = riskier, inverted before weighting
    EXECUTION,
    TEAM
}
