package com.jay.dealintel.model.enums;

public enum MarketPosition {
    LEADER,
    CHALLENGER,
    NICHE,
    FOLLOWER,
    UNKNOWN
}
