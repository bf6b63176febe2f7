package com.jay.dealintel.model.enums;

public enum DealRecommendation {
    PROCEED(5),
    PROCEED_WITH_CAUTION(4),
    INVESTIGATE_FURTHER(3),
    NEGOTIATE_TERMS(2),
    DECLINE(1);

    private final int favorability;

    DealRecommendation(int favorability) {
        this.favorability = favorability;
    }

    /** Higher is more favourable to the buyer proceeding. */
    public int favorability() {
        return favorability;
    }
}
