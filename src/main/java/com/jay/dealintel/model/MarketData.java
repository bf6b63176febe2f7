package com.jay.dealintel.model;

/**
 * Market conditions used when valuing a synergy. Rates are fractions (0.03 = 3%).
 * Null components fall back to 3% growth and a 10% annual discount rate.
 */
public record MarketData(Double marketGrowthRate, Double discountRate) {

    public static final double DEFAULT_GROWTH = 0.03;
    public static final double DEFAULT_DISCOUNT_RATE = 0.10;

    public MarketData {
        if (marketGrowthRate == null) marketGrowthRate = DEFAULT_GROWTH;
        if (discountRate == null) discountRate = DEFAULT_DISCOUNT_RATE;
    }

    public static MarketData defaults() {
        return new MarketData(DEFAULT_GROWTH, DEFAULT_DISCOUNT_RATE);
    }
}
