package com.jay.dealintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Months needed to recover the integration cost. {@code months} is null when nothing
 * has been realized yet and payback cannot be estimated.
 */
public record PaybackPeriod(Double months) {

    public static PaybackPeriod of(double months) {
        return new PaybackPeriod(months);
    }

    public static PaybackPeriod unbounded() {
        return new PaybackPeriod(null);
    }

    @JsonProperty("unbounded")
    public boolean isUnbounded() {
        return months == null;
    }

    @Override
    public String toString() {
        return isUnbounded() ? "unbounded" : String.format("%.1f months", months);
    }
}
