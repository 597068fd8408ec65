package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Least-squares fit of temperature against observation index for one city.
 * {@code slope} is in degrees per observation, not per calendar day.
 */
public record Trend(
    @JsonProperty("city") String city,
    @JsonProperty("slope") double slope,
    @JsonProperty("intercept") double intercept,
    @JsonProperty("observations") int observations,
    @JsonProperty("direction") TrendDirection direction
) {
    public String narrative() {
        String word = direction == TrendDirection.POSITIVE ? "positive" : "negative";
        return "Based on the linear regression coefficient, the long-term temperature trend in "
            + city + " is " + word + ".";
    }
}
