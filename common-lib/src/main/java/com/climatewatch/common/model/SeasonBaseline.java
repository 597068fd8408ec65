package com.climatewatch.common.model;

import com.climatewatch.common.stats.Statistics;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mean and sample standard deviation of temperature for one (city, season) group.
 *
 * <p>{@code stdTemperature} is {@code null} when the group holds a single
 * observation: the deviation is undefined, which is not the same as zero.
 */
public record SeasonBaseline(
    @JsonProperty("city") String city,
    @JsonProperty("season") Season season,
    @JsonProperty("sampleCount") int sampleCount,
    @JsonProperty("meanTemperature") double meanTemperature,
    @JsonProperty("stdTemperature") Double stdTemperature
) {
    public boolean hasDefinedStd() {
        return stdTemperature != null;
    }

    /** @return mean - 2·std, or {@code null} when std is undefined */
    @JsonProperty("lowerBand")
    public Double lowerBand() {
        return hasDefinedStd() ? meanTemperature - Statistics.SIGMA_MULTIPLIER * stdTemperature : null;
    }

    /** @return mean + 2·std, or {@code null} when std is undefined */
    @JsonProperty("upperBand")
    public Double upperBand() {
        return hasDefinedStd() ? meanTemperature + Statistics.SIGMA_MULTIPLIER * stdTemperature : null;
    }
}
