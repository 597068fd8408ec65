package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive statistics of a city's temperatures. {@code std} is {@code null}
 * for a single observation.
 */
public record SeriesSummary(
    @JsonProperty("city") String city,
    @JsonProperty("count") int count,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") Double std,
    @JsonProperty("min") double min,
    @JsonProperty("p25") double p25,
    @JsonProperty("median") double median,
    @JsonProperty("p75") double p75,
    @JsonProperty("max") double max
) {}
