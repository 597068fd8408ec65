package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classification of one live reading against its seasonal baseline. Never stored.
 */
public record LiveVerdict(
    @JsonProperty("city") String city,
    @JsonProperty("season") Season season,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("seasonMean") double seasonMean,
    @JsonProperty("seasonStd") double seasonStd,
    @JsonProperty("lowerBound") double lowerBound,
    @JsonProperty("upperBound") double upperBound,
    @JsonProperty("anomalous") boolean anomalous,
    @JsonProperty("message") String message
) {}
