package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One validated daily temperature observation. Immutable once ingested.
 */
public record Reading(
    @JsonProperty("city") String city,
    @JsonProperty("timestamp") LocalDate timestamp,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("season") Season season
) {
    public static Reading of(String city, LocalDate timestamp, double temperature, Season season) {
        return new Reading(city, timestamp, temperature, season);
    }
}
