package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Current temperature of a city as resolved by the weather fetch layer.
 *
 * @param month UTC calendar month of {@code observedAt}, 1..12
 */
public record LiveTemperature(
    @JsonProperty("city") String city,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("month") int month,
    @JsonProperty("observedAt") Instant observedAt
) {
    /** Same reading labelled with the city name as the caller spelled it. */
    public LiveTemperature forCity(String requestedCity) {
        return new LiveTemperature(requestedCity, temperature, month, observedAt);
    }

    public LiveObservation toObservation() {
        return LiveObservation.of(city, temperature, month);
    }
}
