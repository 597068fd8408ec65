package com.climatewatch.weather.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of the OpenWeatherMap "current weather" payload that the fetch needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenWeatherResponse(
    @JsonProperty("name") String name,
    @JsonProperty("dt") Long dt,
    @JsonProperty("main") Main main
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Main(
        @JsonProperty("temp") Double temp
    ) {}

    public Double temperature() {
        return main == null ? null : main.temp();
    }
}
