package com.climatewatch.weather.cache;

import com.climatewatch.common.model.LiveTemperature;

import java.time.Instant;

/**
 * Immutable cache entry wrapping a {@link LiveTemperature} with its fetch timestamp.
 */
public record CachedWeather(
    LiveTemperature data,
    Instant fetchedAt
) {}
