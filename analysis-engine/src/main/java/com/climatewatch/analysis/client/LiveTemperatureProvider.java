package com.climatewatch.analysis.client;

import com.climatewatch.common.model.LiveTemperature;
import reactor.core.publisher.Mono;

/**
 * Resolves the current temperature of a city. Failures are signalled as
 * {@link com.climatewatch.common.exception.WeatherFetchException}.
 */
public interface LiveTemperatureProvider {
    Mono<LiveTemperature> fetch(String city, String apiKey);
}
