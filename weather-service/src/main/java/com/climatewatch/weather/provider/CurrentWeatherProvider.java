package com.climatewatch.weather.provider;

import com.climatewatch.common.model.LiveTemperature;
import reactor.core.publisher.Mono;

/**
 * Source of the current temperature of a city. Errors are signalled as
 * {@link com.climatewatch.common.exception.WeatherFetchException}.
 */
public interface CurrentWeatherProvider {
    Mono<LiveTemperature> getCurrent(String city, String apiKey);
}
