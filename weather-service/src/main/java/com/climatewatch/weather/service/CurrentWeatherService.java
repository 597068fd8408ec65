package com.climatewatch.weather.service;

import com.climatewatch.common.model.LiveTemperature;
import com.climatewatch.weather.cache.CachedWeather;
import com.climatewatch.weather.cache.WeatherCache;
import com.climatewatch.weather.client.OpenWeatherWebClient;
import com.climatewatch.weather.provider.CurrentWeatherProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Current weather access backed by a short-lived in-memory cache.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check {@link WeatherCache} for a valid (non-expired) entry.</li>
 *   <li>On hit → return immediately (no API call).</li>
 *   <li>On miss → call OpenWeatherMap via {@link OpenWeatherWebClient},
 *       store the result in cache, and return it.</li>
 * </ol>
 *
 * <p>The cache matches city names case-insensitively, so a hit is relabelled
 * with the name of the current request.
 */
@Service
public class CurrentWeatherService implements CurrentWeatherProvider {

    private static final Logger log = LoggerFactory.getLogger(CurrentWeatherService.class);

    private final OpenWeatherWebClient client;
    private final WeatherCache cache;

    public CurrentWeatherService(OpenWeatherWebClient client, WeatherCache cache) {
        this.client = client;
        this.cache  = cache;
    }

    @Override
    public Mono<LiveTemperature> getCurrent(String city, String apiKey) {
        return Mono.defer(() -> {
            if (apiKey != null && !apiKey.isBlank()) {
                CachedWeather cached = cache.get(city, apiKey);
                if (cached != null) {
                    log.info("CACHE_HIT city={} fetchedAt={}", city, cached.fetchedAt());
                    return Mono.just(cached.data().forCity(city));
                }
            }

            log.info("CACHE_MISS city={}", city);
            return client.fetchCurrent(city, apiKey)
                .doOnSuccess(temperature -> cache.put(city, apiKey, temperature));
        });
    }
}
