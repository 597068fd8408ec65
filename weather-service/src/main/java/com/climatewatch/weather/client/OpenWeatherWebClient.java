package com.climatewatch.weather.client;

import com.climatewatch.common.exception.WeatherFetchException;
import com.climatewatch.common.model.LiveTemperature;
import com.climatewatch.common.model.WeatherFailure;
import com.climatewatch.weather.model.OpenWeatherResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeoutException;

/**
 * Fetches the current temperature of a city from the OpenWeatherMap
 * "current weather" endpoint ({@code /data/2.5/weather}, metric units).
 *
 * <p>Outcome classification:
 * <ul>
 *   <li>401                         → {@link WeatherFailure#INVALID_CREDENTIAL}</li>
 *   <li>any other 4xx               → {@link WeatherFailure#CITY_LOOKUP_FAILURE}</li>
 *   <li>5xx, I/O, timeout, bad body → {@link WeatherFailure#TRANSPORT_FAILURE}</li>
 * </ul>
 * Only transport failures are retried.
 */
public class OpenWeatherWebClient {

    private static final Logger log = LoggerFactory.getLogger(OpenWeatherWebClient.class);

    private final WebClient webClient;
    private final int maxRetries;
    private final Duration retryBackoff;

    public OpenWeatherWebClient(WebClient openWeatherWebClient, int maxRetries, Duration retryBackoff) {
        this.webClient    = openWeatherWebClient;
        this.maxRetries   = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    public Mono<LiveTemperature> fetchCurrent(String city, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new WeatherFetchException(WeatherFailure.INVALID_CREDENTIAL,
                "No OpenWeatherMap API key supplied"));
        }
        log.info("Fetching current weather. provider=OpenWeatherMap city={}", city);

        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/data/2.5/weather")
                .queryParam("q", city)
                .queryParam("appid", apiKey)
                .queryParam("units", "metric")
                .build())
            .retrieve()
            .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(),
                response -> Mono.error(new WeatherFetchException(WeatherFailure.INVALID_CREDENTIAL,
                    "Invalid API key. Please check the key.")))
            .onStatus(HttpStatusCode::is4xxClientError,
                response -> Mono.error(new WeatherFetchException(WeatherFailure.CITY_LOOKUP_FAILURE,
                    "Weather lookup failed for city=" + city + " status=" + response.statusCode().value())))
            .onStatus(HttpStatusCode::is5xxServerError,
                response -> Mono.error(new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                    "Weather provider server error: " + response.statusCode().value())))
            .bodyToMono(OpenWeatherResponse.class)
            .map(response -> toLiveTemperature(city, response))
            .switchIfEmpty(Mono.error(() -> new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                "Empty weather payload for city=" + city)))
            .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                .filter(OpenWeatherWebClient::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying weather fetch. city={} attempt={} err={}",
                    city, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .onErrorMap(e -> !(e instanceof WeatherFetchException),
                e -> new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                    "Weather fetch failed for city=" + city + ": " + e.getMessage(), e))
            .doOnSuccess(t -> log.info("Current weather fetched. city={} temperature={} month={}",
                city, t.temperature(), t.month()))
            .doOnError(e -> log.warn("Weather fetch failed. city={} err={}", city, e.getMessage()));
    }

    private LiveTemperature toLiveTemperature(String city, OpenWeatherResponse response) {
        if (response == null || response.temperature() == null || response.dt() == null) {
            throw new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                "Malformed weather payload for city=" + city);
        }
        Instant observedAt = Instant.ofEpochSecond(response.dt());
        int month = observedAt.atZone(ZoneOffset.UTC).getMonthValue();
        return new LiveTemperature(city, response.temperature(), month, observedAt);
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof WeatherFetchException wfe) {
            return wfe.getFailure() == WeatherFailure.TRANSPORT_FAILURE;
        }
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }
}
