package com.climatewatch.analysis.client;

import com.climatewatch.common.exception.WeatherFetchException;
import com.climatewatch.common.model.ErrorResponse;
import com.climatewatch.common.model.LiveTemperature;
import com.climatewatch.common.model.WeatherFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Calls weather-service for the current temperature of a city and decodes its
 * {@link ErrorResponse} back into the same {@link WeatherFailure} it reported.
 */
@Component
public class WeatherServiceClient implements LiveTemperatureProvider {

    private static final Logger log = LoggerFactory.getLogger(WeatherServiceClient.class);

    static final String API_KEY_HEADER = "X-Weather-Api-Key";

    private final WebClient webClient;
    private final Duration timeout;

    public WeatherServiceClient(WebClient weatherServiceWebClient,
                                @Value("${services.weather.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = weatherServiceWebClient;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public Mono<LiveTemperature> fetch(String city, String apiKey) {
        return webClient.get()
            .uri("/api/v1/weather/current/{city}", city)
            .headers(headers -> {
                if (apiKey != null) headers.set(API_KEY_HEADER, apiKey);
            })
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(LiveTemperature.class);
                }
                HttpStatusCode status = response.statusCode();
                return response.bodyToMono(ErrorResponse.class)
                    .onErrorResume(e -> Mono.empty())
                    .defaultIfEmpty(ErrorResponse.of(null, "weather-service answered " + status.value()))
                    .flatMap(error -> Mono.error(toException(status, error)));
            })
            .switchIfEmpty(Mono.error(() -> new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                "weather-service returned an empty body for city=" + city)))
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof WeatherFetchException),
                e -> new WeatherFetchException(WeatherFailure.TRANSPORT_FAILURE,
                    "weather-service call failed for city=" + city + ": " + e.getMessage(), e))
            .doOnSuccess(t -> log.info("Live temperature received. city={} temperature={} month={}",
                city, t.temperature(), t.month()))
            .doOnError(e -> log.warn("Live temperature unavailable. city={} err={}", city, e.getMessage()));
    }

    static WeatherFetchException toException(HttpStatusCode status, ErrorResponse error) {
        WeatherFailure failure = error.kind() == null ? null : WeatherFailure.fromErrorKind(error.kind());
        if (failure == null) {
            if (status.value() == HttpStatus.UNAUTHORIZED.value()) {
                failure = WeatherFailure.INVALID_CREDENTIAL;
            } else if (status.value() == HttpStatus.NOT_FOUND.value()) {
                failure = WeatherFailure.CITY_LOOKUP_FAILURE;
            } else {
                failure = WeatherFailure.TRANSPORT_FAILURE;
            }
        }
        return new WeatherFetchException(failure, error.message());
    }
}
