package com.climatewatch.weather.controller;

import com.climatewatch.common.exception.WeatherFetchException;
import com.climatewatch.common.model.ErrorResponse;
import com.climatewatch.common.model.WeatherFailure;
import com.climatewatch.weather.provider.CurrentWeatherProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/weather")
public class WeatherController {

    public static final String API_KEY_HEADER = "X-Weather-Api-Key";

    private final CurrentWeatherProvider provider;

    public WeatherController(CurrentWeatherProvider provider) {
        this.provider = provider;
    }

    @GetMapping("/current/{city}")
    public Mono<ResponseEntity<Object>> getCurrent(
            @PathVariable String city,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return provider.getCurrent(city, apiKey)
            .map(temperature -> ResponseEntity.ok().<Object>body(temperature))
            .onErrorResume(WeatherFetchException.class, e -> Mono.just(
                ResponseEntity.status(statusOf(e.getFailure())).<Object>body(ErrorResponse.from(e))));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    static HttpStatus statusOf(WeatherFailure failure) {
        return switch (failure) {
            case INVALID_CREDENTIAL  -> HttpStatus.UNAUTHORIZED;
            case CITY_LOOKUP_FAILURE -> HttpStatus.NOT_FOUND;
            case TRANSPORT_FAILURE   -> HttpStatus.BAD_GATEWAY;
        };
    }
}
