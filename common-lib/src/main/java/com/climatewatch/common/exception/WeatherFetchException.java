package com.climatewatch.common.exception;

import com.climatewatch.common.model.WeatherFailure;

/**
 * Classified failure of a live weather fetch. The {@link WeatherFailure} tells the
 * caller whether the credential, the city lookup or the transport failed.
 */
public class WeatherFetchException extends ClimateException {
    private final WeatherFailure failure;

    public WeatherFetchException(WeatherFailure failure, String message) {
        super("WeatherFetch", failure.errorKind(), message);
        this.failure = failure;
    }

    public WeatherFetchException(WeatherFailure failure, String message, Throwable cause) {
        super("WeatherFetch", failure.errorKind(), message, cause);
        this.failure = failure;
    }

    public WeatherFailure getFailure() {
        return failure;
    }
}
