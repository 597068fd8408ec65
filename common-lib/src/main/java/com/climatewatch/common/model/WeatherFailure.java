package com.climatewatch.common.model;

import com.climatewatch.common.exception.ErrorKind;

/**
 * Failure classes of a live weather fetch.
 */
public enum WeatherFailure {

    /** Provider answered 401: the API key is missing or wrong. */
    INVALID_CREDENTIAL(ErrorKind.INVALID_CREDENTIAL),

    /** Provider answered with any other non-success status for the city. */
    CITY_LOOKUP_FAILURE(ErrorKind.CITY_LOOKUP_FAILURE),

    /** Connection, timeout, server error or unreadable payload. */
    TRANSPORT_FAILURE(ErrorKind.TRANSPORT_FAILURE);

    private final ErrorKind errorKind;

    WeatherFailure(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    /** @return the failure matching the given kind, or {@code null} for non-weather kinds */
    public static WeatherFailure fromErrorKind(ErrorKind kind) {
        for (WeatherFailure failure : values()) {
            if (failure.errorKind == kind) return failure;
        }
        return null;
    }
}
