package com.climatewatch.common.model;

import com.climatewatch.common.exception.ClimateException;
import com.climatewatch.common.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("kind") ErrorKind kind,
    @JsonProperty("message") String message
) {
    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(kind, message);
    }

    public static ErrorResponse from(ClimateException e) {
        return new ErrorResponse(e.getKind(), e.getMessage());
    }
}
