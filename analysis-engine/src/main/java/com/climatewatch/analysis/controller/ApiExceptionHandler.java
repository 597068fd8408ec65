package com.climatewatch.analysis.controller;

import com.climatewatch.common.exception.ClimateException;
import com.climatewatch.common.exception.ErrorKind;
import com.climatewatch.common.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps every {@link ClimateException} to a distinguishable status and an
 * {@link ErrorResponse} carrying its {@link ErrorKind}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ClimateException.class)
    public ResponseEntity<ErrorResponse> handleClimate(ClimateException ex) {
        HttpStatus status = statusOf(ex.getKind());
        log.info("Request failed. kind={} status={} message={}", ex.getKind(), status.value(), ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.from(ex), status);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        return new ResponseEntity<>(
            ErrorResponse.of(ErrorKind.VALIDATION, ex.getReason()),
            HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION            -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_DATA     -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NO_BASELINE           -> HttpStatus.NOT_FOUND;
            case INCONCLUSIVE_BASELINE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_CREDENTIAL    -> HttpStatus.UNAUTHORIZED;
            case CITY_LOOKUP_FAILURE   -> HttpStatus.NOT_FOUND;
            case TRANSPORT_FAILURE     -> HttpStatus.BAD_GATEWAY;
            case NO_DATASET            -> HttpStatus.CONFLICT;
            case UNKNOWN_CITY          -> HttpStatus.NOT_FOUND;
        };
    }
}
