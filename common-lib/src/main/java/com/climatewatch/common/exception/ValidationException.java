package com.climatewatch.common.exception;

public class ValidationException extends ClimateException {

    public ValidationException(String component, String message) {
        super(component, ErrorKind.VALIDATION, message);
    }

    public ValidationException(String component, String message, Throwable cause) {
        super(component, ErrorKind.VALIDATION, message, cause);
    }
}
