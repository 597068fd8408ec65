package com.climatewatch.common.exception;

public class InsufficientDataException extends ClimateException {
    private final int required;
    private final int available;

    public InsufficientDataException(String component, String message, int required, int available) {
        super(component, ErrorKind.INSUFFICIENT_DATA,
            message + " (required=" + required + ", available=" + available + ")");
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
