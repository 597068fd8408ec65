package com.climatewatch.common.exception;

/**
 * Root of every failure raised by the analytical core and the services built on it.
 * The message is prefixed with the name of the component that raised it.
 */
public class ClimateException extends RuntimeException {
    private final String component;
    private final ErrorKind kind;

    public ClimateException(String component, ErrorKind kind, String message) {
        super("[" + component + "] " + message);
        this.component = component;
        this.kind = kind;
    }

    public ClimateException(String component, ErrorKind kind, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
        this.kind = kind;
    }

    public String getComponent() {
        return component;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
