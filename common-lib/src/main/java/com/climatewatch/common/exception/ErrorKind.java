package com.climatewatch.common.exception;

/**
 * Machine-readable failure category carried by every {@link ClimateException}
 * and echoed as {@code kind} in error responses.
 */
public enum ErrorKind {

    /** Malformed or incomplete input record, or an out-of-range argument. */
    VALIDATION,

    /** Too few observations for a trend fit or a rolling window. */
    INSUFFICIENT_DATA,

    /** Live reading references a (city, season) pair absent from history. */
    NO_BASELINE,

    /** Baseline exists but its standard deviation is undefined (single observation). */
    INCONCLUSIVE_BASELINE,

    /** Weather provider rejected the API key. */
    INVALID_CREDENTIAL,

    /** Weather provider could not resolve the city. */
    CITY_LOOKUP_FAILURE,

    /** Network, timeout or malformed upstream payload. */
    TRANSPORT_FAILURE,

    /** No dataset has been loaded yet. */
    NO_DATASET,

    /** City is not part of the loaded dataset. */
    UNKNOWN_CITY
}
