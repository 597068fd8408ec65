package com.climatewatch.common.model;

import java.time.LocalDate;

/**
 * Unvalidated input row as delivered by the ingestion layer. Any field may be
 * {@code null}; {@code line} is the 1-based source line used in error messages.
 */
public record RawReading(
    int line,
    String city,
    LocalDate timestamp,
    Double temperature,
    String season
) {
    public static RawReading of(int line, String city, LocalDate timestamp,
                                Double temperature, String season) {
        return new RawReading(line, city, timestamp, temperature, season);
    }
}
