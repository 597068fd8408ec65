package com.climatewatch.common.model;

/**
 * Sign of a city's long-term trend slope. A slope of exactly zero is
 * classified {@link #NEGATIVE}.
 */
public enum TrendDirection {
    POSITIVE,
    NEGATIVE;

    public static TrendDirection fromSlope(double slope) {
        return slope > 0 ? POSITIVE : NEGATIVE;
    }
}
