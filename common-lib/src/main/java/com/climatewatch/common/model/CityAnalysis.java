package com.climatewatch.common.model;

import java.util.List;

/**
 * Derived artifacts of one city. Exactly one of {@code trend} and
 * {@code trendUnavailableReason} is non-null.
 */
public record CityAnalysis(
    String city,
    CitySeries series,
    RollingAnalysis rolling,
    List<SeasonBaseline> seasonalProfile,
    Trend trend,
    String trendUnavailableReason,
    SeriesSummary summary
) {
    public CityAnalysis {
        seasonalProfile = List.copyOf(seasonalProfile);
    }

    public boolean hasTrend() {
        return trend != null;
    }
}
