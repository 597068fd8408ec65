package com.climatewatch.analysis.dto;

import com.climatewatch.common.model.CityAnalysis;
import com.climatewatch.common.model.RollingStats;
import com.climatewatch.common.model.SeasonBaseline;
import com.climatewatch.common.model.SeriesSummary;
import com.climatewatch.common.model.Trend;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the presentation layer needs for one city: descriptive table,
 * trend narrative, seasonal profile and the rolling anomaly overlay.
 * {@code trend} is {@code null} exactly when {@code trendUnavailable} is set.
 */
public record CityReport(
    @JsonProperty("city") String city,
    @JsonProperty("summary") SeriesSummary summary,
    @JsonProperty("trend") Trend trend,
    @JsonProperty("trendUnavailable") String trendUnavailable,
    @JsonProperty("trendNarrative") String trendNarrative,
    @JsonProperty("seasonalProfile") List<SeasonBaseline> seasonalProfile,
    @JsonProperty("window") int window,
    @JsonProperty("anomalyCount") long anomalyCount,
    @JsonProperty("rolling") List<RollingStats> rolling
) {
    public static CityReport from(CityAnalysis analysis) {
        return new CityReport(
            analysis.city(),
            analysis.summary(),
            analysis.trend(),
            analysis.trendUnavailableReason(),
            analysis.hasTrend() ? analysis.trend().narrative() : null,
            analysis.seasonalProfile(),
            analysis.rolling().window(),
            analysis.rolling().anomalyCount(),
            analysis.rolling().stats());
    }
}
