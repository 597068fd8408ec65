package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rolling statistics of one city, position-aligned with its {@link CitySeries}.
 */
public record RollingAnalysis(
    @JsonProperty("city") String city,
    @JsonProperty("window") int window,
    @JsonProperty("stats") List<RollingStats> stats
) {
    public RollingAnalysis {
        stats = List.copyOf(stats);
    }

    public List<RollingStats> anomalies() {
        return stats.stream().filter(RollingStats::isAnomaly).toList();
    }

    public long anomalyCount() {
        return stats.stream().filter(RollingStats::isAnomaly).count();
    }
}
