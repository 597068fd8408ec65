package com.climatewatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trailing-window statistics for one reading. {@code movingAverage} and
 * {@code movingStd} are {@code null} while the window is incomplete, and the
 * status is then {@link AnomalyStatus#UNDEFINED}.
 */
public record RollingStats(
    @JsonProperty("reading") Reading reading,
    @JsonProperty("movingAverage") Double movingAverage,
    @JsonProperty("movingStd") Double movingStd,
    @JsonProperty("status") AnomalyStatus status
) {
    public static RollingStats undefined(Reading reading) {
        return new RollingStats(reading, null, null, AnomalyStatus.UNDEFINED);
    }

    public boolean isDefined() {
        return status != AnomalyStatus.UNDEFINED;
    }

    public boolean isAnomaly() {
        return status == AnomalyStatus.ANOMALY;
    }
}
