package com.climatewatch.common.model;

/**
 * Outcome of the rolling 2-sigma check at one position of a city series.
 */
public enum AnomalyStatus {

    /** Trailing window not yet full; no statistic, no verdict. */
    UNDEFINED,

    /** Within average ± 2·std of the trailing window. */
    NORMAL,

    /** Outside average ± 2·std of the trailing window. */
    ANOMALY
}
