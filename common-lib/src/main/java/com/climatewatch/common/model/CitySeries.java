package com.climatewatch.common.model;

import java.util.List;

/**
 * Chronologically ordered readings of a single city (ascending timestamp,
 * ties in input order).
 */
public record CitySeries(String city, List<Reading> readings) {

    public CitySeries {
        readings = List.copyOf(readings);
    }

    public int size() {
        return readings.size();
    }

    /** Temperatures in chronological order. */
    public double[] temperatures() {
        double[] values = new double[readings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = readings.get(i).temperature();
        }
        return values;
    }
}
