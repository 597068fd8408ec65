package com.climatewatch.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Result of one full analysis pass over an immutable dataset snapshot.
 */
public final class ClimateAnalysis {

    private final int window;
    private final int readingCount;
    private final Map<String, CityAnalysis> cities;
    private final SeasonalBaselines baselines;

    public ClimateAnalysis(int window, int readingCount,
                           Map<String, CityAnalysis> cities, SeasonalBaselines baselines) {
        this.window = window;
        this.readingCount = readingCount;
        this.cities = Collections.unmodifiableMap(new LinkedHashMap<>(cities));
        this.baselines = baselines;
    }

    public int window() {
        return window;
    }

    public int readingCount() {
        return readingCount;
    }

    public Set<String> cityNames() {
        return cities.keySet();
    }

    /** @return the city's analysis, or {@code null} when the city is not in the dataset */
    public CityAnalysis city(String city) {
        return cities.get(city);
    }

    public SeasonalBaselines baselines() {
        return baselines;
    }
}
