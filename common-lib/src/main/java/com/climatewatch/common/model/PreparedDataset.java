package com.climatewatch.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the historical dataset, grouped per city.
 * Cities iterate in order of first appearance after the chronological sort.
 */
public final class PreparedDataset {

    private final Map<String, CitySeries> seriesByCity;

    public PreparedDataset(Map<String, CitySeries> seriesByCity) {
        this.seriesByCity = Collections.unmodifiableMap(new LinkedHashMap<>(seriesByCity));
    }

    public Set<String> cities() {
        return seriesByCity.keySet();
    }

    /** @return the series of the city, or {@code null} if the city is absent */
    public CitySeries series(String city) {
        return seriesByCity.get(city);
    }

    public List<CitySeries> allSeries() {
        return List.copyOf(seriesByCity.values());
    }

    public int readingCount() {
        return seriesByCity.values().stream().mapToInt(CitySeries::size).sum();
    }
}
