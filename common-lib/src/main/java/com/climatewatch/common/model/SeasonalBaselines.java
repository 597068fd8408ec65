package com.climatewatch.common.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table of {@link SeasonBaseline} rows keyed by exact (city, season).
 */
public final class SeasonalBaselines {

    private record Key(String city, Season season) {}

    private final Map<Key, SeasonBaseline> rows;

    public SeasonalBaselines(Collection<SeasonBaseline> baselines) {
        Map<Key, SeasonBaseline> map = new LinkedHashMap<>();
        for (SeasonBaseline baseline : baselines) {
            map.put(new Key(baseline.city(), baseline.season()), baseline);
        }
        this.rows = Map.copyOf(map);
    }

    /** @return the baseline row, or {@code null} when the pair was never observed */
    public SeasonBaseline find(String city, Season season) {
        return rows.get(new Key(city, season));
    }

    /** Baselines of one city, ordered winter → autumn. */
    public List<SeasonBaseline> forCity(String city) {
        return rows.values().stream()
            .filter(b -> b.city().equals(city))
            .sorted(Comparator.comparing(SeasonBaseline::season))
            .toList();
    }

    public int size() {
        return rows.size();
    }
}
