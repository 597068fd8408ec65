package com.climatewatch.weather.cache;

import com.climatewatch.common.model.LiveTemperature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of successful weather fetches, one entry per (city, API key).
 *
 * <p>The provider refreshes its observations roughly every ten minutes, so a
 * repeated live check inside the TTL is served without an outbound call. Entries
 * are keyed by credential too: a cached answer never bypasses a credential check.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Failures are never cached.
 */
@Component
public class WeatherCache {

    private static final Logger log = LoggerFactory.getLogger(WeatherCache.class);

    private final ConcurrentHashMap<String, CachedWeather> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public WeatherCache(@Value("${weather.cache-ttl-minutes:10}") long ttlMinutes) {
        this(Duration.ofMinutes(ttlMinutes), Clock.systemUTC());
    }

    WeatherCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached entry, or {@code null} if absent or expired. Expired
     * entries are evicted on read.
     */
    public CachedWeather get(String city, String apiKey) {
        String key = key(city, apiKey);
        CachedWeather entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key);
            return null;
        }
        return entry;
    }

    /**
     * Stores a fresh entry and drops every expired one, so entries for
     * cities nobody asks for again do not accumulate.
     */
    public void put(String city, String apiKey, LiveTemperature temperature) {
        store.values().removeIf(this::isExpired);
        store.put(key(city, apiKey), new CachedWeather(temperature, clock.instant()));
        log.info("CACHE_REFRESH city={} ttlSeconds={}", city, ttl.toSeconds());
    }

    public boolean isExpired(CachedWeather entry) {
        Instant now = clock.instant();
        return now.isAfter(entry.fetchedAt().plus(ttl));
    }

    int size() {
        return store.size();
    }

    private static String key(String city, String apiKey) {
        return city.trim().toLowerCase(Locale.ROOT) + '|' + apiKey;
    }
}
