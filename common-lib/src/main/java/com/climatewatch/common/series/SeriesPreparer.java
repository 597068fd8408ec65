package com.climatewatch.common.series;

import com.climatewatch.common.exception.ValidationException;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.PreparedDataset;
import com.climatewatch.common.model.RawReading;
import com.climatewatch.common.model.Reading;
import com.climatewatch.common.model.Season;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates raw rows and arranges them into per-city chronological series.
 *
 * <p>Rows are validated first; a single invalid row rejects the whole batch
 * with a {@link ValidationException} naming its line. The valid rows are then
 * stable-sorted by timestamp (equal timestamps keep their input order) and
 * grouped per city. A missing season is derived from the timestamp month.
 *
 * <p>No Spring dependencies. No I/O. Pure function.
 */
public final class SeriesPreparer {

    private static final String COMPONENT = "SeriesPreparer";

    private SeriesPreparer() {}

    public static PreparedDataset prepare(Collection<RawReading> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new ValidationException(COMPONENT, "Dataset contains no readings");
        }

        List<Reading> readings = new ArrayList<>(rows.size());
        for (RawReading row : rows) {
            readings.add(validate(row));
        }

        // List.sort is stable: ties keep input order
        readings.sort(Comparator.comparing(Reading::timestamp));

        Map<String, List<Reading>> grouped = new LinkedHashMap<>();
        for (Reading reading : readings) {
            grouped.computeIfAbsent(reading.city(), c -> new ArrayList<>()).add(reading);
        }

        Map<String, CitySeries> series = new LinkedHashMap<>();
        grouped.forEach((city, cityReadings) -> series.put(city, new CitySeries(city, cityReadings)));
        return new PreparedDataset(series);
    }

    /**
     * Converts one raw row into a {@link Reading}.
     *
     * @throws ValidationException when city, timestamp or temperature is missing,
     *         the temperature is not finite, or the season name is unknown
     */
    public static Reading validate(RawReading row) {
        if (row == null) {
            throw new ValidationException(COMPONENT, "Null record in dataset");
        }
        if (row.city() == null || row.city().isBlank()) {
            throw invalid(row, "missing city");
        }
        if (row.timestamp() == null) {
            throw invalid(row, "missing timestamp");
        }
        if (row.temperature() == null) {
            throw invalid(row, "missing temperature");
        }
        if (!Double.isFinite(row.temperature())) {
            throw invalid(row, "temperature is not a finite number: " + row.temperature());
        }

        Season season;
        if (row.season() == null || row.season().isBlank()) {
            season = Season.fromMonth(row.timestamp().getMonthValue());
        } else {
            season = Season.fromWireName(row.season());
            if (season == null) {
                throw invalid(row, "unknown season '" + row.season() + "'");
            }
        }
        return Reading.of(row.city(), row.timestamp(), row.temperature(), season);
    }

    private static ValidationException invalid(RawReading row, String reason) {
        return new ValidationException(COMPONENT, "Invalid record at line " + row.line() + ": " + reason);
    }
}
