package com.climatewatch.common.series;

import com.climatewatch.common.exception.ValidationException;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.PreparedDataset;
import com.climatewatch.common.model.RawReading;
import com.climatewatch.common.model.Reading;
import com.climatewatch.common.model.Season;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesPreparerTest {

    private static RawReading row(int line, String city, String date, Double temperature, String season) {
        return RawReading.of(line, city, date == null ? null : LocalDate.parse(date), temperature, season);
    }

    // ── Ordering and grouping ──────────────────────────────────────────────

    @Nested
    @DisplayName("prepare() — ordering and grouping")
    class OrderingTests {

        @Test
        @DisplayName("readings of a city come out in ascending timestamp order")
        void sortsChronologically() {
            PreparedDataset dataset = SeriesPreparer.prepare(List.of(
                row(2, "Berlin", "2020-03-05", 8.0, "spring"),
                row(3, "Berlin", "2020-01-10", -1.0, "winter"),
                row(4, "Berlin", "2020-02-01", 2.0, "winter")));

            List<Reading> readings = dataset.series("Berlin").readings();
            for (int i = 1; i < readings.size(); i++) {
                assertFalse(readings.get(i).timestamp().isBefore(readings.get(i - 1).timestamp()),
                    "Reading " + i + " is earlier than its predecessor");
            }
            assertEquals(LocalDate.parse("2020-01-10"), readings.get(0).timestamp());
        }

        @Test
        @DisplayName("equal timestamps keep input order")
        void stableTies() {
            PreparedDataset dataset = SeriesPreparer.prepare(List.of(
                row(2, "Cairo", "2021-07-01", 30.0, "summer"),
                row(3, "Cairo", "2021-07-01", 31.0, "summer"),
                row(4, "Cairo", "2021-07-01", 32.0, "summer")));

            double[] temps = dataset.series("Cairo").temperatures();
            assertArrayEquals(new double[]{30.0, 31.0, 32.0}, temps);
        }

        @Test
        @DisplayName("cities are grouped independently and case-sensitively")
        void groupsPerCity() {
            PreparedDataset dataset = SeriesPreparer.prepare(List.of(
                row(2, "Berlin", "2020-01-02", 1.0, "winter"),
                row(3, "Moscow", "2020-01-01", -10.0, "winter"),
                row(4, "berlin", "2020-01-03", 3.0, "winter"),
                row(5, "Berlin", "2020-01-01", 0.0, "winter")));

            assertEquals(List.of("Moscow", "Berlin", "berlin"), List.copyOf(dataset.cities()));
            CitySeries berlin = dataset.series("Berlin");
            assertEquals(2, berlin.size());
            assertArrayEquals(new double[]{0.0, 1.0}, berlin.temperatures());
            assertEquals(4, dataset.readingCount());
        }

        @Test
        @DisplayName("absent city → null series")
        void unknownCity() {
            PreparedDataset dataset = SeriesPreparer.prepare(List.of(
                row(2, "Berlin", "2020-01-02", 1.0, "winter")));
            assertNull(dataset.series("Paris"));
        }
    }

    // ── Season resolution ──────────────────────────────────────────────────

    @Nested
    @DisplayName("season resolution")
    class SeasonTests {

        @Test
        @DisplayName("missing season is derived from the timestamp month")
        void derivesSeason() {
            PreparedDataset dataset = SeriesPreparer.prepare(List.of(
                row(2, "Tokyo", "2020-12-15", 7.0, null),
                row(3, "Tokyo", "2021-04-15", 15.0, ""),
                row(4, "Tokyo", "2021-08-15", 28.0, null),
                row(5, "Tokyo", "2021-11-15", 14.0, "  ")));

            List<Reading> readings = dataset.series("Tokyo").readings();
            assertEquals(Season.WINTER, readings.get(0).season());
            assertEquals(Season.SPRING, readings.get(1).season());
            assertEquals(Season.SUMMER, readings.get(2).season());
            assertEquals(Season.AUTUMN, readings.get(3).season());
        }

        @Test
        @DisplayName("supplied season wins over the month mapping")
        void suppliedSeasonKept() {
            Reading reading = SeriesPreparer.validate(row(2, "Sydney", "2020-01-15", 26.0, "SUMMER"));
            assertEquals(Season.SUMMER, reading.season());
        }

        @Test
        @DisplayName("unknown season name → ValidationException")
        void unknownSeason() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> SeriesPreparer.validate(row(7, "Sydney", "2020-01-15", 26.0, "monsoon")));
            assertTrue(e.getMessage().contains("line 7"), e.getMessage());
        }
    }

    // ── Validation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("missing city rejects the whole batch")
        void missingCity() {
            List<RawReading> rows = List.of(
                row(2, "Berlin", "2020-01-01", 1.0, "winter"),
                row(3, " ", "2020-01-02", 1.0, "winter"));
            ValidationException e = assertThrows(ValidationException.class, () -> SeriesPreparer.prepare(rows));
            assertTrue(e.getMessage().contains("line 3"), e.getMessage());
            assertTrue(e.getMessage().contains("missing city"), e.getMessage());
        }

        @Test
        @DisplayName("missing timestamp → ValidationException")
        void missingTimestamp() {
            assertThrows(ValidationException.class,
                () -> SeriesPreparer.validate(row(2, "Berlin", null, 1.0, "winter")));
        }

        @Test
        @DisplayName("missing temperature → ValidationException")
        void missingTemperature() {
            assertThrows(ValidationException.class,
                () -> SeriesPreparer.validate(row(2, "Berlin", "2020-01-01", null, "winter")));
        }

        @Test
        @DisplayName("NaN temperature → ValidationException")
        void nanTemperature() {
            assertThrows(ValidationException.class,
                () -> SeriesPreparer.validate(row(2, "Berlin", "2020-01-01", Double.NaN, "winter")));
        }

        @Test
        @DisplayName("empty dataset → ValidationException")
        void emptyDataset() {
            assertThrows(ValidationException.class, () -> SeriesPreparer.prepare(Collections.emptyList()));
            assertThrows(ValidationException.class, () -> SeriesPreparer.prepare(null));
        }
    }
}
