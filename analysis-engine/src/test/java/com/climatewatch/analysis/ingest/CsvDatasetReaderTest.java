package com.climatewatch.analysis.ingest;

import com.climatewatch.analysis.config.AnalysisConfig;
import com.climatewatch.common.exception.ValidationException;
import com.climatewatch.common.model.RawReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvDatasetReaderTest {

    private final CsvDatasetReader reader = new CsvDatasetReader(new AnalysisConfig().csvMapper());

    @Test
    @DisplayName("rows keep their source line, header is line 1")
    void readsRowsWithLineNumbers() {
        List<RawReading> rows = reader.read("""
            city,timestamp,temperature,season
            Berlin,2020-01-01,-1.5,winter
            Cairo,2020-07-01,35.2,summer
            """);

        assertEquals(2, rows.size());
        assertEquals(new RawReading(2, "Berlin", LocalDate.of(2020, 1, 1), -1.5, "winter"), rows.get(0));
        assertEquals(3, rows.get(1).line());
        assertEquals(35.2, rows.get(1).temperature());
    }

    @Test
    @DisplayName("season column is optional")
    void seasonOptional() {
        List<RawReading> rows = reader.read("timestamp,city,temperature\n2020-04-02,Rome,14.0\n");
        assertNull(rows.get(0).season());
    }

    @Test
    @DisplayName("date-time timestamps are truncated to their date")
    void dateTimeTruncated() {
        List<RawReading> rows = reader.read("""
            timestamp,city,temperature
            2020-03-05 00:00:00,Rome,11.0
            2020-03-06T12:30:00,Rome,12.0
            """);
        assertEquals(LocalDate.of(2020, 3, 5), rows.get(0).timestamp());
        assertEquals(LocalDate.of(2020, 3, 6), rows.get(1).timestamp());
    }

    @Test
    @DisplayName("empty cells are passed on as null")
    void emptyCellIsNull() {
        List<RawReading> rows = reader.read("timestamp,city,temperature\n2020-01-01,Berlin,\n");
        assertNull(rows.get(0).temperature());
    }

    @Test
    @DisplayName("missing required column → ValidationException")
    void missingColumn() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> reader.read("timestamp,city\n2020-01-01,Berlin\n"));
        assertTrue(e.getMessage().contains("temperature"), e.getMessage());
    }

    @Test
    @DisplayName("non-numeric temperature names its line")
    void badTemperature() {
        ValidationException e = assertThrows(ValidationException.class, () -> reader.read("""
            timestamp,city,temperature
            2020-01-01,Berlin,1.0
            2020-01-02,Berlin,warm
            """));
        assertTrue(e.getMessage().contains("line 3"), e.getMessage());
    }

    @Test
    @DisplayName("unparseable timestamp → ValidationException")
    void badTimestamp() {
        assertThrows(ValidationException.class,
            () -> reader.read("timestamp,city,temperature\n01/02/2020,Berlin,1.0\n"));
    }

    @Test
    @DisplayName("blank file → ValidationException")
    void blankFile() {
        assertThrows(ValidationException.class, () -> reader.read("   "));
        assertThrows(ValidationException.class, () -> reader.read(null));
    }

    @Test
    @DisplayName("blank lines are counted in the reported line")
    void blankLinesCounted() {
        String csv = "timestamp,city,temperature\n2020-01-01,Berlin,1.0\n\n\n2020-01-02,Berlin,2.0\n";
        List<RawReading> rows = reader.read(csv);

        assertEquals(2, rows.get(0).line());
        assertEquals(5, rows.get(1).line());
    }

    @Test
    @DisplayName("bad value after blank lines names its physical line")
    void badValueAfterBlankLines() {
        ValidationException e = assertThrows(ValidationException.class, () -> reader.read(
            "timestamp,city,temperature\n2020-01-01,Berlin,1.0\n\n\n2020-01-02,Berlin,warm\n"));
        assertTrue(e.getMessage().contains("line 5"), e.getMessage());
    }

    @Test
    @DisplayName("quoted line break inside a field shifts the following rows")
    void quotedLineBreak() {
        List<RawReading> rows = reader.read(
            "timestamp,city,temperature\n2020-01-01,\"New\nYork\",1.0\n2020-01-02,Oslo,2.0\n");

        assertEquals("New\nYork", rows.get(0).city());
        assertEquals(4, rows.get(1).line());
    }

    @Test
    @DisplayName("required columns are checked against the header, not the first row")
    void shortFirstRowIsNotAMissingColumn() {
        List<RawReading> rows = reader.read("timestamp,city,temperature\n2020-01-01,Berlin\n");

        assertEquals(1, rows.size());
        assertEquals("Berlin", rows.get(0).city());
        assertNull(rows.get(0).temperature());
    }

    @Test
    @DisplayName("header without data still has its columns checked")
    void headerOnlyMissingColumn() {
        assertThrows(ValidationException.class, () -> reader.read("timestamp,city\n"));
        assertTrue(reader.read("timestamp,city,temperature\n").isEmpty());
    }

    @Test
    @DisplayName("line locator skips the row's own line break")
    void lineLocator() {
        CsvDatasetReader.LineLocator lines = new CsvDatasetReader.LineLocator("a\nbb\n\nc");
        assertEquals(1, lines.lineAt(2));
        assertEquals(2, lines.lineAt(5));
        assertEquals(4, lines.lineAt(8));
    }
}
