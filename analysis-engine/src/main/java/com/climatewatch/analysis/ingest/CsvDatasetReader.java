package com.climatewatch.analysis.ingest;

import com.climatewatch.common.exception.ValidationException;
import com.climatewatch.common.model.RawReading;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the historical dataset from CSV text into unvalidated {@link RawReading} rows.
 *
 * <p>Expected header (any column order): {@code timestamp,city,temperature[,season]}.
 * Timestamps are ISO dates; a date-time ({@code 2020-01-01 00:00:00} or ISO) is
 * accepted and truncated to its date. Empty cells become {@code null} and are
 * rejected later by the series preparer with their line number.
 */
@Component
public class CsvDatasetReader {

    private static final String COMPONENT = "CsvDatasetReader";

    static final String TIMESTAMP   = "timestamp";
    static final String CITY        = "city";
    static final String TEMPERATURE = "temperature";
    static final String SEASON      = "season";

    private final CsvMapper csvMapper;

    public CsvDatasetReader(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    public List<RawReading> read(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new ValidationException(COMPONENT, "Dataset file is empty");
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<RawReading> rows = new ArrayList<>();
        int line = 1; // header

        try (MappingIterator<Map<String, String>> it =
                 csvMapper.readerFor(Map.class).with(schema).readValues(csv)) {
            // the first advance reads the header into the parser's schema
            boolean more = it.hasNextValue();
            requireColumns(((CsvParser) it.getParser()).getSchema());

            LineLocator lines = new LineLocator(csv);
            while (more) {
                Map<String, String> row = it.nextValue();
                line = lines.lineAt(it.getCurrentLocation().getCharOffset());
                rows.add(toRawReading(line, row));
                more = it.hasNextValue();
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new ValidationException(COMPONENT, "Malformed CSV after line " + line + ": " + e.getMessage(), e);
        }
        return rows;
    }

    private void requireColumns(CsvSchema header) {
        for (String column : List.of(TIMESTAMP, CITY, TEMPERATURE)) {
            if (header.column(column) == null) {
                throw new ValidationException(COMPONENT, "Missing required column '" + column + "'");
            }
        }
    }

    private RawReading toRawReading(int line, Map<String, String> row) {
        return RawReading.of(
            line,
            emptyToNull(row.get(CITY)),
            parseDate(line, emptyToNull(row.get(TIMESTAMP))),
            parseTemperature(line, emptyToNull(row.get(TEMPERATURE))),
            emptyToNull(row.get(SEASON)));
    }

    private static Double parseTemperature(int line, String text) {
        if (text == null) return null;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ValidationException(COMPONENT,
                "Invalid record at line " + line + ": temperature '" + text + "' is not a number", e);
        }
    }

    static LocalDate parseDate(int line, String text) {
        if (text == null) return null;
        // date-time forms keep only their date part
        String datePart = text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')
            ? text.substring(0, 10)
            : text;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            throw new ValidationException(COMPONENT,
                "Invalid record at line " + line + ": timestamp '" + text + "' is not an ISO date", e);
        }
    }

    /**
     * Maps the parser's character offset at the end of a row to the 1-based
     * physical line holding the row's last character. Blank lines and quoted
     * line breaks are counted. Offsets only move forward, so the scan is linear.
     */
    static final class LineLocator {
        private final String text;
        private int scanned;
        private int newlines;

        LineLocator(String text) {
            this.text = text;
        }

        int lineAt(long charOffset) {
            int last = (int) Math.min(Math.max(charOffset, 0), text.length()) - 1;
            // the terminating line break belongs to the row
            while (last >= 0 && (text.charAt(last) == '\n' || text.charAt(last) == '\r')) {
                last--;
            }
            for (; scanned <= last; scanned++) {
                if (text.charAt(scanned) == '\n') newlines++;
            }
            return newlines + 1;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
