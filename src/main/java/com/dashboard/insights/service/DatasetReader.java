package com.dashboard.insights.service;

import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.model.Dataset;
import com.dashboard.insights.model.ObservationSeries;
import com.dashboard.insights.model.SeriesTable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Turns a request {@link Dataset} into aligned numeric columns.
 *
 * When a date column is declared, rows are stably sorted by it (ISO-8601 dates, date-times,
 * offset date-times, or epoch milliseconds). Numeric cells may be numbers or numeric strings;
 * null, blank or absent cells become NaN.
 */
@Component
public class DatasetReader {

    public SeriesTable read(Dataset dataset) {
        List<String> columns = dataset.getNumericColumns();
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Dataset declares no numeric columns");
        }
        return read(dataset, columns);
    }

    /**
     * Reads a single metric column, which need not be listed among the numeric columns.
     */
    public ObservationSeries readColumn(Dataset dataset, String column) {
        return read(dataset, List.of(column)).columns().get(0);
    }

    private SeriesTable read(Dataset dataset, List<String> columns) {
        List<Map<String, Object>> rows = dataset.getRows();
        if (rows == null || rows.isEmpty()) {
            throw new InsufficientDataException("Dataset has no rows", 1, 0);
        }
        for (String column : columns) {
            boolean known = rows.stream().anyMatch(row -> row != null && row.containsKey(column));
            if (!known) {
                throw new IllegalArgumentException("Unknown column: " + column);
            }
        }

        String dateColumn = dataset.getDateColumn();
        boolean dated = dateColumn != null && !dateColumn.isBlank();
        List<LocalDateTime> parsed = new ArrayList<>(rows.size());
        List<Integer> order = IntStream.range(0, rows.size()).boxed().toList();
        if (dated) {
            for (int i = 0; i < rows.size(); i++) {
                parsed.add(parseTimestamp(cell(rows.get(i), dateColumn), dateColumn, i));
            }
            order = order.stream().sorted(Comparator.comparing(parsed::get)).toList();
        }

        List<LocalDateTime> timestamps = new ArrayList<>(rows.size());
        if (dated) {
            for (int index : order) timestamps.add(parsed.get(index));
        }

        List<ObservationSeries> series = new ArrayList<>(columns.size());
        for (String column : columns) {
            double[] values = new double[rows.size()];
            for (int i = 0; i < order.size(); i++) {
                int source = order.get(i);
                values[i] = parseNumber(cell(rows.get(source), column), column, source);
            }
            series.add(new ObservationSeries(column, values, timestamps));
        }
        return new SeriesTable(series, timestamps);
    }

    private static Object cell(Map<String, Object> row, String column) {
        return row == null ? null : row.get(column);
    }

    static double parseNumber(Object value, String column, int row) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            if (text.isBlank()) return Double.NaN;
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format(
                        "Row %d column %s is not numeric: '%s'", row, column, text), e);
            }
        }
        throw new IllegalArgumentException(String.format(
                "Row %d column %s has unsupported value type %s", row, column, value.getClass().getSimpleName()));
    }

    static LocalDateTime parseTimestamp(Object value, String column, int row) {
        if (value == null) {
            throw new IllegalArgumentException(String.format("Row %d has no value for date column %s", row, column));
        }
        if (value instanceof Number epochMillis) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis.longValue()), ZoneOffset.UTC);
        }
        String text = value.toString().trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(String.format(
                    "Row %d column %s is not an ISO-8601 date: '%s'", row, column, text), e);
        }
    }
}
