package com.dashboard.insights.testutil;

import com.dashboard.insights.config.DetectionConfig;
import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.model.Dataset;
import com.dashboard.insights.model.ObservationSeries;
import com.dashboard.insights.model.SeriesTable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    /** Row indices that {@link #salesWithOutliers()} pushes far above the norm. */
    public static final int[] OUTLIER_ROWS = {50, 150, 300};

    private TestDataFactory() {}

    public static double[] gaussian(int n, double mean, double std, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + std * random.nextGaussian();
        }
        return values;
    }

    /**
     * 365 daily sales around 1000 (std 50) with three spikes of +600.
     */
    public static double[] salesWithOutliers() {
        double[] values = gaussian(365, 1000.0, 50.0, 42L);
        for (int row : OUTLIER_ROWS) {
            values[row] = 1600.0;
        }
        return values;
    }

    public static double[] linear(int n, double start, double step) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = start + step * i;
        return values;
    }

    public static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    public static List<LocalDateTime> dailyTimestamps(int n) {
        List<LocalDateTime> timestamps = new ArrayList<>(n);
        for (int i = 0; i < n; i++) timestamps.add(START.plusDays(i).atStartOfDay());
        return timestamps;
    }

    public static SeriesTable datedTable(Map<String, double[]> columns) {
        int n = columns.values().iterator().next().length;
        List<LocalDateTime> timestamps = dailyTimestamps(n);
        List<ObservationSeries> series = new ArrayList<>();
        columns.forEach((name, values) -> series.add(new ObservationSeries(name, values, timestamps)));
        return new SeriesTable(series, timestamps);
    }

    public static SeriesTable undatedTable(Map<String, double[]> columns) {
        List<ObservationSeries> series = new ArrayList<>();
        columns.forEach((name, values) -> series.add(ObservationSeries.of(name, values)));
        return new SeriesTable(series, List.of());
    }

    /**
     * Daily dataset with a "Date" column; NaN values become absent cells.
     */
    public static Dataset dailyDataset(Map<String, double[]> columns) {
        int n = columns.values().iterator().next().length;
        List<Map<String, Object>> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Date", START.plusDays(i).toString());
            for (Map.Entry<String, double[]> column : columns.entrySet()) {
                double value = column.getValue()[i];
                row.put(column.getKey(), Double.isNaN(value) ? null : value);
            }
            rows.add(row);
        }
        return Dataset.builder()
                .dateColumn("Date")
                .numericColumns(new ArrayList<>(columns.keySet()))
                .rows(rows)
                .build();
    }

    public static Dataset salesDataset(double... values) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("TotalSales", values);
        return dailyDataset(columns);
    }

    public static DetectionConfig detectionConfig() {
        return new DetectionConfig();
    }

    public static TrendConfig trendConfig() {
        return new TrendConfig();
    }
}
