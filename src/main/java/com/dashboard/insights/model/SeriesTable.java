package com.dashboard.insights.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Metric columns of a dataset after parsing, aligned row by row.
 *
 * @param columns    one series per numeric column, in declared order
 * @param timestamps row timestamps, empty when the dataset has no date column
 */
public record SeriesTable(List<ObservationSeries> columns, List<LocalDateTime> timestamps) {

    public SeriesTable {
        columns = List.copyOf(columns);
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
    }

    public boolean isOrdered() {
        return !timestamps.isEmpty();
    }

    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public Optional<ObservationSeries> column(String name) {
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public LocalDateTime timestampAt(int row) {
        return isOrdered() ? timestamps.get(row) : null;
    }
}
