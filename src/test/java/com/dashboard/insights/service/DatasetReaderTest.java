package com.dashboard.insights.service;

import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.model.Dataset;
import com.dashboard.insights.model.ObservationSeries;
import com.dashboard.insights.model.SeriesTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetReaderTest {

    private final DatasetReader reader = new DatasetReader();

    @Test
    void read_sortsRowsByDateColumn() {
        Dataset dataset = Dataset.builder()
                .dateColumn("Date")
                .numericColumns(List.of("TotalSales"))
                .rows(List.of(
                        Map.of("Date", "2024-01-03", "TotalSales", 30),
                        Map.of("Date", "2024-01-01", "TotalSales", "10.5"),
                        Map.of("Date", "2024-01-02", "TotalSales", 20.0)))
                .build();

        SeriesTable table = reader.read(dataset);

        assertThat(table.isOrdered()).isTrue();
        assertThat(table.column("TotalSales").orElseThrow().values()).containsExactly(10.5, 20.0, 30.0);
        assertThat(table.timestampAt(0)).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    @Test
    void read_withoutDateColumn_keepsInputOrder() {
        Dataset dataset = Dataset.builder()
                .numericColumns(List.of("a", "b"))
                .rows(List.of(Map.of("a", 3, "b", 1), Map.of("a", 1, "b", 2)))
                .build();

        SeriesTable table = reader.read(dataset);

        assertThat(table.isOrdered()).isFalse();
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.column("a").orElseThrow().values()).containsExactly(3.0, 1.0);
        assertThat(table.timestampAt(0)).isNull();
    }

    @Test
    void read_nullAndBlankCellsBecomeMissing() {
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("m", null);
        rows.add(withNull);
        rows.add(Map.of("m", " "));
        rows.add(Map.of("m", 4));

        ObservationSeries series = reader.readColumn(Dataset.builder().rows(rows).build(), "m");

        assertThat(series.valueAt(0)).isNaN();
        assertThat(series.valueAt(1)).isNaN();
        assertThat(series.withoutMissing().values()).containsExactly(4.0);
    }

    @Test
    void read_unknownColumn_rejected() {
        Dataset dataset = Dataset.builder()
                .numericColumns(List.of("Revenue"))
                .rows(List.of(Map.of("TotalSales", 1)))
                .build();

        assertThatThrownBy(() -> reader.read(dataset))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown column: Revenue");
    }

    @Test
    void read_noRows_throwsInsufficientData() {
        Dataset dataset = Dataset.builder().numericColumns(List.of("m")).rows(List.of()).build();

        assertThatThrownBy(() -> reader.read(dataset)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void read_noNumericColumns_rejected() {
        Dataset dataset = Dataset.builder().rows(List.of(Map.of("m", 1))).build();

        assertThatThrownBy(() -> reader.read(dataset)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseNumber_nonNumericText_rejected() {
        assertThatThrownBy(() -> DatasetReader.parseNumber("twelve", "m", 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Row 3");
        assertThatThrownBy(() -> DatasetReader.parseNumber(List.of(1), "m", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseTimestamp_acceptedFormats() {
        assertThat(DatasetReader.parseTimestamp("2024-03-05T10:15:00", "d", 0))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 10, 15));
        assertThat(DatasetReader.parseTimestamp("2024-03-05T10:15:00+02:00", "d", 0))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 8, 15));
        assertThat(DatasetReader.parseTimestamp("2024-03-05T10:15:00Z", "d", 0))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 10, 15));
        assertThat(DatasetReader.parseTimestamp(0L, "d", 0))
                .isEqualTo(LocalDateTime.of(1970, 1, 1, 0, 0));
        assertThatThrownBy(() -> DatasetReader.parseTimestamp("03/05/2024", "d", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
