package com.dashboard.insights.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered values of one metric, optionally paired with their timestamps.
 * Missing values are NaN. Calendar gaps are kept as they are.
 */
public final class ObservationSeries {

    private final String name;
    private final double[] values;
    private final List<LocalDateTime> timestamps;

    public ObservationSeries(String name, double[] values, List<LocalDateTime> timestamps) {
        if (timestamps != null && !timestamps.isEmpty() && timestamps.size() != values.length) {
            throw new IllegalArgumentException("Series " + name + " has " + values.length
                    + " values but " + timestamps.size() + " timestamps");
        }
        this.name = name;
        this.values = values.clone();
        this.timestamps = timestamps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(timestamps));
    }

    public static ObservationSeries of(String name, double... values) {
        return new ObservationSeries(name, values, List.of());
    }

    /**
     * Same series with missing values removed, order preserved.
     */
    public ObservationSeries withoutMissing() {
        List<LocalDateTime> keptTimes = new ArrayList<>();
        double[] kept = new double[values.length];
        int n = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) continue;
            kept[n++] = values[i];
            if (hasTimestamps()) keptTimes.add(timestamps.get(i));
        }
        double[] trimmed = new double[n];
        System.arraycopy(kept, 0, trimmed, 0, n);
        return new ObservationSeries(name, trimmed, keptTimes);
    }

    public String getName() { return name; }
    public double[] values() { return values.clone(); }
    public double valueAt(int index) { return values[index]; }
    public int size() { return values.length; }
    public boolean hasTimestamps() { return !timestamps.isEmpty(); }
    public List<LocalDateTime> getTimestamps() { return timestamps; }

    public LocalDateTime timestampAt(int index) {
        return hasTimestamps() ? timestamps.get(index) : null;
    }
}
