package com.bizpulse.anomaly.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable block of observations sharing one feature schema.
 *
 * Each row is one observation (a FeatureRow); each column is a named numeric feature.
 * A missing value is stored as {@link Double#NaN} and imputed by the detectors.
 * Row ids and timestamps are optional and only carried through to anomaly records.
 */
public final class FeatureMatrix {

    private final List<String> columns;
    private final double[][] values;
    private final List<String> rowIds;
    private final List<Instant> timestamps;

    private FeatureMatrix(List<String> columns, double[][] values, List<String> rowIds, List<Instant> timestamps) {
        this.columns = columns;
        this.values = values;
        this.rowIds = rowIds;
        this.timestamps = timestamps;
    }

    public static FeatureMatrix of(List<String> columns, double[][] rows) {
        Builder builder = builder(columns);
        for (double[] row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    /**
     * Build a matrix from name → value maps. The schema is the union of keys in first-seen order;
     * a key missing from a row (or mapped to {@code null}) becomes NaN.
     */
    public static FeatureMatrix fromRows(List<Map<String, Double>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Double> row : rows) {
            names.addAll(row.keySet());
        }
        Builder builder = builder(new ArrayList<>(names));
        for (Map<String, Double> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    public static FeatureMatrix empty(List<String> columns) {
        return builder(columns).build();
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public int featureCount() {
        return columns.size();
    }

    public List<String> getColumns() {
        return columns;
    }

    public double value(int row, int column) {
        return values[row][column];
    }

    public double[] row(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }

    /**
     * Copy of all non-missing values of a column.
     */
    public double[] presentValues(int column) {
        return Arrays.stream(values)
                .mapToDouble(r -> r[column])
                .filter(v -> !Double.isNaN(v))
                .toArray();
    }

    public String rowId(int row) {
        return rowIds.get(row);
    }

    public Instant timestamp(int row) {
        return timestamps.get(row);
    }

    public Map<String, Double> rowAsMap(int row) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            double v = values[row][c];
            map.put(columns.get(c), Double.isNaN(v) ? null : v);
        }
        return map;
    }

    public static final class Builder {

        private final List<String> columns;
        private final List<double[]> rows = new ArrayList<>();
        private final List<String> rowIds = new ArrayList<>();
        private final List<Instant> timestamps = new ArrayList<>();

        private Builder(List<String> columns) {
            Objects.requireNonNull(columns, "columns must not be null");
            if (new LinkedHashSet<>(columns).size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate feature names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(double[] row) {
            return addRow(row, null, null);
        }

        public Builder addRow(double[] row, String rowId, Instant timestamp) {
            Objects.requireNonNull(row, "row must not be null");
            if (row.length != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.length
                        + " values but schema has " + columns.size() + " features");
            }
            rows.add(Arrays.copyOf(row, row.length));
            rowIds.add(rowId);
            timestamps.add(timestamp);
            return this;
        }

        public Builder addRow(Map<String, Double> row) {
            return addRow(row, null, null);
        }

        public Builder addRow(Map<String, Double> row, String rowId, Instant timestamp) {
            double[] values = new double[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                Double v = row.get(columns.get(c));
                values[c] = v == null ? Double.NaN : v;
            }
            return addRow(values, rowId, timestamp);
        }

        public FeatureMatrix build() {
            return new FeatureMatrix(columns, rows.toArray(new double[0][]),
                    Collections.unmodifiableList(new ArrayList<>(rowIds)),
                    Collections.unmodifiableList(new ArrayList<>(timestamps)));
        }
    }
}
