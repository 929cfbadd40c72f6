package com.vidnyan.causeway.domain.trace;

import java.util.*;

/**
 * Table of sampled values: one column per graph node, one row per sample.
 * Immutable; column arrays are copied on the way in and out.
 */
public final class Trace {

    private static final Trace EMPTY = new Trace(new LinkedHashMap<>(), 0);

    private final Map<String, double[]> columns;
    private final int rowCount;

    private Trace(LinkedHashMap<String, double[]> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static Trace empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if columns differ in length
     */
    public static Trace of(Map<String, double[]> columns) {
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, double[]> column : columns.entrySet()) {
            if (rows >= 0 && column.getValue().length != rows) {
                throw new IllegalArgumentException("Column '" + column.getKey() + "' has "
                        + column.getValue().length + " rows, expected " + rows);
            }
            rows = column.getValue().length;
            copy.put(column.getKey(), column.getValue().clone());
        }
        return new Trace(copy, Math.max(rows, 0));
    }

    /**
     * Build from JSON-like lists of numbers. Nulls become NaN.
     */
    public static Trace fromLists(Map<String, ? extends List<? extends Number>> columns) {
        Map<String, double[]> arrays = new LinkedHashMap<>();
        columns.forEach((name, values) -> arrays.put(name, values.stream()
                .mapToDouble(v -> v == null ? Double.NaN : v.doubleValue())
                .toArray()));
        return of(arrays);
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException for an unknown column
     */
    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values.clone();
    }

    public double value(String column, int row) {
        return columns.get(column)[row];
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * New table with the given rows, in order. Rows may repeat.
     */
    public Trace select(int[] rows) {
        LinkedHashMap<String, double[]> selected = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            double[] out = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                out[i] = values[rows[i]];
            }
            selected.put(name, out);
        });
        return new Trace(selected, rows.length);
    }

    /**
     * New table with only the named columns.
     */
    public Trace project(Collection<String> names) {
        LinkedHashMap<String, double[]> projected = new LinkedHashMap<>();
        for (String name : names) {
            projected.put(name, column(name));
        }
        return new Trace(projected, rowCount);
    }

    public boolean hasMissing() {
        return columns.values().stream().flatMapToDouble(Arrays::stream).anyMatch(Double::isNaN);
    }

    /**
     * New table without the rows that contain a NaN in any column.
     */
    public Trace dropIncompleteRows() {
        int[] complete = java.util.stream.IntStream.range(0, rowCount)
                .filter(row -> columns.values().stream().noneMatch(c -> Double.isNaN(c[row])))
                .toArray();
        return complete.length == rowCount ? this : select(complete);
    }

    public Map<String, Double> row(int index) {
        Map<String, Double> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> row.put(name, values[index]));
        return row;
    }

    /**
     * JSON-friendly copy: column name to list of values.
     */
    public Map<String, List<Double>> toLists() {
        Map<String, List<Double>> lists = new LinkedHashMap<>();
        columns.forEach((name, values) -> lists.put(name, Arrays.stream(values).boxed().toList()));
        return lists;
    }

    @Override
    public String toString() {
        return "Trace[" + rowCount + " rows x " + columns.size() + " columns " + columns.keySet() + "]";
    }
}
