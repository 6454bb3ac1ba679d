package com.calldash.calldash.data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rectangular call dataset: every row carries exactly {@link #columns()}.
 */
public record Dataset(List<Row> rows, List<String> columns, List<DataFile> sourceFiles) {

    public Dataset {
        columns = columns == null ? List.of() : List.copyOf(new LinkedHashSet<>(columns));
        sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
        List<Row> normalized = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (Row row : rows) {
                boolean aligned = new ArrayList<>(row.columns()).equals(columns);
                normalized.add(aligned ? row : Row.of(columns, row.asMap()));
            }
        }
        rows = List.copyOf(normalized);
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of(), List.of());
    }

    /**
     * Builds a dataset from loosely keyed rows, filling every column absent from a row with null.
     */
    public static Dataset fromMaps(List<? extends Map<String, ?>> rows, List<String> columns, List<DataFile> sourceFiles) {
        List<Row> normalized = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            normalized.add(Row.of(columns, row));
        }
        return new Dataset(normalized, columns, sourceFiles);
    }

    /**
     * Builds a dataset whose columns are the union of all row keys in first-seen order.
     */
    public static Dataset fromMaps(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            if (row != null) {
                columns.addAll(row.keySet());
            }
        }
        return fromMaps(rows, new ArrayList<>(columns), List.of());
    }

    /**
     * Returns the columns that came from uploaded files, without provenance columns.
     */
    public List<String> userColumns() {
        List<String> user = new ArrayList<>(columns.size());
        for (String column : columns) {
            if (!CallDataConstants.PROVENANCE_COLUMNS.contains(column)) {
                user.add(column);
            }
        }
        return user;
    }

    public boolean isEmpty() {
        return rows.isEmpty() && columns.isEmpty();
    }
}
