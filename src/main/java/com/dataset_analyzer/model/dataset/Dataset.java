package com.dataset_analyzer.model.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable tabular input of one analysis run.
 * Rows are stored positionally against {@link #getColumns()}; every row has exactly one cell per column.
 */
public final class Dataset {

    private final String name;
    private final List<String> columns;
    private final List<List<CellValue>> rows;

    private Dataset(String name, List<String> columns, List<List<CellValue>> rows) {
        this.name = name;
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset of(String name, List<String> columns, List<List<CellValue>> rows) {
        List<String> columnCopy = List.copyOf(columns);
        if (columnCopy.stream().distinct().count() != columnCopy.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columnCopy);
        }
        List<List<CellValue>> rowCopy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<CellValue> row = rows.get(i);
            if (row.size() != columnCopy.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                        + " cells but the dataset has " + columnCopy.size() + " columns");
            }
            rowCopy.add(List.copyOf(row));
        }
        return new Dataset(name, columnCopy, Collections.unmodifiableList(rowCopy));
    }

    /**
     * Builds a dataset from column-to-value maps that already share one key set.
     */
    public static Dataset fromRecords(String name, List<String> columns, List<Map<String, ?>> records) {
        List<List<CellValue>> rows = records.stream()
                .map(record -> columns.stream()
                        .map(column -> CellValue.of(record.get(column)))
                        .collect(Collectors.toList()))
                .collect(Collectors.toList());
        return of(name, columns, rows);
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<CellValue>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return index;
    }

    public List<CellValue> columnValues(String column) {
        int index = columnIndex(column);
        return rows.stream().map(row -> row.get(index)).collect(Collectors.toUnmodifiableList());
    }

    public Map<String, CellValue> rowAsMap(int rowIndex) {
        List<CellValue> row = rows.get(rowIndex);
        Map<String, CellValue> mapped = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            mapped.put(columns.get(i), row.get(i));
        }
        return mapped;
    }

    /**
     * The first {@code n} rows as column-to-value maps, fewer when the dataset is shorter.
     */
    public List<Map<String, CellValue>> head(int n) {
        int limit = Math.max(0, Math.min(n, rows.size()));
        List<Map<String, CellValue>> preview = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            preview.add(rowAsMap(i));
        }
        return preview;
    }
}
