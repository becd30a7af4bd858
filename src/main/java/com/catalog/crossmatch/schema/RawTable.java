package com.catalog.crossmatch.schema;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A catalogue as read from its source: column names and string cells.
 */
public final class RawTable {

    private final List<String> columns;
    private final List<String[]> rows;
    private final Map<String, Integer> index;

    public RawTable(List<String> columns, List<String[]> rows) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns is required"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows is required"));
        this.index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            index.putIfAbsent(this.columns.get(i), i);
        }
    }

    public List<String> getColumns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String name) {
        return index.containsKey(name);
    }

    public OptionalInt columnIndex(String name) {
        Integer i = index.get(name);
        return i != null ? OptionalInt.of(i) : OptionalInt.empty();
    }

    /**
     * Raw cell value; null when the row is shorter than the header.
     */
    public String cell(int row, int column) {
        String[] values = rows.get(row);
        return column < values.length ? values[column] : null;
    }
}
