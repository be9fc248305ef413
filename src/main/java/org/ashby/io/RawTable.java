package org.ashby.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, column-named table of raw cell values as produced by a loader.
 *
 * Cells are heterogeneous: {@code String}, {@code Number}, {@code Boolean} or {@code null} for blanks.
 * Nothing here interprets the values; that is the job of the model layer.
 */
public final class RawTable {

    private final List<String> columns;
    private final Map<String, Integer> columnIndex;
    private final List<List<Object>> rows;

    public RawTable(List<String> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("column name must be non-empty (index " + i + ")");
            }
            if (index.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
        }

        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = Objects.requireNonNull(rows.get(r), "row must not be null");
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row " + r + " has " + row.size() + " cells but the table has " + columns.size() + " columns"
                );
            }
            // List.copyOf rejects nulls, and blank cells are nulls
            copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
        }

        this.columns = List.copyOf(columns);
        this.columnIndex = Map.copyOf(index);
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columnIndex.containsKey(name);
    }

    public int rowCount() {
        return rows.size();
    }

    public TableRow row(int index) {
        if (index < 0 || index >= rows.size()) {
            throw new IndexOutOfBoundsException("row=" + index + ", rows=" + rows.size());
        }
        return new TableRow(this, index);
    }

    public List<TableRow> rows() {
        List<TableRow> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            out.add(new TableRow(this, i));
        }
        return out;
    }

    public Object cell(int rowIndex, String column) {
        return rows.get(rowIndex).get(requireColumn(column));
    }

    /**
     * All values of one column, in row order (may contain nulls).
     */
    public List<Object> column(String name) {
        int idx = requireColumn(name);
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            out.add(row.get(idx));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns a new table with one extra column appended on the right.
     */
    public RawTable withColumn(String name, List<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(
                    "Column '" + name + "' has " + values.size() + " values but the table has " + rows.size() + " rows"
            );
        }
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.add(name);

        List<List<Object>> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = new ArrayList<>(rows.get(i));
            row.add(values.get(i));
            newRows.add(row);
        }
        return new RawTable(newColumns, newRows);
    }

    private int requireColumn(String name) {
        Integer idx = columnIndex.get(name);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return idx;
    }

    @Override
    public String toString() {
        return "RawTable(columns=" + columns.size() + ", rows=" + rows.size() + ")";
    }
}
