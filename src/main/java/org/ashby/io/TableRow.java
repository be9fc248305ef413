package org.ashby.io;

import java.util.Objects;

/**
 * Read-only view of one row of a {@link RawTable}.
 */
public final class TableRow {

    private final RawTable table;
    private final int index;

    TableRow(RawTable table, int index) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.index = index;
    }

    /** @return zero-based position of this row in its table */
    public int index() {
        return index;
    }

    /**
     * @return the raw cell for the column, or null if the cell is blank
     * @throws IllegalArgumentException if the table has no such column
     */
    public Object get(String column) {
        return table.cell(index, column);
    }

    @Override
    public String toString() {
        return "TableRow(" + index + ")";
    }
}
