package org.ashby.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a plottable property lives in the table.
 *
 * A SINGLE descriptor reads one column named like the property.
 * A RANGE descriptor reads a low and a high column; it may also know a bare
 * value column of the same name, used when both bounds of a row are blank.
 */
public final class ColumnDescriptor {

    private final String propertyName;
    private final ColumnKind kind;
    private final List<String> sourceColumns;
    private final String valueColumn; // null when absent

    private ColumnDescriptor(String propertyName, ColumnKind kind, List<String> sourceColumns, String valueColumn) {
        this.propertyName = propertyName;
        this.kind = kind;
        this.sourceColumns = List.copyOf(sourceColumns);
        this.valueColumn = valueColumn;
    }

    public static ColumnDescriptor single(String column) {
        requireName(column, "column");
        return new ColumnDescriptor(column, ColumnKind.SINGLE, List.of(column), column);
    }

    public static ColumnDescriptor range(String propertyName, String lowColumn, String highColumn) {
        return range(propertyName, lowColumn, highColumn, null);
    }

    /**
     * @param valueColumn bare column of the same property, or null
     */
    public static ColumnDescriptor range(String propertyName, String lowColumn, String highColumn, String valueColumn) {
        requireName(propertyName, "propertyName");
        requireName(lowColumn, "lowColumn");
        requireName(highColumn, "highColumn");
        if (lowColumn.equals(highColumn)) {
            throw new IllegalArgumentException("low and high columns must differ: " + lowColumn);
        }
        if (valueColumn != null && !valueColumn.equals(propertyName)) {
            throw new IllegalArgumentException("value column must be named like the property: " + valueColumn);
        }
        return new ColumnDescriptor(propertyName, ColumnKind.RANGE, List.of(lowColumn, highColumn), valueColumn);
    }

    public String propertyName() {
        return propertyName;
    }

    public ColumnKind kind() {
        return kind;
    }

    public boolean isRange() {
        return kind == ColumnKind.RANGE;
    }

    /**
     * @return the one column of a SINGLE property, or [low, high] of a RANGE property
     */
    public List<String> sourceColumns() {
        return sourceColumns;
    }

    public Optional<String> lowColumn() {
        return isRange() ? Optional.of(sourceColumns.get(0)) : Optional.empty();
    }

    public Optional<String> highColumn() {
        return isRange() ? Optional.of(sourceColumns.get(1)) : Optional.empty();
    }

    /**
     * @return the exact-value column; always present for SINGLE, optional for RANGE
     */
    public Optional<String> valueColumn() {
        return Optional.ofNullable(valueColumn);
    }

    /**
     * Every column this descriptor may read, bounds first.
     */
    public List<String> referencedColumns() {
        if (!isRange() || valueColumn == null) {
            return sourceColumns;
        }
        List<String> all = new ArrayList<>(sourceColumns);
        all.add(valueColumn);
        return List.copyOf(all);
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " must be non-empty");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDescriptor other)) return false;
        return propertyName.equals(other.propertyName)
                && kind == other.kind
                && sourceColumns.equals(other.sourceColumns)
                && Objects.equals(valueColumn, other.valueColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyName, kind, sourceColumns, valueColumn);
    }

    @Override
    public String toString() {
        return kind + "(" + propertyName + " <- " + referencedColumns() + ")";
    }
}
