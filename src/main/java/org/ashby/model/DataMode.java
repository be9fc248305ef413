package org.ashby.model;

/**
 * Which columns of a property the resolver consults.
 */
public enum DataMode {

    /** Bounds when a row has any, otherwise the exact value. */
    MIX("Mix"),
    /** Only the low/high columns. */
    RANGES("Ranges only"),
    /** Only the exact-value column. */
    VALUES("Values only");

    private final String label;

    DataMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * RANGES when both axes are stored as ranges, VALUES when neither is, MIX otherwise.
     * RANGES on a single-column axis would skip every row.
     */
    public static DataMode suggest(ColumnDescriptor x, ColumnDescriptor y) {
        if (x.isRange() && y.isRange()) return RANGES;
        if (!x.isRange() && !y.isRange()) return VALUES;
        return MIX;
    }

    @Override
    public String toString() {
        return label;
    }
}
