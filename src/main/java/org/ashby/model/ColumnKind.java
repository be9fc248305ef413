package org.ashby.model;

/**
 * How a property is stored in the table.
 */
public enum ColumnKind {
    /** One column holding an exact value. */
    SINGLE,
    /** Two columns holding a low and a high bound. */
    RANGE
}
