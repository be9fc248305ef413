package org.ashby.app.service;

import org.ashby.io.RawTable;
import org.ashby.model.CategoryColors;
import org.ashby.model.Classification;

import java.util.Objects;

/**
 * Everything derived from one load. Replaced as a whole on reload so stale
 * descriptors or colors can never meet a new table.
 */
record LoadedTable(String origin, RawTable table, Classification classification, CategoryColors colors) {

    LoadedTable {
        Objects.requireNonNull(origin, "origin must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(colors, "colors must not be null");
    }

    LoadedTable withColors(CategoryColors newColors) {
        return new LoadedTable(origin, table, classification, newColors);
    }
}
