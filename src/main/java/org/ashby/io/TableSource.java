package org.ashby.io;

/**
 * A single tabular input:
 * - where its data comes from (file/stream/etc.)
 * - how its cells become a RawTable
 *
 * Implementations should:
 * - load the table once (and cache it)
 * - verify that the grouping column exists
 */
public interface TableSource {

    /**
     * Human readable origin of the data (usually a file path), used in logs and messages.
     */
    String origin();

    /**
     * Loads (or returns the cached) table.
     *
     * @throws TableLoadException if the content is structurally unusable (e.g. no grouping column)
     * @throws java.io.UncheckedIOException if the underlying input cannot be read
     */
    RawTable load();
}
