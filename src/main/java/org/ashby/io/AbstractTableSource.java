package org.ashby.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Shared load-once behaviour for table sources.
 * Subclasses only parse; caching and grouping-column validation live here.
 */
public abstract class AbstractTableSource implements TableSource {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTableSource.class);

    private final String origin;
    private final String groupingColumn;

    // Cached after first load
    private volatile RawTable cached;

    private final Object lock = new Object();

    protected AbstractTableSource(String origin, String groupingColumn) {
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        if (groupingColumn == null || groupingColumn.isBlank()) {
            throw new IllegalArgumentException("groupingColumn must be non-empty");
        }
        this.groupingColumn = groupingColumn;
    }

    @Override
    public String origin() {
        return origin;
    }

    public String groupingColumn() {
        return groupingColumn;
    }

    @Override
    public RawTable load() {
        RawTable local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            RawTable table;
            try {
                table = read();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read table from '" + origin + "'", e);
            }

            if (!table.hasColumn(groupingColumn)) {
                throw new TableLoadException(
                        "The table from '" + origin + "' must contain a '" + groupingColumn + "' column for coloring and legend"
                );
            }

            LOG.info("Loaded {} rows x {} columns from {}", table.rowCount(), table.columns().size(), origin);
            this.cached = table;
            return table;
        }
    }

    /**
     * Parses the underlying input into a table. Called at most once per successful load.
     */
    protected abstract RawTable read() throws IOException;
}
