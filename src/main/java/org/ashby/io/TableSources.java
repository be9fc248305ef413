package org.ashby.io;

import org.ashby.io.csv.CsvTableSource;
import org.ashby.io.excel.ExcelTableSource;
import org.ashby.io.json.JsonTableSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks a TableSource implementation from a file extension.
 */
public final class TableSources {

    private TableSources() {
    }

    public static TableSource forPath(Path path, String groupingColumn) {
        Objects.requireNonNull(path, "path must not be null");
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);

        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return new ExcelTableSource(path, groupingColumn);
        }
        if (name.endsWith(".csv")) {
            return new CsvTableSource(path, groupingColumn);
        }
        if (name.endsWith(".json")) {
            return new JsonTableSource(path.toString(), () -> Files.newInputStream(path), groupingColumn);
        }
        throw new IllegalArgumentException("Unsupported table file type: " + path.getFileName());
    }
}
