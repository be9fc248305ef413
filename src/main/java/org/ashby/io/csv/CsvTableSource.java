package org.ashby.io.csv;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.ashby.io.AbstractTableSource;
import org.ashby.io.RawTable;
import org.ashby.io.TableLoadException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSV implementation of TableSource. The first record is the header row.
 * Every cell stays text; empty cells become blanks (null).
 */
public final class CsvTableSource extends AbstractTableSource {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final Path path;

    public CsvTableSource(Path path, String groupingColumn) {
        super(Objects.requireNonNull(path, "path must not be null").toString(), groupingColumn);
        this.path = path;
    }

    @Override
    protected RawTable read() throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            List<String> columns = new ArrayList<>(parser.getHeaderNames());
            List<List<Object>> rows = new ArrayList<>();

            for (CSVRecord record : parser) {
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    row.add(value == null || value.isEmpty() ? null : value);
                }
                rows.add(row);
            }
            return new RawTable(columns, rows);
        } catch (IllegalArgumentException e) {
            // commons-csv reports duplicate or empty headers this way
            throw new TableLoadException("Invalid CSV header in '" + path + "': " + e.getMessage(), e);
        }
    }
}
