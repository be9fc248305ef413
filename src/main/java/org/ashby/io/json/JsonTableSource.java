package org.ashby.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ashby.io.AbstractTableSource;
import org.ashby.io.RawTable;
import org.ashby.io.TableLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON implementation of TableSource.
 *
 * Expected JSON shape: array of flat objects, one per material
 * [
 *   { "Category": "Metals", "Density low": 7800, "Density high": "~8000" },
 *   { "Category": "Foams", "Density": 40 }
 * ]
 *
 * Columns appear in first-seen key order; keys absent from an object are blank cells.
 */
public final class JsonTableSource extends AbstractTableSource {

    private final InputStreamSupplier streamSupplier;

    public JsonTableSource(String origin, InputStreamSupplier streamSupplier, String groupingColumn) {
        super(origin, groupingColumn);
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
    }

    @Override
    protected RawTable read() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        JsonFactory factory = mapper.getFactory();

        List<String> columns = new ArrayList<>();
        List<Map<String, Object>> records = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            if (p.nextToken() != JsonToken.START_ARRAY) {
                throw new TableLoadException("JSON table must be an array of objects: " + origin());
            }

            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken() != JsonToken.START_OBJECT) {
                    throw new TableLoadException("Expected an object inside the array: " + origin());
                }

                Map<String, Object> record = new LinkedHashMap<>();
                while (p.nextToken() != JsonToken.END_OBJECT) {
                    String field = p.currentName();
                    JsonToken value = p.nextToken();
                    record.put(field, readScalar(p, value, field));
                    if (!columns.contains(field)) {
                        columns.add(field);
                    }
                }
                records.add(record);
            }
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(record.get(column));
            }
            rows.add(row);
        }
        try {
            return new RawTable(columns, rows);
        } catch (IllegalArgumentException e) {
            throw new TableLoadException("Invalid keys in '" + origin() + "': " + e.getMessage(), e);
        }
    }

    private Object readScalar(JsonParser p, JsonToken token, String field) throws IOException {
        return switch (token) {
            case VALUE_NULL -> null;
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NUMBER_INT -> p.getNumberValue();
            case VALUE_NUMBER_FLOAT -> p.getDoubleValue();
            case VALUE_STRING -> p.getText();
            default -> throw new TableLoadException(
                    "Field '" + field + "' must hold a scalar value, got " + token + " in " + origin()
            );
        };
    }

    /**
     * Simple functional interface so callers can provide:
     * - a file stream
     * - a classpath resource stream
     * - an in-memory stream in tests
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
