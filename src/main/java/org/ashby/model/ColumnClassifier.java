package org.ashby.model;

import org.ashby.io.RawTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups table headers into plottable properties and decides which of them can be chosen as axes.
 *
 * - "X low" + "X high" -> one RANGE property "X" (a bare "X" column becomes its fallback value column)
 * - every other header -> SINGLE property named like the header
 * - the grouping column is never a property
 * - a property is an axis option only if one of its columns holds at least one number
 *
 * Stateless apart from configuration: every call classifies the given table from scratch.
 */
public final class ColumnClassifier {

    public static final String DEFAULT_LOW_SUFFIX = " low";
    public static final String DEFAULT_HIGH_SUFFIX = " high";

    private final String groupingColumn;
    private final String lowSuffix;
    private final String highSuffix;
    private final ValueSanitizer sanitizer;

    public ColumnClassifier(String groupingColumn, ValueSanitizer sanitizer) {
        this(groupingColumn, DEFAULT_LOW_SUFFIX, DEFAULT_HIGH_SUFFIX, sanitizer);
    }

    public ColumnClassifier(String groupingColumn, String lowSuffix, String highSuffix, ValueSanitizer sanitizer) {
        this.groupingColumn = Objects.requireNonNull(groupingColumn, "groupingColumn must not be null");
        this.lowSuffix = Objects.requireNonNull(lowSuffix, "lowSuffix must not be null");
        this.highSuffix = Objects.requireNonNull(highSuffix, "highSuffix must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        // fail fast on bad suffix configuration
        HeaderToken.parse("X", lowSuffix, highSuffix);
    }

    public Classification classify(RawTable table) {
        Objects.requireNonNull(table, "table must not be null");
        Map<String, ColumnDescriptor> descriptors = describe(table.columns());

        List<String> axisOptions = new ArrayList<>();
        for (ColumnDescriptor d : descriptors.values()) {
            if (hasAnyNumber(table, d)) {
                axisOptions.add(d.propertyName());
            }
        }
        return new Classification(descriptors, axisOptions);
    }

    /**
     * Header grouping only, without looking at cell values.
     */
    public Map<String, ColumnDescriptor> describe(List<String> columnNames) {
        Objects.requireNonNull(columnNames, "columnNames must not be null");

        List<HeaderToken> tokens = new ArrayList<>(columnNames.size());
        Map<String, String> lows = new HashMap<>();
        Map<String, String> highs = new HashMap<>();
        for (String name : columnNames) {
            if (name.equals(groupingColumn)) continue;
            HeaderToken token = HeaderToken.parse(name, lowSuffix, highSuffix);
            tokens.add(token);
            if (token.bound() == HeaderToken.Bound.LOW) lows.putIfAbsent(token.base(), name);
            if (token.bound() == HeaderToken.Bound.HIGH) highs.putIfAbsent(token.base(), name);
        }

        Map<String, ColumnDescriptor> out = new LinkedHashMap<>();
        for (HeaderToken token : tokens) {
            String header = token.header();

            // a bare column whose low/high pair exists belongs to that range
            if (isPaired(header, lows, highs)) {
                putRange(out, header, lows, highs, tokens);
                continue;
            }
            if (token.isBound() && isPaired(token.base(), lows, highs)) {
                putRange(out, token.base(), lows, highs, tokens);
                continue;
            }
            // unpaired bound columns and near-matches stay individual properties
            out.putIfAbsent(header, ColumnDescriptor.single(header));
        }
        return out;
    }

    private static boolean isPaired(String base, Map<String, String> lows, Map<String, String> highs) {
        return lows.containsKey(base) && highs.containsKey(base);
    }

    private static void putRange(Map<String, ColumnDescriptor> out, String base,
                                 Map<String, String> lows, Map<String, String> highs,
                                 List<HeaderToken> tokens) {
        if (out.containsKey(base)) return;
        String value = null;
        for (HeaderToken t : tokens) {
            if (t.header().equals(base)) {
                value = base;
                break;
            }
        }
        out.put(base, ColumnDescriptor.range(base, lows.get(base), highs.get(base), value));
    }

    private boolean hasAnyNumber(RawTable table, ColumnDescriptor d) {
        for (String column : d.referencedColumns()) {
            for (Object cell : table.column(column)) {
                if (sanitizer.sanitize(cell).isNumber()) {
                    return true;
                }
            }
        }
        return false;
    }
}
