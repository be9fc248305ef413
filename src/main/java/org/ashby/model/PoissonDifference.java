package org.ashby.model;

import org.ashby.io.RawTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derived "Poisson difference" property: the hyperbolic Poisson ratio 1/(1+v).
 *
 * The mapping is decreasing, so the derived low comes from "Poisson high"
 * and the derived high from "Poisson low".
 */
public final class PoissonDifference {

    public static final String SOURCE_PROPERTY = "Poisson";
    public static final String PROPERTY = "Poisson difference";
    public static final String AXIS_LABEL = "Hyperbolic Poisson Ratio 1/(1+v)";

    private PoissonDifference() {
    }

    /**
     * Appends "Poisson difference low/high" when the table has a Poisson range and no
     * derived columns yet; otherwise returns the table unchanged.
     */
    public static RawTable appendTo(RawTable table, ValueSanitizer sanitizer, String lowSuffix, String highSuffix) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(sanitizer, "sanitizer must not be null");

        String sourceLow = SOURCE_PROPERTY + lowSuffix;
        String sourceHigh = SOURCE_PROPERTY + highSuffix;
        String derivedLow = PROPERTY + lowSuffix;
        String derivedHigh = PROPERTY + highSuffix;

        if (!table.hasColumn(sourceLow) || !table.hasColumn(sourceHigh)
                || table.hasColumn(derivedLow) || table.hasColumn(derivedHigh)) {
            return table;
        }

        return table
                .withColumn(derivedLow, derive(table.column(sourceHigh), sanitizer))
                .withColumn(derivedHigh, derive(table.column(sourceLow), sanitizer));
    }

    /**
     * @return 1/(1+v), or null when v is missing or -1
     */
    public static Double hyperbolic(SanitizedValue v) {
        if (v.isMissing() || v.value() == -1.0) return null;
        return 1.0 / (1.0 + v.value());
    }

    private static List<Object> derive(List<Object> source, ValueSanitizer sanitizer) {
        List<Object> out = new ArrayList<>(source.size());
        for (Object cell : source) {
            out.add(hyperbolic(sanitizer.sanitize(cell)));
        }
        return out;
    }
}
