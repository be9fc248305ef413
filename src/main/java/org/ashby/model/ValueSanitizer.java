package org.ashby.model;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns raw spreadsheet cells into numbers or "missing".
 *
 * Rules:
 * - null, blank and boolean cells are missing
 * - numbers pass through (NaN / infinity are missing)
 * - text is stripped, one leading approximation marker (e.g. "~") is removed,
 *   and the rest must be a plain decimal number such as "12", "-0.5" or "1.2E-4"
 *
 * Never throws for cell content.
 */
public final class ValueSanitizer {

    public static final List<String> DEFAULT_APPROXIMATION_MARKERS = List.of("~");

    // Plain decimal notation only. Double.parseDouble would also accept "NaN", "Infinity", "0x1p3" or "2d".
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final List<String> approximationMarkers;

    public ValueSanitizer() {
        this(DEFAULT_APPROXIMATION_MARKERS);
    }

    public ValueSanitizer(List<String> approximationMarkers) {
        Objects.requireNonNull(approximationMarkers, "approximationMarkers must not be null");
        for (String marker : approximationMarkers) {
            if (marker == null || marker.isEmpty()) {
                throw new IllegalArgumentException("approximation markers must be non-empty");
            }
        }
        this.approximationMarkers = List.copyOf(approximationMarkers);
    }

    public SanitizedValue sanitize(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return SanitizedValue.missing();
        }
        if (raw instanceof SanitizedValue already) {
            return already;
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? SanitizedValue.of(d) : SanitizedValue.missing();
        }

        String text = stripMarker(raw.toString().strip());
        if (text.isEmpty() || !DECIMAL.matcher(text).matches()) {
            return SanitizedValue.missing();
        }

        double d = Double.parseDouble(text);
        // "1e999" matches the pattern but overflows
        return Double.isFinite(d) ? SanitizedValue.of(d) : SanitizedValue.missing();
    }

    private String stripMarker(String text) {
        for (String marker : approximationMarkers) {
            if (text.startsWith(marker)) {
                return text.substring(marker.length()).strip();
            }
        }
        return text;
    }
}
