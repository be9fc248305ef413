package org.ashby.model;

import java.util.OptionalDouble;

/**
 * A cell value after sanitization: either a finite number or missing.
 * Instances are immutable; there is exactly one missing instance.
 */
public final class SanitizedValue {

    private static final SanitizedValue MISSING = new SanitizedValue(Double.NaN, false);

    private final double value;
    private final boolean present;

    private SanitizedValue(double value, boolean present) {
        this.value = value;
        this.present = present;
    }

    /**
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static SanitizedValue of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        // fold -0.0 into 0.0 so equality follows numeric equality
        return new SanitizedValue(value == 0.0 ? 0.0 : value, true);
    }

    public static SanitizedValue missing() {
        return MISSING;
    }

    public boolean isNumber() {
        return present;
    }

    public boolean isMissing() {
        return !present;
    }

    /**
     * @throws IllegalStateException if this value is missing
     */
    public double value() {
        if (!present) {
            throw new IllegalStateException("Missing value has no number");
        }
        return value;
    }

    public OptionalDouble asOptional() {
        return present ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SanitizedValue other)) return false;
        if (present != other.present) return false;
        return !present || Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return present ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return present ? "Number(" + value + ")" : "Missing";
    }
}
