package org.ashby.model;

import java.util.Objects;

/**
 * A column header split into its property base name and an optional bound suffix.
 *
 * Matching is literal and case-sensitive: with suffixes " low" / " high",
 * "Density low" is (Density, LOW) while "Density Low" and "Densitylow" are plain headers.
 *
 * @param header the original header text
 * @param base   property name without the suffix (equals header when bound is NONE)
 * @param bound  which suffix matched
 */
public record HeaderToken(String header, String base, Bound bound) {

    public enum Bound { NONE, LOW, HIGH }

    public HeaderToken {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(bound, "bound must not be null");
    }

    public boolean isBound() {
        return bound != Bound.NONE;
    }

    /**
     * Splits a header. When both suffixes match (one is a suffix of the other) the longer wins.
     * A header that is nothing but a suffix has no base and stays a plain header.
     */
    public static HeaderToken parse(String header, String lowSuffix, String highSuffix) {
        Objects.requireNonNull(header, "header must not be null");
        requireSuffix(lowSuffix, "lowSuffix");
        requireSuffix(highSuffix, "highSuffix");
        if (lowSuffix.equals(highSuffix)) {
            throw new IllegalArgumentException("low and high suffixes must differ");
        }

        boolean low = header.endsWith(lowSuffix);
        boolean high = header.endsWith(highSuffix);
        if (low && high) {
            low = lowSuffix.length() > highSuffix.length();
            high = !low;
        }

        if (low) {
            return bounded(header, header.length() - lowSuffix.length(), Bound.LOW);
        }
        if (high) {
            return bounded(header, header.length() - highSuffix.length(), Bound.HIGH);
        }
        return new HeaderToken(header, header, Bound.NONE);
    }

    private static HeaderToken bounded(String header, int baseLength, Bound bound) {
        String base = header.substring(0, baseLength);
        if (base.isBlank()) {
            return new HeaderToken(header, header, Bound.NONE);
        }
        return new HeaderToken(header, base, bound);
    }

    private static void requireSuffix(String suffix, String name) {
        if (suffix == null || suffix.isEmpty()) {
            throw new IllegalArgumentException(name + " must be non-empty");
        }
    }
}
