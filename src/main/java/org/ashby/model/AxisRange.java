package org.ashby.model;

/**
 * Visible data interval of one chart axis.
 */
public record AxisRange(double min, double max) {

    public AxisRange {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("axis limits must be finite");
        }
        if (min >= max) {
            throw new IllegalArgumentException("axis min must be < max: " + min + " >= " + max);
        }
    }

    public boolean isLogCompatible() {
        return min > 0;
    }
}
