package org.ashby.model;

/**
 * What one row offers on one axis: an exact value or a low/high interval.
 * "Unusable" is expressed by the absence of a resolution.
 */
public interface AxisResolution {

    double center();

    /** Half of the interval width; 0 for a point. */
    double radius();

    boolean isInterval();

    static AxisResolution point(double value) {
        return new Point(value);
    }

    /**
     * Bounds may be given in either order.
     */
    static AxisResolution interval(double a, double b) {
        return new Interval(Math.min(a, b), Math.max(a, b));
    }

    record Point(double value) implements AxisResolution {
        @Override public double center() { return value; }
        @Override public double radius() { return 0.0; }
        @Override public boolean isInterval() { return false; }
    }

    record Interval(double low, double high) implements AxisResolution {
        public Interval {
            if (low > high) {
                throw new IllegalArgumentException("low must be <= high: " + low + " > " + high);
            }
        }

        @Override public double center() { return (low + high) / 2.0; }
        @Override public double radius() { return (high - low) / 2.0; }
        @Override public boolean isInterval() { return true; }
    }
}
