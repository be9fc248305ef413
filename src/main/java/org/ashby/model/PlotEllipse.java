package org.ashby.model;

/**
 * Axis-aligned ellipse spanning a property range. A zero radius on one axis is a line segment,
 * on both axes a single point.
 */
public record PlotEllipse(double xCenter, double yCenter, double xRadius, double yRadius) implements PlotPrimitive {

    public PlotEllipse {
        if (xRadius < 0 || yRadius < 0) {
            throw new IllegalArgumentException("radii must be >= 0");
        }
    }

    @Override public double centerX() { return xCenter; }
    @Override public double centerY() { return yCenter; }

    /** Both radii are zero: only the center is covered. */
    public boolean isPoint() {
        return xRadius == 0 && yRadius == 0;
    }

    /** Exactly one radius is zero. */
    public boolean isSegment() {
        return (xRadius == 0) != (yRadius == 0);
    }
}
