package org.ashby.model;

public record PlotPoint(double x, double y) implements PlotPrimitive {
    @Override public double centerX() { return x; }
    @Override public double centerY() { return y; }
}
