package org.ashby.model;

/**
 * Geometric shape representing one table row on the chart.
 */
public interface PlotPrimitive {

    double centerX();

    double centerY();
}
