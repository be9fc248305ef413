package org.ashby.view;

import java.util.Objects;

/**
 * How the chart frame and text look, independent of the data.
 *
 * @param axisLineWidth width of the frame around the plot area
 * @param showTopSpine  draw the top edge of the frame
 * @param showRightSpine draw the right edge of the frame
 */
public record ChartStyle(FigureType figureType, double axisLineWidth,
                         boolean showTopSpine, boolean showRightSpine) {

    public ChartStyle {
        Objects.requireNonNull(figureType, "figureType must not be null");
        if (!Double.isFinite(axisLineWidth) || axisLineWidth <= 0) {
            throw new IllegalArgumentException("axis line width must be > 0: " + axisLineWidth);
        }
    }

    public static ChartStyle defaults() {
        return new ChartStyle(FigureType.PRESENTATION, 1.0, true, true);
    }
}
