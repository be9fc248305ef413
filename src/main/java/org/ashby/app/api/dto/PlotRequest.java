package org.ashby.app.api.dto;

import org.ashby.model.AxisRange;
import org.ashby.model.DataMode;
import org.ashby.model.Guideline;

import java.util.Objects;

/**
 * Everything the UI chose for one chart.
 *
 * @param xUnit     free text appended to the X label; may be blank
 * @param yUnit     free text appended to the Y label; may be blank
 * @param guideline reference line to draw, or null for none
 */
public record PlotRequest(String xProperty, String yProperty,
                          String xUnit, String yUnit,
                          DataMode dataMode,
                          AxisRange xRange, AxisRange yRange,
                          boolean logScale,
                          Guideline guideline) {

    public PlotRequest {
        Objects.requireNonNull(xProperty, "xProperty must not be null");
        Objects.requireNonNull(yProperty, "yProperty must not be null");
        Objects.requireNonNull(dataMode, "dataMode must not be null");
        Objects.requireNonNull(xRange, "xRange must not be null");
        Objects.requireNonNull(yRange, "yRange must not be null");
        xUnit = xUnit == null ? "" : xUnit;
        yUnit = yUnit == null ? "" : yUnit;
        if (logScale && (!xRange.isLogCompatible() || !yRange.isLogCompatible())) {
            throw new IllegalArgumentException("Log-scale axis limits must be positive");
        }
    }
}
