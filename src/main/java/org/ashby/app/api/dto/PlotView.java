package org.ashby.app.api.dto;

import org.ashby.model.AxisRange;
import org.ashby.model.Guideline;
import org.ashby.model.PlotEntry;
import org.ashby.model.PlotPoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ready-to-render chart: shapes in row order, labels, limits and legend.
 *
 * @param guidelinePoints sampled reference line (empty when no guideline)
 * @param skippedRows     rows that had no usable value on one of the axes
 */
public record PlotView(List<PlotEntry> entries,
                       String xLabel, String yLabel,
                       AxisRange xRange, AxisRange yRange,
                       boolean logScale,
                       List<LegendEntry> legend,
                       Optional<Guideline> guideline,
                       List<PlotPoint> guidelinePoints,
                       int skippedRows) {

    public PlotView {
        Objects.requireNonNull(xLabel, "xLabel must not be null");
        Objects.requireNonNull(yLabel, "yLabel must not be null");
        Objects.requireNonNull(xRange, "xRange must not be null");
        Objects.requireNonNull(yRange, "yRange must not be null");
        Objects.requireNonNull(guideline, "guideline must not be null");
        entries = List.copyOf(entries);
        legend = List.copyOf(legend);
        guidelinePoints = List.copyOf(guidelinePoints);
    }
}
