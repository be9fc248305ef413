package org.ashby.view;

import org.ashby.model.AxisRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps data values of one axis to screen pixels, linearly or by decade.
 * Pure math: no toolkit classes, so the chart geometry is testable without a display.
 */
public final class AxisScale {

    private final AxisRange range;
    private final boolean log;
    private final double pixelStart;
    private final double pixelEnd;

    private AxisScale(AxisRange range, boolean log, double pixelStart, double pixelEnd) {
        this.range = Objects.requireNonNull(range, "range must not be null");
        if (log && !range.isLogCompatible()) {
            throw new IllegalArgumentException("Log axis needs positive limits: " + range);
        }
        this.log = log;
        this.pixelStart = pixelStart;
        this.pixelEnd = pixelEnd;
    }

    /**
     * @param pixelStart pixel of range.min (for a Y axis this is the bottom, i.e. the larger pixel)
     * @param pixelEnd   pixel of range.max
     */
    public static AxisScale of(AxisRange range, boolean log, double pixelStart, double pixelEnd) {
        return new AxisScale(range, log, pixelStart, pixelEnd);
    }

    public boolean isLog() {
        return log;
    }

    public AxisRange range() {
        return range;
    }

    /**
     * @return pixel position, or NaN for values a log axis cannot show (<= 0)
     */
    public double toPixel(double value) {
        double t;
        if (log) {
            if (value <= 0) return Double.NaN;
            t = (Math.log10(value) - Math.log10(range.min())) / (Math.log10(range.max()) - Math.log10(range.min()));
        } else {
            t = (value - range.min()) / (range.max() - range.min());
        }
        return pixelStart + t * (pixelEnd - pixelStart);
    }

    /**
     * Clamps a value into what this axis can display (log axes cannot show <= 0).
     */
    public double clampToVisible(double value) {
        if (log && value <= 0) return range.min();
        return value;
    }

    /**
     * Major tick values inside the range: powers of ten on a log axis,
     * a 1/2/5 x 10^k step on a linear one.
     */
    public List<Double> majorTicks() {
        List<Double> ticks = new ArrayList<>();
        if (log) {
            int first = (int) Math.ceil(Math.log10(range.min()) - 1e-9);
            int last = (int) Math.floor(Math.log10(range.max()) + 1e-9);
            for (int e = first; e <= last; e++) {
                ticks.add(Math.pow(10, e));
            }
            return ticks;
        }

        double step = niceStep((range.max() - range.min()) / 8.0);
        double start = Math.ceil(range.min() / step) * step;
        for (double v = start; v <= range.max() + step * 1e-9; v += step) {
            // avoid -0.0 and accumulated drift in labels
            ticks.add(Math.abs(v) < step * 1e-9 ? 0.0 : v);
        }
        return ticks;
    }

    static double niceStep(double rough) {
        double magnitude = Math.pow(10, Math.floor(Math.log10(rough)));
        double residual = rough / magnitude;
        if (residual > 5) return 10 * magnitude;
        if (residual > 2) return 5 * magnitude;
        if (residual > 1) return 2 * magnitude;
        return magnitude;
    }
}
