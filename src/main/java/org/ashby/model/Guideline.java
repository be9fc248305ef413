package org.ashby.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Material-index reference line, e.g. E^(1/2)/rho = const.
 *
 * On log axes it is the power law y = yIntercept * x^power (a straight line on the chart);
 * on linear axes it is y = power * x + yIntercept.
 *
 * @param labelX x of the label anchor, in data coordinates
 * @param labelY y of the label anchor, in data coordinates
 */
public record Guideline(double power, double xMin, double xMax, double yIntercept,
                        String label, double labelX, double labelY) {

    static final int SAMPLES = 5;

    public Guideline {
        Objects.requireNonNull(label, "label must not be null");
        if (!(xMin < xMax)) {
            throw new IllegalArgumentException("guideline xMin must be < xMax: " + xMin + " >= " + xMax);
        }
    }

    /**
     * Evenly spaced samples over [xMin, xMax].
     */
    public List<PlotPoint> points(boolean logScale) {
        List<PlotPoint> out = new ArrayList<>(SAMPLES);
        double step = (xMax - xMin) / (SAMPLES - 1);
        for (int i = 0; i < SAMPLES; i++) {
            double x = (i == SAMPLES - 1) ? xMax : xMin + i * step;
            double y = logScale ? yIntercept * Math.pow(x, power) : power * x + yIntercept;
            out.add(new PlotPoint(x, y));
        }
        return out;
    }
}
