package org.ashby.view;

import java.util.Locale;

/**
 * Size presets for the chart: small text for print, large text for slides.
 * Sizes are in pixels; marker size is the point diameter.
 */
public enum FigureType {

    PUBLICATION("Publication", 12, 12, 10, 8, 5, 1.0),
    PRESENTATION("Presentation", 16, 18, 14, 14, 8, 2.0);

    private final String label;
    private final double fontSize;
    private final double axisLabelSize;
    private final double tickLabelSize;
    private final double legendFontSize;
    private final double markerSize;
    private final double lineWidth;

    FigureType(String label, double fontSize, double axisLabelSize, double tickLabelSize,
               double legendFontSize, double markerSize, double lineWidth) {
        this.label = label;
        this.fontSize = fontSize;
        this.axisLabelSize = axisLabelSize;
        this.tickLabelSize = tickLabelSize;
        this.legendFontSize = legendFontSize;
        this.markerSize = markerSize;
        this.lineWidth = lineWidth;
    }

    public String label() { return label; }

    /** Base text size, used for the guideline label. */
    public double fontSize() { return fontSize; }

    public double axisLabelSize() { return axisLabelSize; }

    public double tickLabelSize() { return tickLabelSize; }

    public double legendFontSize() { return legendFontSize; }

    public double markerSize() { return markerSize; }

    /** Width of data lines such as the guideline and degenerate ellipses. */
    public double lineWidth() { return lineWidth; }

    /**
     * Case-insensitive lookup by name ("publication") or label ("Presentation").
     *
     * @throws IllegalArgumentException for anything else
     */
    public static FigureType parse(String text) {
        if (text != null) {
            String t = text.strip();
            for (FigureType type : values()) {
                if (type.name().equalsIgnoreCase(t) || type.label.equalsIgnoreCase(t)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown figure type: " + text
                + " (expected " + PUBLICATION.label.toLowerCase(Locale.ROOT)
                + " or " + PRESENTATION.label.toLowerCase(Locale.ROOT) + ")");
    }

    @Override
    public String toString() {
        return label;
    }
}
