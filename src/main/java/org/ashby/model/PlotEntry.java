package org.ashby.model;

import java.util.Objects;

/**
 * One renderable row: its category, the category's color and its shape.
 */
public record PlotEntry(String category, RgbColor color, PlotPrimitive primitive) {
    public PlotEntry {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(color, "color must not be null");
        Objects.requireNonNull(primitive, "primitive must not be null");
    }
}
