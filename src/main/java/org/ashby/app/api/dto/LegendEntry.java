package org.ashby.app.api.dto;

import org.ashby.model.RgbColor;

/** UI-safe legend row. */
public record LegendEntry(String category, RgbColor color) {
}
