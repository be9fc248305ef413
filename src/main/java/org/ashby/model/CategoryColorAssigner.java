package org.ashby.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps the distinct values of the grouping column to colors.
 *
 * Categories are compared as text, so 1, 1.0 and "1" are the same category.
 * Colors follow first appearance: category i of N gets hue 360*i/N at a fixed
 * saturation and brightness. A table with a single category gets one fixed color.
 */
public final class CategoryColorAssigner {

    public static final String UNCATEGORIZED = "Uncategorized";

    public static final double DEFAULT_SATURATION = 0.75;
    public static final double DEFAULT_BRIGHTNESS = 0.90;
    public static final RgbColor DEFAULT_SINGLE_COLOR = RgbColor.fromHex("#1f4e9c");

    private final double saturation;
    private final double brightness;
    private final RgbColor singleCategoryColor;

    public CategoryColorAssigner() {
        this(DEFAULT_SATURATION, DEFAULT_BRIGHTNESS, DEFAULT_SINGLE_COLOR);
    }

    public CategoryColorAssigner(double saturation, double brightness, RgbColor singleCategoryColor) {
        if (saturation < 0 || saturation > 1 || brightness < 0 || brightness > 1) {
            throw new IllegalArgumentException("saturation and brightness must be in [0, 1]");
        }
        this.saturation = saturation;
        this.brightness = brightness;
        this.singleCategoryColor = Objects.requireNonNull(singleCategoryColor, "singleCategoryColor must not be null");
    }

    public CategoryColors assignColors(List<?> categoryColumnValues) {
        Objects.requireNonNull(categoryColumnValues, "categoryColumnValues must not be null");

        // append-only list + membership set: order is appearance order, never hash order
        List<String> order = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object raw : categoryColumnValues) {
            String category = categoryOf(raw);
            if (seen.add(category)) {
                order.add(category);
            }
        }

        int n = order.size();
        Map<String, RgbColor> colors = new HashMap<>();
        for (int i = 0; i < n; i++) {
            RgbColor color = (n == 1)
                    ? singleCategoryColor
                    : RgbColor.fromHsb(360.0 * i / n, saturation, brightness);
            colors.put(order.get(i), color);
        }
        return new CategoryColors(order, colors);
    }

    /**
     * Text form of a grouping cell. Integral numbers print without a fraction;
     * blank cells fall into {@link #UNCATEGORIZED}.
     */
    public static String categoryOf(Object raw) {
        if (raw == null) {
            return UNCATEGORIZED;
        }
        String text;
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            text = (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15)
                    ? Long.toString((long) d)
                    : raw.toString();
        } else if (raw instanceof BigDecimal bd) {
            text = bd.stripTrailingZeros().toPlainString();
        } else {
            text = raw.toString();
        }
        text = text.strip();
        return text.isEmpty() ? UNCATEGORIZED : text;
    }
}
