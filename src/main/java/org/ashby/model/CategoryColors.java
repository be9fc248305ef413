package org.ashby.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable category -> color mapping that remembers first-seen category order (legend order).
 */
public final class CategoryColors {

    private final List<String> categories;
    private final Map<String, RgbColor> colors;

    CategoryColors(List<String> categories, Map<String, RgbColor> colors) {
        if (categories.size() != colors.size() || !colors.keySet().containsAll(categories)) {
            throw new IllegalArgumentException("Every category needs exactly one color");
        }
        this.categories = List.copyOf(categories);
        this.colors = Map.copyOf(colors);
    }

    /** @return categories in first-seen order */
    public List<String> categories() {
        return categories;
    }

    public int size() {
        return categories.size();
    }

    public boolean contains(String category) {
        return colors.containsKey(category);
    }

    /**
     * @throws IllegalArgumentException if the category was not part of the loaded table
     */
    public RgbColor colorOf(String category) {
        RgbColor c = colors.get(category);
        if (c == null) {
            throw new IllegalArgumentException("Unknown category: " + category);
        }
        return c;
    }

    /**
     * Returns a copy with one category recolored; order is unchanged.
     */
    public CategoryColors withOverride(String category, RgbColor color) {
        Objects.requireNonNull(color, "color must not be null");
        colorOf(category);
        Map<String, RgbColor> copy = new HashMap<>(colors);
        copy.put(category, color);
        return new CategoryColors(new ArrayList<>(categories), copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryColors other)) return false;
        return categories.equals(other.categories) && colors.equals(other.colors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(categories, colors);
    }

    @Override
    public String toString() {
        return "CategoryColors(" + categories.size() + " categories)";
    }
}
