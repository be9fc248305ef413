package org.ashby.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of classifying one table's headers.
 *
 * @param descriptors property name -> descriptor, in header order
 * @param axisOptions property names with at least one numeric cell, in header order
 */
public record Classification(Map<String, ColumnDescriptor> descriptors, List<String> axisOptions) {

    public Classification {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        Objects.requireNonNull(axisOptions, "axisOptions must not be null");
        for (String option : axisOptions) {
            if (!descriptors.containsKey(option)) {
                throw new IllegalArgumentException("Axis option without descriptor: " + option);
            }
        }
        // Map.copyOf would lose header order
        descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        axisOptions = List.copyOf(axisOptions);
    }

    /**
     * @throws IllegalArgumentException if the property has no descriptor
     */
    public ColumnDescriptor descriptor(String propertyName) {
        ColumnDescriptor d = descriptors.get(propertyName);
        if (d == null) {
            throw new IllegalArgumentException("Unknown property: " + propertyName);
        }
        return d;
    }

    public boolean isAxisOption(String propertyName) {
        return axisOptions.contains(propertyName);
    }
}
