package org.ashby.model;

import org.ashby.io.RawTable;
import org.ashby.io.TableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces the ordered (category, color, primitive) list for one pair of axes.
 *
 * Bound to one loaded table's classification and colors; build a new one after a reload.
 * Output follows row order and never contains rows that could not be resolved.
 */
public final class PlotDatasetBuilder {

    private final Classification classification;
    private final CategoryColors colors;
    private final String groupingColumn;
    private final ValueSanitizer sanitizer;

    public PlotDatasetBuilder(Classification classification, CategoryColors colors,
                              String groupingColumn, ValueSanitizer sanitizer) {
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
        this.colors = Objects.requireNonNull(colors, "colors must not be null");
        this.groupingColumn = Objects.requireNonNull(groupingColumn, "groupingColumn must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
    }

    public List<PlotEntry> build(RawTable table, String xProperty, String yProperty) {
        return build(table, xProperty, yProperty, DataMode.MIX);
    }

    /**
     * @throws IllegalArgumentException if a property has no descriptor, or a row's category
     *                                  is not in the color mapping (colors from another table)
     */
    public List<PlotEntry> build(RawTable table, String xProperty, String yProperty, DataMode mode) {
        Objects.requireNonNull(table, "table must not be null");
        ColumnDescriptor x = classification.descriptor(xProperty);
        ColumnDescriptor y = classification.descriptor(yProperty);
        RowPrimitiveResolver resolver = new RowPrimitiveResolver(sanitizer, mode);

        List<PlotEntry> out = new ArrayList<>(table.rowCount());
        for (TableRow row : table.rows()) {
            String category = CategoryColorAssigner.categoryOf(row.get(groupingColumn));
            RgbColor color = colors.colorOf(category);

            Optional<PlotPrimitive> primitive = resolver.resolve(row, x, y);
            primitive.ifPresent(p -> out.add(new PlotEntry(category, color, p)));
        }
        return List.copyOf(out);
    }
}
