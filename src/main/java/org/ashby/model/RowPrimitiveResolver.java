package org.ashby.model;

import org.ashby.io.TableRow;

import java.util.Objects;
import java.util.Optional;

/**
 * Converts one table row into a plot primitive for a chosen X and Y property.
 *
 * Per axis the row resolves to a point (one usable number), an interval (both bounds,
 * reordered so low <= high) or nothing. A row with nothing on either axis is skipped.
 * Two points give a {@link PlotPoint}; any interval gives a {@link PlotEllipse}
 * centered on the midpoints with half-width radii (0 on a point axis).
 *
 * Partial data is normal input: resolution never throws for cell content.
 */
public final class RowPrimitiveResolver {

    private final ValueSanitizer sanitizer;
    private final DataMode mode;

    public RowPrimitiveResolver(ValueSanitizer sanitizer) {
        this(sanitizer, DataMode.MIX);
    }

    public RowPrimitiveResolver(ValueSanitizer sanitizer, DataMode mode) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public DataMode mode() {
        return mode;
    }

    /**
     * @return the primitive, or empty if the row cannot be placed on these axes
     */
    public Optional<PlotPrimitive> resolve(TableRow row, ColumnDescriptor x, ColumnDescriptor y) {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");

        Optional<AxisResolution> xr = resolveAxis(row, x);
        if (xr.isEmpty()) return Optional.empty();
        Optional<AxisResolution> yr = resolveAxis(row, y);
        if (yr.isEmpty()) return Optional.empty();

        AxisResolution ax = xr.get();
        AxisResolution ay = yr.get();
        if (!ax.isInterval() && !ay.isInterval()) {
            return Optional.of(new PlotPoint(ax.center(), ay.center()));
        }
        return Optional.of(new PlotEllipse(ax.center(), ay.center(), ax.radius(), ay.radius()));
    }

    public Optional<AxisResolution> resolveAxis(TableRow row, ColumnDescriptor d) {
        if (!d.isRange()) {
            // a single column has no bounds to offer
            return mode == DataMode.RANGES ? Optional.empty() : valueOf(row, d);
        }
        return switch (mode) {
            case RANGES -> boundsOf(row, d);
            case VALUES -> valueOf(row, d);
            case MIX -> {
                Optional<AxisResolution> bounds = boundsOf(row, d);
                yield bounds.isPresent() ? bounds : valueOf(row, d);
            }
        };
    }

    private Optional<AxisResolution> boundsOf(TableRow row, ColumnDescriptor d) {
        SanitizedValue low = sanitizer.sanitize(row.get(d.lowColumn().orElseThrow()));
        SanitizedValue high = sanitizer.sanitize(row.get(d.highColumn().orElseThrow()));

        if (low.isNumber() && high.isNumber()) {
            return Optional.of(AxisResolution.interval(low.value(), high.value()));
        }
        if (low.isNumber()) return Optional.of(AxisResolution.point(low.value()));
        if (high.isNumber()) return Optional.of(AxisResolution.point(high.value()));
        return Optional.empty();
    }

    private Optional<AxisResolution> valueOf(TableRow row, ColumnDescriptor d) {
        Optional<String> column = d.valueColumn();
        if (column.isEmpty()) return Optional.empty();

        SanitizedValue v = sanitizer.sanitize(row.get(column.get()));
        return v.isNumber() ? Optional.of(AxisResolution.point(v.value())) : Optional.empty();
    }
}
