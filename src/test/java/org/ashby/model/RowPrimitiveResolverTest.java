package org.ashby.model;

import org.ashby.io.RawTable;
import org.ashby.io.TableRow;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers:
 * - AxisResolution (points and intervals)
 * - RowPrimitiveResolver in every DataMode
 * - DataMode.suggest
 */
public class RowPrimitiveResolverTest {

    private static final double EPS = 1e-12;

    private static final List<String> COLUMNS = List.of("E low", "E high", "E", "Density");
    private static final ColumnDescriptor E = ColumnDescriptor.range("E", "E low", "E high", "E");
    private static final ColumnDescriptor E_NO_VALUE = ColumnDescriptor.range("E", "E low", "E high");
    private static final ColumnDescriptor DENSITY = ColumnDescriptor.single("Density");

    private final ValueSanitizer sanitizer = new ValueSanitizer();
    private final RowPrimitiveResolver mix = new RowPrimitiveResolver(sanitizer);

    /** One row: E low, E high, E, Density. */
    private static TableRow row(Object eLow, Object eHigh, Object e, Object density) {
        RawTable t = new RawTable(COLUMNS, List.of(Arrays.asList(eLow, eHigh, e, density)));
        return t.row(0);
    }

    @Nested
    class AxisResolutionTests {

        @Test
        void interval_reordersBounds() {
            AxisResolution r = AxisResolution.interval(5, 1);
            assertTrue(r.isInterval());
            assertEquals(3.0, r.center(), EPS);
            assertEquals(2.0, r.radius(), EPS);
        }

        @Test
        void point_hasZeroRadius() {
            AxisResolution r = AxisResolution.point(4);
            assertFalse(r.isInterval());
            assertEquals(4.0, r.center());
            assertEquals(0.0, r.radius());
        }
    }

    @Nested
    class MixModeTests {

        @Test
        void twoValues_giveAPoint() {
            Optional<PlotPrimitive> p = mix.resolve(row(null, null, 200.0, 7800.0), E, DENSITY);
            assertEquals(Optional.of(new PlotPoint(200.0, 7800.0)), p);
        }

        @Test
        void rangeAndValue_giveAnEllipse_withZeroRadiusOnTheValueAxis() {
            PlotPrimitive p = mix.resolve(row(100.0, 300.0, null, 7800.0), E, DENSITY).orElseThrow();
            assertEquals(new PlotEllipse(200.0, 7800.0, 100.0, 0.0), p);
        }

        @Test
        void twoRanges_giveACenteredEllipse() {
            PlotPrimitive p = mix.resolve(row(100.0, 300.0, null, null), E, E).orElseThrow();
            PlotEllipse e = assertInstanceOf(PlotEllipse.class, p);
            assertEquals(200.0, e.xCenter(), EPS);
            assertEquals(200.0, e.yCenter(), EPS);
            assertEquals(100.0, e.xRadius(), EPS);
            assertEquals(100.0, e.yRadius(), EPS);
        }

        @Test
        void textBounds_withMarkers_areSanitized() {
            PlotPrimitive p = mix.resolve(row("~1", " 3 ", null, 10), E, DENSITY).orElseThrow();
            assertEquals(new PlotEllipse(2.0, 10.0, 1.0, 0.0), p);
        }

        @Test
        void reversedBounds_areReordered() {
            PlotPrimitive p = mix.resolve(row(300.0, 100.0, null, 1.0), E, DENSITY).orElseThrow();
            assertEquals(new PlotEllipse(200.0, 1.0, 100.0, 0.0), p);
        }

        @Test
        void zeroWidthInterval_staysAnEllipse() {
            PlotPrimitive p = mix.resolve(row(5.0, 5.0, null, 1.0), E, DENSITY).orElseThrow();
            assertEquals(new PlotEllipse(5.0, 1.0, 0.0, 0.0), p);
            assertTrue(((PlotEllipse) p).isPoint());
        }

        @Test
        void ellipseShape_followsZeroRadii() {
            PlotEllipse dot = new PlotEllipse(5.0, 1.0, 0.0, 0.0);
            assertTrue(dot.isPoint());
            assertFalse(dot.isSegment());

            PlotEllipse horizontal = new PlotEllipse(200.0, 1.0, 100.0, 0.0);
            assertFalse(horizontal.isPoint());
            assertTrue(horizontal.isSegment());
            assertTrue(new PlotEllipse(1.0, 200.0, 0.0, 100.0).isSegment());

            PlotEllipse full = new PlotEllipse(200.0, 2.0, 100.0, 1.0);
            assertFalse(full.isPoint());
            assertFalse(full.isSegment());

            assertThrows(IllegalArgumentException.class, () -> new PlotEllipse(0, 0, -1, 0));
        }

        @Test
        void oneBoundOnly_actsAsAValue() {
            assertEquals(Optional.of(new PlotPoint(100.0, 1.0)), mix.resolve(row(100.0, null, null, 1.0), E, DENSITY));
            assertEquals(Optional.of(new PlotPoint(300.0, 1.0)), mix.resolve(row(null, 300.0, null, 1.0), E, DENSITY));
        }

        @Test
        void bounds_winOverTheValueColumn() {
            PlotPrimitive p = mix.resolve(row(100.0, 300.0, 999.0, 1.0), E, DENSITY).orElseThrow();
            assertEquals(200.0, p.centerX(), EPS);
        }

        @Test
        void blankBounds_fallBackToTheValueColumn() {
            assertEquals(Optional.of(new PlotPoint(210.0, 1.0)), mix.resolve(row("n/a", null, "210", 1.0), E, DENSITY));
        }

        @Test
        void nothingUsableOnOneAxis_skipsTheRow() {
            assertTrue(mix.resolve(row(null, null, null, 1.0), E, DENSITY).isEmpty());
            assertTrue(mix.resolve(row(100.0, 300.0, null, "junk"), E, DENSITY).isEmpty());
            assertTrue(mix.resolve(row(null, null, 200.0, 1.0), E_NO_VALUE, DENSITY).isEmpty());
        }
    }

    @Nested
    class RestrictedModeTests {

        @Test
        void rangesOnly_ignoresValueColumns_andSingles() {
            RowPrimitiveResolver ranges = new RowPrimitiveResolver(sanitizer, DataMode.RANGES);
            assertEquals(DataMode.RANGES, ranges.mode());

            assertTrue(ranges.resolve(row(null, null, 200.0, 1.0), E, E).isEmpty());
            assertTrue(ranges.resolve(row(100.0, 300.0, null, 1.0), E, DENSITY).isEmpty());
            assertTrue(ranges.resolve(row(100.0, 300.0, null, null), E, E).isPresent());
        }

        @Test
        void valuesOnly_ignoresBounds() {
            RowPrimitiveResolver values = new RowPrimitiveResolver(sanitizer, DataMode.VALUES);

            assertEquals(Optional.of(new PlotPoint(999.0, 1.0)), values.resolve(row(100.0, 300.0, 999.0, 1.0), E, DENSITY));
            assertTrue(values.resolve(row(100.0, 300.0, null, 1.0), E, DENSITY).isEmpty());
            assertTrue(values.resolve(row(100.0, 300.0, null, 1.0), E_NO_VALUE, DENSITY).isEmpty());
        }
    }

    @Nested
    class SuggestTests {

        @Test
        void suggest_dependsOnHowAxesAreStored() {
            assertEquals(DataMode.RANGES, DataMode.suggest(E, E_NO_VALUE));
            assertEquals(DataMode.VALUES, DataMode.suggest(DENSITY, DENSITY));
            assertEquals(DataMode.MIX, DataMode.suggest(E, DENSITY));
            assertEquals(DataMode.MIX, DataMode.suggest(DENSITY, E));
        }

        @Test
        void labels_areUserFacing() {
            assertEquals("Mix", DataMode.MIX.toString());
            assertEquals("Ranges only", DataMode.RANGES.label());
            assertEquals("Values only", DataMode.VALUES.label());
        }
    }
}
