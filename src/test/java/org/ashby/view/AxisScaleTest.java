package org.ashby.view;

import org.ashby.model.AxisRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AxisScaleTest {

    private static final double EPS = 1e-9;

    @Test
    void linear_mapsEndpointsAndMiddle() {
        AxisScale s = AxisScale.of(new AxisRange(0, 100), false, 50, 550);
        assertEquals(50, s.toPixel(0), EPS);
        assertEquals(550, s.toPixel(100), EPS);
        assertEquals(300, s.toPixel(50), EPS);
        assertFalse(s.isLog());
    }

    @Test
    void yAxis_canRunBottomToTop() {
        AxisScale s = AxisScale.of(new AxisRange(0, 10), false, 400, 0);
        assertEquals(400, s.toPixel(0), EPS);
        assertEquals(0, s.toPixel(10), EPS);
    }

    @Test
    void log_spacesDecadesEvenly() {
        AxisScale s = AxisScale.of(new AxisRange(1, 1000), true, 0, 300);
        assertEquals(0, s.toPixel(1), EPS);
        assertEquals(100, s.toPixel(10), EPS);
        assertEquals(200, s.toPixel(100), EPS);
        assertTrue(Double.isNaN(s.toPixel(0)));
        assertTrue(Double.isNaN(s.toPixel(-5)));
    }

    @Test
    void log_requiresPositiveRange() {
        assertThrows(IllegalArgumentException.class, () -> AxisScale.of(new AxisRange(0, 10), true, 0, 100));
    }

    @Test
    void clampToVisible_onlyAffectsNonPositiveOnLog() {
        AxisScale log = AxisScale.of(new AxisRange(10, 1000), true, 0, 100);
        assertEquals(10, log.clampToVisible(-3), EPS);
        assertEquals(50, log.clampToVisible(50), EPS);

        AxisScale lin = AxisScale.of(new AxisRange(-10, 10), false, 0, 100);
        assertEquals(-3, lin.clampToVisible(-3), EPS);
    }

    @Test
    void majorTicks_areDecadesOnLog() {
        AxisScale s = AxisScale.of(new AxisRange(10, 30000), true, 0, 100);
        assertEquals(List.of(10.0, 100.0, 1000.0, 10000.0), s.majorTicks());
    }

    @Test
    void majorTicks_areNiceStepsOnLinear() {
        AxisScale s = AxisScale.of(new AxisRange(0, 100), false, 0, 100);
        List<Double> ticks = s.majorTicks();
        assertEquals(0.0, ticks.get(0), EPS);
        assertEquals(100.0, ticks.get(ticks.size() - 1), EPS);
        assertEquals(20.0, ticks.get(1) - ticks.get(0), EPS);
        assertEquals(6, ticks.size());
    }

    @Test
    void niceStep_roundsUpToOneTwoFive() {
        assertEquals(1.0, AxisScale.niceStep(1.0), EPS);
        assertEquals(2.0, AxisScale.niceStep(1.5), EPS);
        assertEquals(5.0, AxisScale.niceStep(3.0), EPS);
        assertEquals(10.0, AxisScale.niceStep(7.0), EPS);
        assertEquals(0.05, AxisScale.niceStep(0.03), EPS);
    }
}
