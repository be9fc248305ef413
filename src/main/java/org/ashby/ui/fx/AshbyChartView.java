package org.ashby.ui.fx;

import javafx.geometry.VPos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.scene.text.Text;
import javafx.scene.text.TextAlignment;
import org.ashby.app.api.dto.LegendEntry;
import org.ashby.app.api.dto.PlotView;
import org.ashby.model.PlotEllipse;
import org.ashby.model.PlotEntry;
import org.ashby.model.PlotPoint;
import org.ashby.model.RgbColor;
import org.ashby.view.AxisScale;
import org.ashby.view.ChartStyle;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Canvas rendering of a {@link PlotView}:
 * - ellipses (translucent) for ranges, outlined dots for exact values
 * - log or linear axes with grid
 * - legend above the plot area
 * - dashed guideline with its label
 * Text sizes, marker size and the frame follow the current {@link ChartStyle}.
 *
 * Holds no data of its own beyond the last view it was given.
 */
public final class AshbyChartView extends Pane {

    private static final double MARGIN_LEFT = 80;
    private static final double MARGIN_RIGHT = 30;
    private static final double MARGIN_BOTTOM = 60;
    private static final double LEGEND_ROW_HEIGHT = 20;
    private static final int LEGEND_COLUMNS = 2;
    private static final double ELLIPSE_ALPHA = 0.3;
    private static final Color GRID_COLOR = Color.rgb(0, 0, 0, 0.15);

    private final Canvas canvas = new Canvas(800, 700);
    private PlotView view;
    private ChartStyle style = ChartStyle.defaults();

    public AshbyChartView() {
        getChildren().add(canvas);
        widthProperty().addListener((o, a, b) -> { canvas.setWidth(b.doubleValue()); refresh(); });
        heightProperty().addListener((o, a, b) -> { canvas.setHeight(b.doubleValue()); refresh(); });
    }

    public void show(PlotView view) {
        this.view = view;
        refresh();
    }

    public void setChartStyle(ChartStyle style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
        refresh();
    }

    public void clear() {
        this.view = null;
        refresh();
    }

    public void refresh() {
        GraphicsContext g = canvas.getGraphicsContext2D();
        g.clearRect(0, 0, canvas.getWidth(), canvas.getHeight());
        if (view == null) return;

        int legendRows = (view.legend().size() + LEGEND_COLUMNS - 1) / LEGEND_COLUMNS;
        double top = 20 + legendRows * legendRowHeight() + 10;
        double left = MARGIN_LEFT;
        double right = canvas.getWidth() - MARGIN_RIGHT;
        double bottom = canvas.getHeight() - MARGIN_BOTTOM;
        if (right - left < 50 || bottom - top < 50) return;

        AxisScale xs = AxisScale.of(view.xRange(), view.logScale(), left, right);
        AxisScale ys = AxisScale.of(view.yRange(), view.logScale(), bottom, top);

        drawGridAndTicks(g, xs, ys, left, right, top, bottom);

        g.save();
        g.beginPath();
        g.rect(left, top, right - left, bottom - top);
        g.clip();

        // ellipses first so exact values stay visible on top
        for (PlotEntry e : view.entries()) {
            if (e.primitive() instanceof PlotEllipse ellipse) {
                drawEllipse(g, ellipse, fx(e.color()), xs, ys);
            }
        }
        for (PlotEntry e : view.entries()) {
            if (e.primitive() instanceof PlotPoint point) {
                drawPoint(g, point, fx(e.color()), xs, ys);
            }
        }
        drawGuideline(g, xs, ys);
        g.restore();

        drawFrame(g, left, right, top, bottom);

        drawAxisLabels(g, left, right, top, bottom);
        drawLegend(g, view.legend(), left, right);
    }

    private void drawEllipse(GraphicsContext g, PlotEllipse e, Color color, AxisScale xs, AxisScale ys) {
        double x0 = xs.toPixel(xs.clampToVisible(e.xCenter() - e.xRadius()));
        double x1 = xs.toPixel(xs.clampToVisible(e.xCenter() + e.xRadius()));
        double y0 = ys.toPixel(ys.clampToVisible(e.yCenter() - e.yRadius()));
        double y1 = ys.toPixel(ys.clampToVisible(e.yCenter() + e.yRadius()));
        if (!allFinite(x0, x1, y0, y1)) return;

        double w = Math.abs(x1 - x0);
        double h = Math.abs(y1 - y0);

        // a zero-width range on both axes is drawn like an exact value
        if (e.isPoint()) {
            drawPoint(g, new PlotPoint(e.xCenter(), e.yCenter()), color, xs, ys);
            return;
        }
        if (e.isSegment()) {
            g.setStroke(color);
            g.setLineWidth(style.figureType().lineWidth());
            g.strokeLine(x0, y0, x1, y1);
            return;
        }

        g.setFill(color.deriveColor(0, 1, 1, ELLIPSE_ALPHA));
        g.fillOval(Math.min(x0, x1), Math.min(y0, y1), w, h);
    }

    private void drawPoint(GraphicsContext g, PlotPoint p, Color color, AxisScale xs, AxisScale ys) {
        double sx = xs.toPixel(p.x());
        double sy = ys.toPixel(p.y());
        if (!allFinite(sx, sy)) return;

        double r = style.figureType().markerSize() / 2.0;
        g.setFill(color);
        g.fillOval(sx - r, sy - r, r * 2, r * 2);
        g.setStroke(Color.BLACK);
        g.setLineWidth(1.0);
        g.strokeOval(sx - r, sy - r, r * 2, r * 2);
    }

    private void drawGuideline(GraphicsContext g, AxisScale xs, AxisScale ys) {
        List<PlotPoint> pts = view.guidelinePoints();
        if (pts.size() < 2) return;

        g.setStroke(Color.BLACK);
        g.setLineWidth(style.figureType().lineWidth());
        g.setLineDashes(8.0, 6.0);
        for (int i = 0; i < pts.size() - 1; i++) {
            PlotPoint a = pts.get(i);
            PlotPoint b = pts.get(i + 1);
            double ax = xs.toPixel(a.x()), ay = ys.toPixel(a.y());
            double bx = xs.toPixel(b.x()), by = ys.toPixel(b.y());
            if (allFinite(ax, ay, bx, by)) {
                g.strokeLine(ax, ay, bx, by);
            }
        }
        g.setLineDashes(null);

        view.guideline().ifPresent(gl -> {
            double lx = xs.toPixel(gl.labelX());
            double ly = ys.toPixel(gl.labelY());
            if (allFinite(lx, ly) && !gl.label().isBlank()) {
                g.setFill(Color.BLACK);
                g.setFont(Font.font("System", style.figureType().fontSize()));
                g.setTextAlign(TextAlignment.LEFT);
                g.setTextBaseline(VPos.TOP);
                g.fillText(gl.label(), lx, ly);
            }
        });
    }

    private void drawGridAndTicks(GraphicsContext g, AxisScale xs, AxisScale ys,
                                  double left, double right, double top, double bottom) {
        g.setFont(Font.font("System", style.figureType().tickLabelSize()));
        g.setLineWidth(1.0);

        g.setTextAlign(TextAlignment.CENTER);
        g.setTextBaseline(VPos.TOP);
        for (double v : xs.majorTicks()) {
            double px = xs.toPixel(v);
            g.setStroke(GRID_COLOR);
            g.setLineDashes(4.0, 3.0);
            g.strokeLine(px, top, px, bottom);
            g.setLineDashes(null);
            g.setFill(Color.BLACK);
            g.fillText(tickLabel(v, xs.isLog()), px, bottom + 6);
        }

        g.setTextAlign(TextAlignment.RIGHT);
        g.setTextBaseline(VPos.CENTER);
        for (double v : ys.majorTicks()) {
            double py = ys.toPixel(v);
            g.setStroke(GRID_COLOR);
            g.setLineDashes(4.0, 3.0);
            g.strokeLine(left, py, right, py);
            g.setLineDashes(null);
            g.setFill(Color.BLACK);
            g.fillText(tickLabel(v, ys.isLog()), left - 6, py);
        }
    }

    private void drawAxisLabels(GraphicsContext g, double left, double right, double top, double bottom) {
        g.setFill(Color.BLACK);
        g.setFont(Font.font("System", FontWeight.BOLD, style.figureType().axisLabelSize()));

        g.setTextAlign(TextAlignment.CENTER);
        g.setTextBaseline(VPos.BOTTOM);
        g.fillText(view.xLabel(), (left + right) / 2, canvas.getHeight() - 10);

        g.save();
        g.translate(20, (top + bottom) / 2);
        g.rotate(-90);
        g.setTextBaseline(VPos.CENTER);
        g.fillText(view.yLabel(), 0, 0);
        g.restore();
    }

    private void drawLegend(GraphicsContext g, List<LegendEntry> legend, double left, double right) {
        if (legend.isEmpty()) return;

        Font font = Font.font("System", style.figureType().legendFontSize());
        g.setFont(font);
        g.setTextAlign(TextAlignment.LEFT);
        g.setTextBaseline(VPos.CENTER);

        double columnWidth = (right - left) / LEGEND_COLUMNS;
        for (int i = 0; i < legend.size(); i++) {
            LegendEntry entry = legend.get(i);
            double x = left + (i % LEGEND_COLUMNS) * columnWidth;
            double y = 20 + (i / LEGEND_COLUMNS) * legendRowHeight();

            g.setFill(fx(entry.color()));
            g.fillRect(x, y - 6, 18, 12);
            g.setFill(Color.BLACK);
            g.fillText(ellipsize(entry.category(), font, columnWidth - 30), x + 24, y);
        }
    }

    // bottom and left edges always; top and right only when enabled
    private void drawFrame(GraphicsContext g, double left, double right, double top, double bottom) {
        g.setStroke(Color.BLACK);
        g.setLineWidth(style.axisLineWidth());
        g.strokeLine(left, bottom, right, bottom);
        g.strokeLine(left, top, left, bottom);
        if (style.showTopSpine()) g.strokeLine(left, top, right, top);
        if (style.showRightSpine()) g.strokeLine(right, top, right, bottom);
    }

    private double legendRowHeight() {
        return Math.max(LEGEND_ROW_HEIGHT, style.figureType().legendFontSize() + 8);
    }

    static String tickLabel(double v, boolean log) {
        if (log) {
            int exp = (int) Math.round(Math.log10(v));
            return "1e" + exp;
        }
        if (v == Math.rint(v) && Math.abs(v) < 1e6) {
            return Long.toString((long) v);
        }
        return String.format(Locale.ROOT, "%.3g", v);
    }

    private static String ellipsize(String text, Font font, double maxWidth) {
        Text measure = new Text(text);
        measure.setFont(font);
        if (measure.getLayoutBounds().getWidth() <= maxWidth) return text;

        String s = text;
        while (s.length() > 1) {
            s = s.substring(0, s.length() - 1);
            measure.setText(s + "...");
            if (measure.getLayoutBounds().getWidth() <= maxWidth) return s + "...";
        }
        return s;
    }

    static Color fx(RgbColor c) {
        return Color.rgb(c.red(), c.green(), c.blue());
    }

    private static boolean allFinite(double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
