package org.ashby.ui.fx;

import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Node;
import javafx.scene.control.Button;
import javafx.scene.control.CheckBox;
import javafx.scene.control.ColorPicker;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Control;
import javafx.scene.control.Label;
import javafx.scene.control.ScrollPane;
import javafx.scene.control.TextField;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.stage.FileChooser;
import org.ashby.app.api.AshbyUseCases;
import org.ashby.app.api.dto.PlotRequest;
import org.ashby.app.api.dto.PlotView;
import org.ashby.config.AshbySettings;
import org.ashby.model.AxisRange;
import org.ashby.model.CategoryColors;
import org.ashby.model.DataMode;
import org.ashby.model.Guideline;
import org.ashby.model.RgbColor;
import org.ashby.view.ChartStyle;
import org.ashby.view.FigureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Main window: table loading and chart settings on the left, chart in the center,
 * status line at the bottom. UI logic only; all data work goes through {@link AshbyUseCases}.
 */
public final class MainView extends BorderPane {

    private static final Logger LOG = LoggerFactory.getLogger(MainView.class);

    private final AshbyUseCases useCases;
    private final AshbyChartView chart = new AshbyChartView();

    // Data
    private final Button loadBtn = new Button("Load table...");
    private final Label loadedLabel = new Label("Loaded: (none)");

    // Axes
    private final ComboBox<String> xProperty = new ComboBox<>();
    private final ComboBox<String> yProperty = new ComboBox<>();
    private final TextField xUnit = new TextField();
    private final TextField yUnit = new TextField();
    private final ComboBox<DataMode> dataMode = new ComboBox<>();

    // Limits
    private final TextField xMin = new TextField();
    private final TextField xMax = new TextField();
    private final TextField yMin = new TextField();
    private final TextField yMax = new TextField();
    private final CheckBox logScale = new CheckBox("Log-log axes");

    // Guideline
    private final CheckBox guidelineEnabled = new CheckBox("Show guideline");
    private final TextField glPower = new TextField();
    private final TextField glXMin = new TextField();
    private final TextField glXMax = new TextField();
    private final TextField glIntercept = new TextField();
    private final TextField glLabel = new TextField();
    private final TextField glLabelX = new TextField();
    private final TextField glLabelY = new TextField();

    // Figure
    private final ComboBox<FigureType> figureType = new ComboBox<>();
    private final TextField axisLineWidth = new TextField();
    private final CheckBox topSpine = new CheckBox("Top spine");
    private final CheckBox rightSpine = new CheckBox("Right spine");

    private final VBox colorsBox = new VBox(6);
    private final Button generateBtn = new Button("Generate plot");
    private final Label statusBar = new Label("Ready.");

    // last chart shown, so recoloring can redraw without the user pressing Generate again
    private PlotRequest lastRequest;

    public MainView(AshbyUseCases useCases) {
        this.useCases = Objects.requireNonNull(useCases);

        setPadding(new Insets(14));

        setLeft(buildLeftPanel());
        setCenter(buildCenter());
        setBottom(buildStatusBar());

        applyDefaults(useCases.settings());
        refreshTableUI();
    }

    // =======================
    // Public helpers (FxApp)
    // =======================

    public void setStatus(String msg) {
        statusBar.setText(msg);
    }

    // =======================
    // Layout
    // =======================

    private Node buildLeftPanel() {
        // --- Data card ---
        Label dataTitle = title("Data");
        loadedLabel.setStyle("""
                -fx-padding: 4 10;
                -fx-background-color: #eef4ff;
                -fx-text-fill: #1e66ff;
                -fx-font-weight: 700;
                -fx-background-radius: 999;
                """);
        loadBtn.setMaxWidth(Double.MAX_VALUE);
        loadBtn.setOnAction(e -> chooseAndLoadFile());
        VBox dataCard = card(dataTitle, loadBtn, loadedLabel);

        // --- Axes card ---
        dataMode.getItems().setAll(DataMode.values());
        dataMode.getSelectionModel().select(DataMode.MIX);
        xProperty.setOnAction(e -> suggestDataMode());
        yProperty.setOnAction(e -> suggestDataMode());
        xUnit.setPromptText("e.g. kg/m^3");
        yUnit.setPromptText("e.g. GPa");

        VBox axesCard = card(
                title("Axes"),
                labeledRow("X", xProperty),
                labeledRow("X unit", xUnit),
                labeledRow("Y", yProperty),
                labeledRow("Y unit", yUnit),
                labeledRow("Data", dataMode)
        );

        // --- Limits card ---
        VBox limitsCard = card(
                title("Axis limits"),
                labeledRow("X min", xMin),
                labeledRow("X max", xMax),
                labeledRow("Y min", yMin),
                labeledRow("Y max", yMax),
                logScale
        );

        // --- Guideline card ---
        VBox guidelineFields = new VBox(8,
                labeledRow("Power", glPower),
                labeledRow("X from", glXMin),
                labeledRow("X to", glXMax),
                labeledRow("Intercept", glIntercept),
                labeledRow("Label", glLabel),
                labeledRow("Label X", glLabelX),
                labeledRow("Label Y", glLabelY)
        );
        guidelineFields.disableProperty().bind(guidelineEnabled.selectedProperty().not());
        VBox guidelineCard = card(title("Guideline"), guidelineEnabled, guidelineFields);

        // --- Figure card ---
        figureType.getItems().setAll(FigureType.values());
        VBox figureCard = card(
                title("Figure"),
                labeledRow("Type", figureType),
                labeledRow("Axis width", axisLineWidth),
                new HBox(14, topSpine, rightSpine)
        );

        // --- Colors card ---
        VBox colorsCard = card(title("Colors"), colorsBox);

        generateBtn.setMaxWidth(Double.MAX_VALUE);
        generateBtn.setStyle("-fx-font-weight: 700;");
        generateBtn.setOnAction(e -> generatePlot());

        VBox left = new VBox(12, dataCard, axesCard, limitsCard, guidelineCard, figureCard, colorsCard, generateBtn);
        left.setPadding(new Insets(0, 14, 0, 0));
        left.setPrefWidth(320);

        ScrollPane scroll = new ScrollPane(left);
        scroll.setFitToWidth(true);
        scroll.setHbarPolicy(ScrollPane.ScrollBarPolicy.NEVER);
        scroll.setStyle("-fx-background-color: transparent;");
        return scroll;
    }

    private Node buildCenter() {
        BorderPane wrap = new BorderPane(chart);
        wrap.setStyle("""
                -fx-background-color: white;
                -fx-border-color: #e8e8e8;
                -fx-border-radius: 14;
                -fx-background-radius: 14;
                """);
        return wrap;
    }

    private Node buildStatusBar() {
        HBox bar = new HBox(statusBar);
        bar.setPadding(new Insets(10));
        bar.setStyle("-fx-background-color: #f7f7f7; -fx-border-color: #e3e3e3; -fx-border-width: 1 0 0 0;");
        return bar;
    }

    private Label title(String text) {
        Label l = new Label(text);
        l.setStyle("-fx-font-size: 14px; -fx-font-weight: 700;");
        return l;
    }

    private VBox card(Node... content) {
        VBox box = new VBox(10, content);
        box.setPadding(new Insets(12));
        box.setStyle("""
                -fx-background-color: white;
                -fx-border-color: #e8e8e8;
                -fx-border-radius: 14;
                -fx-background-radius: 14;
                """);
        return box;
    }

    private HBox labeledRow(String label, Control control) {
        Label l = new Label(label);
        l.setMinWidth(64);
        l.setStyle("-fx-font-weight: 700; -fx-text-fill: #333;");

        HBox row = new HBox(10, l, control);
        row.setAlignment(Pos.CENTER_LEFT);
        HBox.setHgrow(control, Priority.ALWAYS);
        control.setMaxWidth(Double.MAX_VALUE);
        return row;
    }

    // =======================
    // Defaults
    // =======================

    private void applyDefaults(AshbySettings s) {
        xMin.setText(format(s.xRange().min()));
        xMax.setText(format(s.xRange().max()));
        yMin.setText(format(s.yRange().min()));
        yMax.setText(format(s.yRange().max()));
        logScale.setSelected(s.logScale());

        Guideline g = s.guideline();
        guidelineEnabled.setSelected(s.guidelineEnabled());
        glPower.setText(format(g.power()));
        glXMin.setText(format(g.xMin()));
        glXMax.setText(format(g.xMax()));
        glIntercept.setText(format(g.yIntercept()));
        glLabel.setText(g.label());
        glLabelX.setText(format(g.labelX()));
        glLabelY.setText(format(g.labelY()));

        ChartStyle style = s.chartStyle();
        figureType.getSelectionModel().select(style.figureType());
        axisLineWidth.setText(format(style.axisLineWidth()));
        topSpine.setSelected(style.showTopSpine());
        rightSpine.setSelected(style.showRightSpine());
        chart.setChartStyle(style);
    }

    // =======================
    // Table
    // =======================

    private void refreshTableUI() {
        boolean loaded = useCases.isLoaded();
        xProperty.setDisable(!loaded);
        yProperty.setDisable(!loaded);
        generateBtn.setDisable(!loaded);

        if (!loaded) {
            loadedLabel.setText("Loaded: (none)");
            xProperty.getItems().clear();
            yProperty.getItems().clear();
            colorsBox.getChildren().setAll(new Label("Load a table to see its categories."));
            return;
        }

        loadedLabel.setText("Loaded: " + new File(useCases.currentOrigin()).getName());

        List<String> options = useCases.axisOptions();
        xProperty.getItems().setAll(options);
        yProperty.getItems().setAll(options);
        if (!options.isEmpty()) {
            xProperty.getSelectionModel().select(0);
            yProperty.getSelectionModel().select(options.size() > 1 ? 1 : 0);
        }
        suggestDataMode();
        refreshColorsUI();
    }

    private void refreshColorsUI() {
        CategoryColors colors = useCases.categoryColors();
        colorsBox.getChildren().clear();

        for (String category : colors.categories()) {
            ColorPicker picker = new ColorPicker(AshbyChartView.fx(colors.colorOf(category)));
            picker.setOnAction(e -> onRecolor(category, picker.getValue()));

            Label name = new Label(category);
            name.setMaxWidth(Double.MAX_VALUE);
            HBox.setHgrow(name, Priority.ALWAYS);

            HBox row = new HBox(10, name, picker);
            row.setAlignment(Pos.CENTER_LEFT);
            colorsBox.getChildren().add(row);
        }
    }

    private void onRecolor(String category, Color c) {
        try {
            useCases.recolorCategory(category, toRgb(c));
            if (lastRequest != null) {
                chart.show(useCases.generatePlot(lastRequest));
            }
            setStatus("Color for '" + category + "' set to " + toRgb(c).toHex());
        } catch (RuntimeException ex) {
            setStatus("Recolor failed: " + ex.getMessage());
        }
    }

    private void suggestDataMode() {
        String x = xProperty.getValue();
        String y = yProperty.getValue();
        if (x == null || y == null || !useCases.isLoaded()) return;
        dataMode.getSelectionModel().select(useCases.suggestDataMode(x, y));
    }

    /**
     * Opens a FileChooser dialog and loads the chosen table in the background.
     */
    private void chooseAndLoadFile() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Load Material Table");
        chooser.getExtensionFilters().addAll(
                new FileChooser.ExtensionFilter("Tables", "*.xlsx", "*.xls", "*.csv", "*.json"),
                new FileChooser.ExtensionFilter("Excel workbooks", "*.xlsx", "*.xls"),
                new FileChooser.ExtensionFilter("CSV files", "*.csv"),
                new FileChooser.ExtensionFilter("JSON files", "*.json")
        );

        File file = chooser.showOpenDialog(getScene().getWindow());
        if (file == null) {
            return;
        }

        loadBtn.setDisable(true);
        setStatus("Loading " + file.getName() + "...");

        Task<Void> task = new Task<>() {
            @Override
            protected Void call() {
                useCases.load(file.toPath());
                return null;
            }
        };

        task.setOnSucceeded(e -> {
            lastRequest = null;
            chart.clear();
            refreshTableUI();
            setStatus("Loaded: " + file.getName() + " (" + useCases.axisOptions().size() + " plottable properties)");
            loadBtn.setDisable(false);
        });

        task.setOnFailed(e -> {
            Throwable err = task.getException();
            LOG.warn("Failed to load {}", file, err);
            setStatus("Failed to load file: " + (err == null ? "unknown error" : err.getMessage()));
            loadBtn.setDisable(false);
        });

        Thread worker = new Thread(task, "table-loader");
        worker.setDaemon(true);
        worker.start();
    }

    // =======================
    // Plot
    // =======================

    private void generatePlot() {
        PlotRequest request;
        try {
            request = buildRequest();
            chart.setChartStyle(buildChartStyle());
        } catch (IllegalArgumentException ex) {
            setStatus("Invalid settings: " + ex.getMessage());
            return;
        }

        try {
            PlotView view = useCases.generatePlot(request);
            chart.show(view);
            lastRequest = request;

            String msg = "Plotted " + view.entries().size() + " rows";
            if (view.skippedRows() > 0) {
                msg += ", skipped " + view.skippedRows() + " without usable values";
            }
            setStatus(msg + ".");
        } catch (RuntimeException ex) {
            LOG.warn("Plot generation failed", ex);
            setStatus("Plot failed: " + ex.getMessage());
        }
    }

    private PlotRequest buildRequest() {
        String x = xProperty.getValue();
        String y = yProperty.getValue();
        if (x == null || y == null) {
            throw new IllegalArgumentException("choose an X and a Y property");
        }

        AxisRange xr = new AxisRange(parse("X min", xMin), parse("X max", xMax));
        AxisRange yr = new AxisRange(parse("Y min", yMin), parse("Y max", yMax));

        Guideline guideline = null;
        if (guidelineEnabled.isSelected()) {
            guideline = new Guideline(
                    parse("Power", glPower),
                    parse("X from", glXMin),
                    parse("X to", glXMax),
                    parse("Intercept", glIntercept),
                    glLabel.getText() == null ? "" : glLabel.getText(),
                    parse("Label X", glLabelX),
                    parse("Label Y", glLabelY)
            );
        }

        return new PlotRequest(x, y, xUnit.getText(), yUnit.getText(),
                dataMode.getValue() == null ? DataMode.MIX : dataMode.getValue(),
                xr, yr, logScale.isSelected(), guideline);
    }

    private ChartStyle buildChartStyle() {
        FigureType type = figureType.getValue() == null ? FigureType.PRESENTATION : figureType.getValue();
        return new ChartStyle(type, parse("Axis width", axisLineWidth), topSpine.isSelected(), rightSpine.isSelected());
    }

    private static double parse(String field, TextField tf) {
        String text = tf.getText() == null ? "" : tf.getText().strip();
        try {
            double v = Double.parseDouble(text);
            if (!Double.isFinite(v)) throw new NumberFormatException();
            return v;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(field + " is not a number: '" + text + "'");
        }
    }

    private static String format(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e7) return Long.toString((long) v);
        return String.format(Locale.ROOT, "%s", v);
    }

    private static RgbColor toRgb(Color c) {
        return new RgbColor(
                (int) Math.round(c.getRed() * 255),
                (int) Math.round(c.getGreen() * 255),
                (int) Math.round(c.getBlue() * 255));
    }
}
