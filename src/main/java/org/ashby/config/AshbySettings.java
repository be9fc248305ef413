package org.ashby.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.ashby.model.AxisRange;
import org.ashby.model.CategoryColorAssigner;
import org.ashby.model.ColumnClassifier;
import org.ashby.model.Guideline;
import org.ashby.model.RgbColor;
import org.ashby.model.ValueSanitizer;
import org.ashby.view.ChartStyle;
import org.ashby.view.FigureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Objects;

/**
 * Typed view over the "ashby" configuration block.
 *
 * Precedence, highest first:
 * 1. JVM system properties (-Dashby.plot.log-scale=false)
 * 2. ashby.conf in the working directory
 * 3. reference.conf on the classpath
 */
public final class AshbySettings {

    private static final Logger LOG = LoggerFactory.getLogger(AshbySettings.class);
    private static final String CONFIG_FILE_NAME = "ashby.conf";
    private static final String ROOT = "ashby";

    private final String groupingColumn;
    private final String lowSuffix;
    private final String highSuffix;
    private final List<String> approximationMarkers;
    private final double colorSaturation;
    private final double colorBrightness;
    private final RgbColor singleCategoryColor;
    private final boolean logScale;
    private final AxisRange xRange;
    private final AxisRange yRange;
    private final ChartStyle chartStyle;
    private final boolean guidelineEnabled;
    private final Guideline guideline;

    private AshbySettings(Config c) {
        this.groupingColumn = c.getString("table.grouping-column");
        this.lowSuffix = c.getString("table.low-suffix");
        this.highSuffix = c.getString("table.high-suffix");
        this.approximationMarkers = List.copyOf(c.getStringList("table.approximation-markers"));
        this.colorSaturation = c.getDouble("colors.saturation");
        this.colorBrightness = c.getDouble("colors.brightness");
        this.singleCategoryColor = RgbColor.fromHex(c.getString("colors.single-category"));
        this.logScale = c.getBoolean("plot.log-scale");
        this.xRange = new AxisRange(c.getDouble("plot.x-range.min"), c.getDouble("plot.x-range.max"));
        this.yRange = new AxisRange(c.getDouble("plot.y-range.min"), c.getDouble("plot.y-range.max"));
        this.chartStyle = new ChartStyle(
                FigureType.parse(c.getString("chart.figure-type")),
                c.getDouble("chart.axis-line-width"),
                c.getBoolean("chart.show-top-spine"),
                c.getBoolean("chart.show-right-spine")
        );
        this.guidelineEnabled = c.getBoolean("guideline.enabled");
        this.guideline = new Guideline(
                c.getDouble("guideline.power"),
                c.getDouble("guideline.x-min"),
                c.getDouble("guideline.x-max"),
                c.getDouble("guideline.y-intercept"),
                c.getString("guideline.label"),
                c.getDouble("guideline.label-x"),
                c.getDouble("guideline.label-y")
        );
        if (groupingColumn.isBlank()) {
            throw new IllegalArgumentException("ashby.table.grouping-column must be non-empty");
        }
        if (lowSuffix.isEmpty() || highSuffix.isEmpty() || lowSuffix.equals(highSuffix)) {
            throw new IllegalArgumentException("ashby.table.low-suffix and high-suffix must be non-empty and differ");
        }
    }

    /**
     * Loads settings with the full precedence chain.
     */
    public static AshbySettings load() {
        final Config cliConfig = ConfigFactory.systemProperties();

        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return from(cliConfig.withFallback(fileConfig).withFallback(defaultConfig).resolve());
    }

    /**
     * Reference defaults only.
     */
    public static AshbySettings defaults() {
        return from(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @param config a resolved config containing the "ashby" block; missing keys fall back to reference.conf
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static AshbySettings from(Config config) {
        Objects.requireNonNull(config, "config must not be null");
        Config merged = config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
        try {
            return new AshbySettings(merged.getConfig(ROOT));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid ashby configuration: " + e.getMessage(), e);
        }
    }

    public ValueSanitizer newSanitizer() {
        return new ValueSanitizer(approximationMarkers);
    }

    public ColumnClassifier newClassifier(ValueSanitizer sanitizer) {
        return new ColumnClassifier(groupingColumn, lowSuffix, highSuffix, sanitizer);
    }

    public CategoryColorAssigner newColorAssigner() {
        return new CategoryColorAssigner(colorSaturation, colorBrightness, singleCategoryColor);
    }

    public String groupingColumn() { return groupingColumn; }

    public String lowSuffix() { return lowSuffix; }

    public String highSuffix() { return highSuffix; }

    public List<String> approximationMarkers() { return approximationMarkers; }

    public double colorSaturation() { return colorSaturation; }

    public double colorBrightness() { return colorBrightness; }

    public RgbColor singleCategoryColor() { return singleCategoryColor; }

    public boolean logScale() { return logScale; }

    public AxisRange xRange() { return xRange; }

    public AxisRange yRange() { return yRange; }

    public ChartStyle chartStyle() { return chartStyle; }

    public boolean guidelineEnabled() { return guidelineEnabled; }

    public Guideline guideline() { return guideline; }
}
