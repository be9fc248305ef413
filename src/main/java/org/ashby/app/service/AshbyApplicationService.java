package org.ashby.app.service;

import org.ashby.app.api.AshbyUseCases;
import org.ashby.app.api.dto.LegendEntry;
import org.ashby.app.api.dto.PlotRequest;
import org.ashby.app.api.dto.PlotView;
import org.ashby.config.AshbySettings;
import org.ashby.io.RawTable;
import org.ashby.io.TableSource;
import org.ashby.io.TableSources;
import org.ashby.model.CategoryColorAssigner;
import org.ashby.model.CategoryColors;
import org.ashby.model.Classification;
import org.ashby.model.ColumnClassifier;
import org.ashby.model.DataMode;
import org.ashby.model.Guideline;
import org.ashby.model.PlotDatasetBuilder;
import org.ashby.model.PlotEntry;
import org.ashby.model.PlotPoint;
import org.ashby.model.PoissonDifference;
import org.ashby.model.RgbColor;
import org.ashby.model.ValueSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Default application service used by the JavaFX UI through AshbyUseCases. */
public final class AshbyApplicationService implements AshbyUseCases {

    private static final Logger LOG = LoggerFactory.getLogger(AshbyApplicationService.class);

    private final AshbySettings settings;
    private final ValueSanitizer sanitizer;
    private final ColumnClassifier classifier;
    private final CategoryColorAssigner colorAssigner;

    private volatile LoadedTable loaded;

    public AshbyApplicationService() {
        this(AshbySettings.load());
    }

    public AshbyApplicationService(AshbySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sanitizer = settings.newSanitizer();
        this.classifier = settings.newClassifier(sanitizer);
        this.colorAssigner = settings.newColorAssigner();
    }

    @Override
    public void load(Path path) {
        load(TableSources.forPath(path, settings.groupingColumn()));
    }

    @Override
    public void load(TableSource source) {
        Objects.requireNonNull(source, "source must not be null");

        RawTable table = PoissonDifference.appendTo(source.load(), sanitizer, settings.lowSuffix(), settings.highSuffix());

        // classification and colors are always rebuilt from the new table
        Classification classification = classifier.classify(table);
        CategoryColors colors = colorAssigner.assignColors(table.column(settings.groupingColumn()));

        LoadedTable next = new LoadedTable(source.origin(), table, classification, colors);
        // same monitor as recolorCategory, so a recolor can never write back the previous snapshot
        synchronized (this) {
            this.loaded = next;
        }
        LOG.info("Table {} ready: {} properties, {} axis options, {} categories",
                source.origin(), classification.descriptors().size(), classification.axisOptions().size(), colors.size());
    }

    @Override
    public boolean isLoaded() {
        return loaded != null;
    }

    @Override
    public String currentOrigin() {
        return ensureLoaded().origin();
    }

    @Override
    public List<String> axisOptions() {
        return ensureLoaded().classification().axisOptions();
    }

    @Override
    public CategoryColors categoryColors() {
        return ensureLoaded().colors();
    }

    @Override
    public synchronized void recolorCategory(String category, RgbColor color) {
        LoadedTable current = ensureLoaded();
        this.loaded = current.withColors(current.colors().withOverride(category, color));
    }

    @Override
    public DataMode suggestDataMode(String xProperty, String yProperty) {
        Classification c = ensureLoaded().classification();
        return DataMode.suggest(c.descriptor(xProperty), c.descriptor(yProperty));
    }

    @Override
    public PlotView generatePlot(PlotRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        LoadedTable current = ensureLoaded();

        PlotDatasetBuilder builder = new PlotDatasetBuilder(
                current.classification(), current.colors(), settings.groupingColumn(), sanitizer);
        List<PlotEntry> entries = builder.build(
                current.table(), request.xProperty(), request.yProperty(), request.dataMode());

        int skipped = current.table().rowCount() - entries.size();
        LOG.debug("Resolved {} of {} rows for {} vs {} ({}), skipped {}",
                entries.size(), current.table().rowCount(), request.yProperty(), request.xProperty(),
                request.dataMode(), skipped);

        List<LegendEntry> legend = current.colors().categories().stream()
                .map(c -> new LegendEntry(c, current.colors().colorOf(c)))
                .toList();

        Optional<Guideline> guideline = Optional.ofNullable(request.guideline());
        List<PlotPoint> guidelinePoints = guideline
                .map(g -> g.points(request.logScale()))
                .orElse(List.of());

        return new PlotView(
                entries,
                axisLabel(request.xProperty(), request.xUnit()),
                axisLabel(request.yProperty(), request.yUnit()),
                request.xRange(),
                request.yRange(),
                request.logScale(),
                legend,
                guideline,
                guidelinePoints,
                skipped
        );
    }

    @Override
    public AshbySettings settings() {
        return settings;
    }

    /**
     * "Density" + "kg/m^3" -> "Density, kg/m^3"; a blank unit leaves the quantity alone.
     */
    static String axisLabel(String property, String unit) {
        String label = PoissonDifference.PROPERTY.equals(property) ? PoissonDifference.AXIS_LABEL : property;
        if (unit != null && !unit.isBlank()) {
            label += ", " + unit.strip();
        }
        return label;
    }

    private LoadedTable ensureLoaded() {
        LoadedTable current = loaded;
        if (current == null) throw new IllegalStateException("No table loaded.");
        return current;
    }
}
