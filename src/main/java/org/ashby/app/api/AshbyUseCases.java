package org.ashby.app.api;

import org.ashby.app.api.dto.PlotRequest;
import org.ashby.app.api.dto.PlotView;
import org.ashby.config.AshbySettings;
import org.ashby.io.TableSource;
import org.ashby.model.CategoryColors;
import org.ashby.model.DataMode;
import org.ashby.model.RgbColor;

import java.nio.file.Path;
import java.util.List;

/**
 * Application boundary consumed by the JavaFX UI.
 * Keeps the UI independent from loaders and the resolution pipeline.
 */
public interface AshbyUseCases {

    /**
     * Loads a table file (xlsx, xls, csv or json) and replaces the current table.
     */
    void load(Path path);

    void load(TableSource source);

    boolean isLoaded();

    /** Description of the loaded table's origin, e.g. its path. */
    String currentOrigin();

    /**
     * Properties that can be chosen for X and Y, in header order.
     */
    List<String> axisOptions();

    CategoryColors categoryColors();

    void recolorCategory(String category, RgbColor color);

    DataMode suggestDataMode(String xProperty, String yProperty);

    PlotView generatePlot(PlotRequest request);

    AshbySettings settings();
}
