package org.ashby.app.service;

import org.ashby.app.api.dto.LegendEntry;
import org.ashby.app.api.dto.PlotRequest;
import org.ashby.app.api.dto.PlotView;
import org.ashby.config.AshbySettings;
import org.ashby.io.TableSource;
import org.ashby.io.json.JsonTableSource;
import org.ashby.model.AxisRange;
import org.ashby.model.DataMode;
import org.ashby.model.Guideline;
import org.ashby.model.PlotEllipse;
import org.ashby.model.PlotPoint;
import org.ashby.model.PoissonDifference;
import org.ashby.model.RgbColor;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class AshbyApplicationServiceTest {

    private static final String MATERIALS = """
            [
              { "Category": "Metals", "Name": "Steel", "Density low": 7800, "Density high": 8000,
                "Young's modulus": 200, "Poisson low": 0.27, "Poisson high": 0.30 },
              { "Category": "Foams", "Name": "PU foam", "Density low": 30, "Density high": 80,
                "Young's modulus": "~0.01", "Poisson low": 0.3, "Poisson high": 0.4 },
              { "Category": "Metals", "Name": "Unknown alloy", "Density low": null, "Density high": null,
                "Young's modulus": 150 }
            ]
            """;

    private static final AxisRange LIN = new AxisRange(0, 10000);

    private final AshbyApplicationService service = new AshbyApplicationService(AshbySettings.defaults());

    private static TableSource json(String origin, String json) {
        return new JsonTableSource(origin, () -> new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "Category");
    }

    private static PlotRequest request(String x, String y, DataMode mode) {
        return new PlotRequest(x, y, "kg/m^3", "GPa", mode, LIN, LIN, false, null);
    }

    @Nested
    class BeforeLoadTests {

        @Test
        void queries_failUntilATableIsLoaded() {
            assertFalse(service.isLoaded());
            IllegalStateException ex = assertThrows(IllegalStateException.class, service::axisOptions);
            assertEquals("No table loaded.", ex.getMessage());
            assertThrows(IllegalStateException.class, service::categoryColors);
            assertThrows(IllegalStateException.class, () -> service.generatePlot(request("a", "b", DataMode.MIX)));
        }
    }

    @Nested
    class LoadTests {

        @Test
        void load_classifies_colors_andAddsPoissonDifference() {
            service.load(json("materials", MATERIALS));

            assertTrue(service.isLoaded());
            assertEquals("materials", service.currentOrigin());
            assertEquals(List.of("Density", "Young's modulus", "Poisson", PoissonDifference.PROPERTY),
                    service.axisOptions());
            assertEquals(List.of("Metals", "Foams"), service.categoryColors().categories());
        }

        @Test
        void load_fromPath_dispatchesByExtension(@TempDir Path tmp) throws IOException {
            Path file = tmp.resolve("materials.json");
            Files.writeString(file, MATERIALS);

            service.load(file);

            assertEquals(file.toString(), service.currentOrigin());
            PlotView view = service.generatePlot(request("Density", "Density", DataMode.MIX));
            assertEquals(2, view.entries().size());
            assertEquals(1, view.skippedRows());
        }

        @Test
        void reload_replacesEverything_includingColorOverrides() {
            service.load(json("first", MATERIALS));
            service.recolorCategory("Metals", RgbColor.fromHex("#000000"));

            service.load(json("second", """
                    [ { "Category": "Glass", "Density": 2500 } ]
                    """));

            assertEquals("second", service.currentOrigin());
            assertEquals(List.of("Density"), service.axisOptions());
            assertEquals(List.of("Glass"), service.categoryColors().categories());
        }

        @Test
        void reload_isNotUndoneByConcurrentRecolors() throws InterruptedException {
            String first = "[{\"Category\": \"Metals\", \"E\": 1}, {\"Category\": \"Foams\", \"E\": 2}]";
            String second = "[{\"Category\": \"Metals\", \"E\": 1}, {\"Category\": \"Glass\", \"E\": 3}]";
            RgbColor black = RgbColor.fromHex("#000000");

            for (int i = 0; i < 300; i++) {
                service.load(json("first", first));

                AtomicBoolean running = new AtomicBoolean(true);
                AtomicReference<Throwable> failure = new AtomicReference<>();
                Thread recolorer = new Thread(() -> {
                    try {
                        while (running.get()) {
                            service.recolorCategory("Metals", black);
                        }
                    } catch (Throwable t) {
                        failure.set(t);
                    }
                }, "recolorer");
                recolorer.start();

                service.load(json("second", second));
                running.set(false);
                recolorer.join();

                assertNull(failure.get());
                assertEquals("second", service.currentOrigin(), "reload undone in iteration " + i);
                assertTrue(service.categoryColors().contains("Glass"));
                assertFalse(service.categoryColors().contains("Foams"));
            }
        }

        @Test
        void failedLoad_keepsThePreviousTable() {
            service.load(json("first", MATERIALS));

            assertThrows(RuntimeException.class, () -> service.load(json("bad", "[{\"Name\": \"x\"}]")));

            assertEquals("first", service.currentOrigin());
        }
    }

    @Nested
    class PlotTests {

        @Test
        void generatePlot_buildsEntries_labels_andLegend() {
            service.load(json("materials", MATERIALS));

            PlotView view = service.generatePlot(request("Density", "Young's modulus", DataMode.MIX));

            assertEquals(2, view.entries().size());
            assertEquals(1, view.skippedRows());
            assertEquals("Density, kg/m^3", view.xLabel());
            assertEquals("Young's modulus, GPa", view.yLabel());
            assertEquals(new PlotEllipse(7900, 200, 100, 0), view.entries().get(0).primitive());
            assertEquals(List.of("Metals", "Foams"), view.legend().stream().map(LegendEntry::category).toList());
            assertTrue(view.guideline().isEmpty());
            assertTrue(view.guidelinePoints().isEmpty());
        }

        @Test
        void recolor_isVisibleInTheNextPlot() {
            service.load(json("materials", MATERIALS));
            RgbColor black = RgbColor.fromHex("#000000");

            service.recolorCategory("Foams", black);
            PlotView view = service.generatePlot(request("Density", "Young's modulus", DataMode.MIX));

            assertEquals(black, view.entries().get(1).color());
            assertEquals(black, view.legend().get(1).color());
            assertThrows(IllegalArgumentException.class, () -> service.recolorCategory("Glass", black));
        }

        @Test
        void poissonDifference_getsItsOwnAxisLabel() {
            service.load(json("materials", MATERIALS));
            PlotView view = service.generatePlot(new PlotRequest(
                    "Density", PoissonDifference.PROPERTY, "", null, DataMode.RANGES,
                    LIN, new AxisRange(0, 1), false, null));

            assertEquals("Density", view.xLabel());
            assertEquals(PoissonDifference.AXIS_LABEL, view.yLabel());
            assertEquals(2, view.entries().size());
        }

        @Test
        void guideline_isSampledForTheChosenScale() {
            service.load(json("materials", MATERIALS));
            Guideline g = new Guideline(2, 10, 1e5, 1e-4, "E^(1/2)/rho = k", 65, 3);

            PlotView view = service.generatePlot(new PlotRequest(
                    "Density", "Young's modulus", null, null, DataMode.MIX,
                    new AxisRange(10, 30000), new AxisRange(1e-4, 1e3), true, g));

            assertEquals(g, view.guideline().orElseThrow());
            assertEquals(5, view.guidelinePoints().size());
            PlotPoint first = view.guidelinePoints().get(0);
            assertEquals(1e-2, first.y(), 1e-12);
        }

        @Test
        void suggestDataMode_followsDescriptors() {
            service.load(json("materials", MATERIALS));
            assertEquals(DataMode.RANGES, service.suggestDataMode("Density", "Poisson"));
            assertEquals(DataMode.MIX, service.suggestDataMode("Density", "Young's modulus"));
            assertEquals(DataMode.VALUES, service.suggestDataMode("Young's modulus", "Young's modulus"));
        }

        @Test
        void logScale_requiresPositiveLimits() {
            assertThrows(IllegalArgumentException.class, () -> new PlotRequest(
                    "a", "b", "", "", DataMode.MIX, new AxisRange(0, 1), new AxisRange(1, 2), true, null));
        }
    }

    @Test
    void axisLabel_appendsStrippedUnit() {
        assertEquals("Density, kg/m^3", AshbyApplicationService.axisLabel("Density", " kg/m^3 "));
        assertEquals("Density", AshbyApplicationService.axisLabel("Density", "  "));
        assertEquals("Density", AshbyApplicationService.axisLabel("Density", null));
    }
}
