package org.ashby.ui.fx;

import javafx.application.Application;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.ashby.app.api.AshbyUseCases;
import org.ashby.app.service.AshbyApplicationService;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JavaFX entry point.
 * Starts the UI and loads a table passed on the command line, if any.
 */
public final class FxApp extends Application {

    @Override
    public void start(Stage stage) {
        AshbyUseCases useCases = new AshbyApplicationService();

        // optional first argument: a table to open right away
        String initial = getParameters().getUnnamed().isEmpty() ? null : getParameters().getUnnamed().get(0);
        String status = "Ready. Use 'Load table...' to open an Excel, CSV or JSON file.";
        if (initial != null) {
            Path path = Path.of(initial);
            try {
                if (!Files.isRegularFile(path)) throw new IllegalArgumentException("not a file: " + path);
                useCases.load(path);
                status = "Loaded: " + path.getFileName();
            } catch (RuntimeException ex) {
                status = "Could not load " + initial + " (" + ex.getMessage() + ")";
            }
        }

        MainView root = new MainView(useCases);
        root.setStatus(status);

        Scene scene = new Scene(root, 1100, 750);
        stage.setTitle("Ashby Plot Generator");
        stage.setScene(scene);
        stage.setMaximized(true);
        stage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
