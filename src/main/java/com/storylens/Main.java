package com.storylens;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storylens.controllers.Controller;
import com.storylens.controllers.DocumentController;
import com.storylens.controllers.EntityController;
import com.storylens.highlight.HighlightEngine;
import com.storylens.models.HighlightConfig;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.NoSuchElementException;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            HighlightConfigStore configStore = new HighlightConfigStore(config.getDataPath(), objectMapper);
            HighlightConfig highlightConfig = configStore.loadOrDefault();
            logger.info("Highlight config: debounce " + highlightConfig.getDebounceMs() + "ms, window "
                + highlightConfig.getWindowWords() + " words");

            EntityCatalogStore catalogStore = new EntityCatalogStore(config.getDataPath());
            HighlightEngine engine = new HighlightEngine(catalogStore, highlightConfig);
            DocumentService documentService = new DocumentService(engine);
            logger.info("Highlight engine initialized for workspace " + config.getWorkspacePath());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new EntityController(catalogStore, objectMapper),
                new DocumentController(documentService, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                documentService.closeAll();
                engine.close();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start StoryLens: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  " + AppConfig.APP_NAME + " v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(NoSuchElementException.class, (e, ctx) -> {
            logger.warn("Not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
