package fisk.domain.orchestration;

import com.google.gson.Gson;
import fisk.common.GsonFactory;
import fisk.dal.ServerConfig;
import fisk.domain.FiscalServiceController;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @since 17/10/2026
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final FiscalServiceController controller;
    private final Gson gson;

    private Javalin javalinApp;

    public WebServerManager(ServerConfig serverConfig, FiscalServiceController controller) {
        this.serverConfig = serverConfig;
        this.controller = controller;
        this.gson = GsonFactory.createPretty();
    }

    public void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp().start(serverConfig.host(), serverConfig.port());
        logger.info("Web server started successfully");
    }

    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    /**
     * Create and configure the Javalin application without starting it
     */
    Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());

            config.bundledPlugins.enableCors(cors -> {
                cors.addRule(corsRule -> {
                    corsRule.anyHost();
                    corsRule.allowCredentials = false;
                });
            });

            config.router.apiBuilder(() -> {
                PrinterApiController printerApiController = new PrinterApiController(controller);
                printerApiController.registerRoutes();
            });
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception", exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app;
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}
