package fisk.domain.orchestration;

import fisk.domain.FiscalServiceController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages graceful shutdown of the application
 * @since 17/10/2026
 */
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final WebServerManager webServerManager;
    private final FiscalServiceController controller;

    private volatile boolean shutdownHookRegistered = false;

    public ShutdownManager(WebServerManager webServerManager, FiscalServiceController controller) {
        this.webServerManager = webServerManager;
        this.controller = controller;
    }

    public void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown"));
            shutdownHookRegistered = true;
        }
    }

    public void shutdown() {
        logger.info("Shutting down Fiskal...");
        try {
            webServerManager.stop();
            controller.stop();
            logger.info("Application shut down successfully");
        } catch (RuntimeException e) {
            logger.error("Error during shutdown", e);
        }
    }
}
