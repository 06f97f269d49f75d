package fisk;

import com.google.inject.Guice;
import com.google.inject.Injector;
import fisk.common.ELogger;
import fisk.dal.ConfigurationService;
import fisk.dal.ServiceOptions;
import fisk.dal.ServiceOptionsStore;
import fisk.domain.FiscalServiceController;
import fisk.domain.orchestration.ShutdownManager;
import fisk.domain.orchestration.WebServerManager;
import org.slf4j.Logger;

import java.nio.file.Paths;

/**
 * Main entry point for the Fiskal fiscal printer service
 * @since 17/10/2026
 */
public class Fiskal {
    private static final Logger logger = ELogger.APP.getLogger();

    public static void main(String[] args) {
        logger.info("Starting Fiskal fiscal printer service...");

        try {
            ConfigurationService configService = new ConfigurationService();
            logger.info("Configuration loaded successfully");
            logger.debug("Server: {}", configService.getServerConfiguration());
            logger.debug("Serial: {}", configService.getSerialConfiguration());
            logger.debug("Jobs: {}", configService.getJobConfiguration());

            ServiceOptionsStore optionsStore = new ServiceOptionsStore(Paths.get(configService.getOptionsFile()));
            ServiceOptions options = optionsStore.load();

            Injector injector = Guice.createInjector(new GuiceModule(configService, optionsStore, options));

            FiscalServiceController controller = injector.getInstance(FiscalServiceController.class);
            controller.start();

            WebServerManager webServerManager = new WebServerManager(configService.getServerConfiguration(), controller);
            webServerManager.start();

            new ShutdownManager(webServerManager, controller).registerShutdownHook();
            logger.info("Server id {}, {} printer(s) available", options.getServerId(), controller.getPrinters().size());

        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        }
    }
}
