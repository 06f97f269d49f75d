package fisk;

import com.google.inject.AbstractModule;
import fisk.dal.ConfigurationService;
import fisk.dal.JobConfig;
import fisk.dal.SerialConfig;
import fisk.dal.ServerConfig;
import fisk.dal.ServiceOptions;
import fisk.dal.ServiceOptionsStore;
import fisk.domain.fiscal.provider.IPrinterProvider;
import fisk.domain.fiscal.provider.PrinterProvider;

/**
 * @since 17/10/2026
 */
public class GuiceModule extends AbstractModule {
    private final ConfigurationService configService;
    private final ServiceOptionsStore optionsStore;
    private final ServiceOptions options;

    public GuiceModule(ConfigurationService configService, ServiceOptionsStore optionsStore, ServiceOptions options) {
        this.configService = configService;
        this.optionsStore = optionsStore;
        this.options = options;
    }

    @Override
    protected void configure() {
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());
        bind(SerialConfig.class).toInstance(configService.getSerialConfiguration());
        bind(JobConfig.class).toInstance(configService.getJobConfiguration());

        bind(ServiceOptionsStore.class).toInstance(optionsStore);
        bind(ServiceOptions.class).toInstance(options);

        bind(IPrinterProvider.class).to(PrinterProvider.class);
    }
}
