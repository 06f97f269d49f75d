package fisk.dal;

import fisk.common.ServerConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 15/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private ServerConfig serverConfig;
    private SerialConfig serialConfig;
    private JobConfig jobConfig;
    private String optionsFile;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        load();
    }

    private void load() throws ConfigurationException {
        this.serverConfig = loadServerConfiguration();
        this.serialConfig = loadSerialConfiguration();
        this.jobConfig = loadJobConfiguration();
        this.optionsFile = loader.getString("service.options.file", ServerConstants.OPTIONS_FILE);
        if (optionsFile.trim().isEmpty()) {
            throw new ConfigurationException("Service options file cannot be empty");
        }
    }

    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        ServerConfig config = new ServerConfig(
                loader.getInt("server.port", ServerConstants.SERVER_PORT),
                loader.getString("server.host", ServerConstants.SERVER_IP));
        config.validate();
        return config;
    }

    private SerialConfig loadSerialConfiguration() throws ConfigurationException {
        SerialConfig config = new SerialConfig(
                loader.getInt("serial.baud", ServerConstants.DEFAULT_BAUD_RATE),
                loader.getInt("serial.read.timeout", ServerConstants.SERIAL_READ_TIMEOUT_MS),
                loader.getInt("serial.write.timeout", ServerConstants.SERIAL_WRITE_TIMEOUT_MS));
        config.validate();
        return config;
    }

    private JobConfig loadJobConfiguration() throws ConfigurationException {
        JobConfig config = new JobConfig(
                loader.getLong("jobs.task.timeout", ServerConstants.DEFAULT_TASK_TIMEOUT_MS),
                loader.getLong("jobs.retention", ServerConstants.JOB_RETENTION_MS),
                loader.getLong("jobs.cleanup.interval", ServerConstants.JOB_CLEANUP_INTERVAL_MS));
        config.validate();
        return config;
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    public SerialConfig getSerialConfiguration() {
        return serialConfig;
    }

    public JobConfig getJobConfiguration() {
        return jobConfig;
    }

    public String getOptionsFile() {
        return optionsFile;
    }

    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        load();
        logger.info("Server: {}", serverConfig);
        logger.info("Serial: {}", serialConfig);
        logger.info("Jobs: {}", jobConfig);
    }
}
