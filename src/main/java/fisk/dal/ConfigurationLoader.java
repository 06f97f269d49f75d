package fisk.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots replaced by underscores, upper case)
 * 3. External config/application.properties (working directory or -Dconfig.dir)
 * 4. Classpath config/application.properties (embedded defaults)
 *
 * @since 15/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    static final String DEFAULT_CONFIG_FILE = "config/application.properties";

    private final String configFile;
    private final Properties properties = new Properties();

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.configFile = configFile;
        this.properties.putAll(loadProperties(configFile));
    }

    private Properties loadProperties(String file) {
        Properties props = new Properties();

        Path path = Paths.get(file);
        if (path.isAbsolute()) {
            if (loadFile(path, props)) {
                logger.info("Loaded configuration from absolute path: {}", path);
                return props;
            }
            logger.warn("Configuration file '{}' not found", path);
        } else {
            Path external = findExternalFile(file);
            if (external != null && loadFile(external, props)) {
                logger.info("Loaded external configuration from: {}", external.toAbsolutePath());
            }
        }

        // Classpath values only fill what the external file left out
        Properties defaults = loadFromClasspath(file);
        for (String key : defaults.stringPropertyNames()) {
            props.putIfAbsent(key, defaults.getProperty(key));
        }

        if (props.isEmpty()) {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private Path findExternalFile(String file) {
        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path candidate = Paths.get(configDir, Paths.get(file).getFileName().toString()).normalize();
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            logger.warn("Config directory specified but file not found: {}", candidate.toAbsolutePath());
            return null;
        }
        Path candidate = Paths.get(System.getProperty("user.dir"), file).normalize();
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private static boolean loadFile(Path path, Properties props) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
            return false;
        }
    }

    private Properties loadFromClasspath(String file) {
        Properties props = new Properties();
        String resource = file.startsWith("/") ? file.substring(1) : file;
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
                logger.debug("Loaded classpath configuration from '{}'", resource);
            }
        } catch (IOException e) {
            logger.debug("Error loading configuration from classpath '{}': {}", resource, e.getMessage());
        }
        return props;
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            return value;
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Get required string property (throws exception if missing)
     */
    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    /**
     * Reload properties from the same file
     */
    public void reload() {
        Properties reloaded = loadProperties(configFile);
        properties.clear();
        properties.putAll(reloaded);
        logger.info("Configuration reloaded");
    }
}
