package fisk.dal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import fisk.common.GsonFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@link ServiceOptions} as a JSON file
 * @since 15/10/2026
 */
public class ServiceOptionsStore {
    private static final Logger logger = LoggerFactory.getLogger(ServiceOptionsStore.class);

    private final Path file;
    private final Gson gson = GsonFactory.createPretty();

    public ServiceOptionsStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Load the options; a missing file yields defaults with a fresh server id.
     */
    public ServiceOptions load() throws ConfigurationException {
        ServiceOptions options;
        if (!Files.isRegularFile(file)) {
            logger.info("Service options file {} not found, using defaults", file.toAbsolutePath());
            options = new ServiceOptions();
        } else {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                options = gson.fromJson(reader, ServiceOptions.class);
            } catch (IOException | JsonParseException e) {
                throw new ConfigurationException("Cannot read service options from " + file, e);
            }
            if (options == null) {
                options = new ServiceOptions();
            }
        }
        for (var entry : options.getPrinters().entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("Printer '" + entry.getKey() + "' has no configuration");
            }
            entry.getValue().validate();
        }
        if (options.ensureServerId()) {
            save(options);
        }
        logger.info("Loaded {}", options);
        return options;
    }

    public void save(ServiceOptions options) throws ConfigurationException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(options, writer);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Saved service options to {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write service options to " + file, e);
        }
    }
}
