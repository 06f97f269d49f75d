package fisk.dal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ConfigurationLoader
 * @since 17/10/2026
 */
class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("server.host");
        System.clearProperty("serial.baud");
        System.clearProperty("jobs.retention");
        System.clearProperty("service.autodetect");
    }

    @Test
    @DisplayName("Should load configuration from properties file")
    void shouldLoadFromPropertiesFile() throws IOException {
        // Given
        Path configFile = tempDir.resolve("test.properties");
        Properties props = new Properties();
        props.setProperty("server.host", "127.0.0.1");
        props.setProperty("service.options.file", "/var/lib/fiskal/printers.json");

        try (var writer = Files.newBufferedWriter(configFile)) {
            props.store(writer, "Test config");
        }

        ConfigurationLoader loader = new ConfigurationLoader(configFile.toString());

        // When
        String host = loader.getString("server.host", "default");
        String optionsFile = loader.getString("service.options.file", "default");

        // Then
        assertThat(host).isEqualTo("127.0.0.1");
        assertThat(optionsFile).isEqualTo("/var/lib/fiskal/printers.json");
    }

    @Test
    @DisplayName("Should fall back to classpath defaults")
    void shouldLoadClasspathDefaults() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        int port = loader.getInt("server.port", 1);

        // Then
        assertThat(port).isEqualTo(8001);
    }

    @Test
    @DisplayName("Should prioritize system properties over file")
    void shouldPrioritizeSystemProperties() {
        // Given
        System.setProperty("server.host", "10.0.0.5");
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        String host = loader.getString("server.host", "default");

        // Then
        assertThat(host).isEqualTo("10.0.0.5");
    }

    @Test
    @DisplayName("Should use default value when property not found")
    void shouldUseDefaultValue() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        String value = loader.getString("nonexistent.property", "defaultValue");

        // Then
        assertThat(value).isEqualTo("defaultValue");
    }

    @Test
    @DisplayName("Should parse numeric values and ignore invalid ones")
    void shouldParseNumericValues() {
        // Given
        System.setProperty("serial.baud", "9600");
        System.setProperty("jobs.retention", "invalid");
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        int baud = loader.getInt("serial.baud", 115200);
        long retention = loader.getLong("jobs.retention", 42L);

        // Then
        assertThat(baud).isEqualTo(9600);
        assertThat(retention).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should parse boolean values correctly")
    void shouldParseBooleanValues() {
        // Given
        System.setProperty("service.autodetect", "true");
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        boolean enabled = loader.getBoolean("service.autodetect", false);

        // Then
        assertThat(enabled).isTrue();
    }

    @Test
    @DisplayName("Should throw exception for required missing property")
    void shouldThrowExceptionForRequiredMissingProperty() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader();

        // When & Then
        assertThatThrownBy(() -> loader.getRequiredString("missing.property"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Required property 'missing.property' is not configured");
    }
}
