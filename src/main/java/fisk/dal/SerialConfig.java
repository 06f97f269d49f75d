package fisk.dal;

/**
 * Type-safe configuration for serial channels
 * @since 15/10/2026
 */
public record SerialConfig(int defaultBaudRate, int readTimeoutMs, int writeTimeoutMs) {

    @Override
    public String toString() {
        return String.format("SerialConfiguration{baud=%d, readTimeout=%d, writeTimeout=%d}",
                defaultBaudRate, readTimeoutMs, writeTimeoutMs);
    }

    public void validate() throws ConfigurationException {
        if (defaultBaudRate < 1200) {
            throw new ConfigurationException("Baud rate must be at least 1200");
        }
        if (readTimeoutMs < 100) {
            throw new ConfigurationException("Serial read timeout must be at least 100ms");
        }
        if (writeTimeoutMs < 100) {
            throw new ConfigurationException("Serial write timeout must be at least 100ms");
        }
    }
}
