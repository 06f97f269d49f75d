package fisk.dal;

/**
 * Type-safe configuration for the print job pipeline
 *
 * @param defaultTaskTimeoutMs wait used when a client passes a negative timeout
 * @param retentionMs          how long finished jobs stay queryable
 * @param cleanupIntervalMs    period of the finished job purge
 * @since 15/10/2026
 */
public record JobConfig(long defaultTaskTimeoutMs, long retentionMs, long cleanupIntervalMs) {

    @Override
    public String toString() {
        return String.format("JobConfiguration{defaultTimeout=%d, retention=%d, cleanupInterval=%d}",
                defaultTaskTimeoutMs, retentionMs, cleanupIntervalMs);
    }

    public void validate() throws ConfigurationException {
        if (defaultTaskTimeoutMs < 1) {
            throw new ConfigurationException("Default task timeout must be positive");
        }
        if (retentionMs < 1000) {
            throw new ConfigurationException("Job retention must be at least 1000ms");
        }
        if (cleanupIntervalMs < 1000) {
            throw new ConfigurationException("Job cleanup interval must be at least 1000ms");
        }
    }
}
