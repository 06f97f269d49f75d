package fisk.dal;

/**
 * Configured printer connection
 * @param uri provider URI, e.g. {@code bg.zk.zfp.com://COM3}
 * @since 15/10/2026
 */
public record PrinterConfig(String uri) {

    public void validate() throws ConfigurationException {
        if (uri == null || uri.trim().isEmpty()) {
            throw new ConfigurationException("Printer URI cannot be empty");
        }
    }
}
