package fisk.common;

/**
 * Web server and job pipeline parameters
 * @since 15/10/2026
 */
public final class ServerConstants {
    private ServerConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int SERVER_PORT = 8001;
    public static final String SERVER_IP = "0.0.0.0";
    public static final String OPTIONS_FILE = "config/printers.json";

    // Job pipeline
    public static final long DEFAULT_TASK_TIMEOUT_MS = 29_000;
    public static final long JOB_RETENTION_MS = 3_600_000;           // 1 hour
    public static final long JOB_CLEANUP_INTERVAL_MS = 600_000;      // 10 minutes

    // Serial transport
    public static final int DEFAULT_BAUD_RATE = 115200;
    public static final int SERIAL_READ_TIMEOUT_MS = 10_000;
    public static final int SERIAL_WRITE_TIMEOUT_MS = 1_000;
}
