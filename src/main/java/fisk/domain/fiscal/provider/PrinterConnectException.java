package fisk.domain.fiscal.provider;

/**
 * A configured or detected printer could not be connected
 * @since 15/10/2026
 */
public class PrinterConnectException extends Exception {
    public PrinterConnectException(String message) {
        super(message);
    }

    public PrinterConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
