package fisk.domain.fiscal.channel;

/**
 * Transport failure while talking to a device
 * @since 15/10/2026
 */
public class ChannelException extends Exception {
    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
