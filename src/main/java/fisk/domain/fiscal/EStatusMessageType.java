package fisk.domain.fiscal;

/**
 * Severity of a single device status message
 * @since 14/10/2026
 */
public enum EStatusMessageType {
    INFO,
    WARNING,
    ERROR,
    RESERVED
}
