package fisk.domain.fiscal;

/**
 * Failure categories surfaced through {@link DeviceStatus} errors.
 * Device errors carry the code of the status bit that raised them.
 * @since 14/10/2026
 */
public enum EErrorKind {
    PROTOCOL_SYNTAX_ERROR("E409"),
    UNSUPPORTED_VALUE("E411"),
    INVALID_ARGUMENT("E403"),
    DEVICE_ERROR("E199"),
    TRANSPORT_FAILURE("E101");

    private final String code;

    EErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
