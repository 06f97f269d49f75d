package fisk.domain.fiscal.codec;

import fisk.domain.fiscal.EErrorKind;

/**
 * Thrown by a codec when a device answer cannot be decoded
 * @since 15/10/2026
 */
public class ProtocolException extends Exception {
    private final EErrorKind kind;

    public ProtocolException(String message) {
        this(EErrorKind.PROTOCOL_SYNTAX_ERROR, message);
    }

    public ProtocolException(EErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EErrorKind getKind() {
        return kind;
    }
}
