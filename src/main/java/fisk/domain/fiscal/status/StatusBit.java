package fisk.domain.fiscal.status;

import fisk.domain.fiscal.EStatusMessageType;
import fisk.domain.fiscal.StatusMessage;

/**
 * One entry of a vendor status bit table
 * @since 15/10/2026
 */
public record StatusBit(String code, String text, EStatusMessageType type) {

    public static final StatusBit RESERVED = new StatusBit(null, "", EStatusMessageType.RESERVED);

    public static StatusBit error(String code, String text) {
        return new StatusBit(code, text, EStatusMessageType.ERROR);
    }

    public static StatusBit warning(String code, String text) {
        return new StatusBit(code, text, EStatusMessageType.WARNING);
    }

    public static StatusBit info(String text) {
        return new StatusBit(null, text, EStatusMessageType.INFO);
    }

    public StatusMessage toMessage() {
        return new StatusMessage(type, code, text);
    }
}
