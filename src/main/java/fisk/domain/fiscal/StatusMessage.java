package fisk.domain.fiscal;

/**
 * One line of device status, decoded from status bits or added by the driver
 * @since 14/10/2026
 */
public record StatusMessage(EStatusMessageType type, String code, String text) {

    public static StatusMessage info(String text) {
        return new StatusMessage(EStatusMessageType.INFO, null, text);
    }

    public static StatusMessage warning(String code, String text) {
        return new StatusMessage(EStatusMessageType.WARNING, code, text);
    }

    public static StatusMessage error(String code, String text) {
        return new StatusMessage(EStatusMessageType.ERROR, code, text);
    }

    @Override
    public String toString() {
        return code == null
                ? String.format("%s: %s", type, text)
                : String.format("%s %s: %s", type, code, text);
    }
}
