package fisk.common;

/**
 * Constants shared by all fiscal protocols
 * @since 15/10/2026
 */
public final class ProtocolConstants {
    private ProtocolConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final String DEVICE_CHARSET = "windows-1251";
    public static final String DEFAULT_OPERATOR_ID = "1";
    public static final String DEFAULT_OPERATOR_PASSWORD = "0000";
    public static final String DEFAULT_OPERATOR_NAME = "Operator";

    // QR data: <FM Number>*<Receipt Number>*<Receipt Date>*<Receipt Hour>*<Receipt Amount>
    public static final char RECEIPT_QR_DELIMITER = '*';
    public static final int RECEIPT_QR_FIELDS = 5;
    public static final String RECEIPT_QR_DATE_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";
}
