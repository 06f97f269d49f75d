package fisk.common;

/**
 * Eltrade ISL protocol constants
 * @since 15/10/2026
 */
public final class IslConstants {
    private IslConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final byte CMD_GET_STATUS = 0x4A;
    public static final byte CMD_DIAGNOSTIC_INFO = 0x5A;
    public static final byte CMD_OPEN_FISCAL_RECEIPT = (byte) 0x90;
    public static final byte CMD_CLOSE_FISCAL_RECEIPT = 0x38;
    public static final byte CMD_ABORT_FISCAL_RECEIPT = 0x3C;
    public static final byte CMD_SELL = 0x31;
    public static final byte CMD_SELL_DEPARTMENT = (byte) 0x8A;
    public static final byte CMD_SUBTOTAL = 0x33;
    public static final byte CMD_TOTAL = 0x35;
    public static final byte CMD_FISCAL_TEXT = 0x36;
    public static final byte CMD_GET_DATE_TIME = 0x3E;
    public static final byte CMD_SET_DATE_TIME = 0x3D;
    public static final byte CMD_MONEY_TRANSFER = 0x46;
    public static final byte CMD_PRINT_DAILY_REPORT = 0x45;
    public static final byte CMD_PRINT_REPORT_FOR_DATE = 0x4F;
    public static final byte CMD_PRINT_DUPLICATE = 0x6D;
    public static final byte CMD_READ_LAST_RECEIPT_QR = 0x74;

    public static final int STATUS_BYTES = 6;
    public static final byte STATUS_SEPARATOR = 0x04;
    // Byte 3 of the status carries the SW1..SW7 switch states
    public static final int SWITCH_STATE_BYTE = 3;
    public static final char FIELD_DELIMITER = ',';
    public static final char SALE_FIELD_DELIMITER = '\t';
    public static final int ITEM_TEXT_MAX_LENGTH = 32;
    public static final int COMMENT_TEXT_MAX_LENGTH = 46;
    public static final int OPERATOR_PASSWORD_MAX_LENGTH = 8;

    public static final String DATE_TIME_FORMAT = "dd-MM-yy HH:mm:ss";
    public static final String REVERSAL_DATE_TIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss";
    public static final String REPORT_DATE_FORMAT = "ddMM";
}
