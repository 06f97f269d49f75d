package fisk.common;

/**
 * Tremol ZFP protocol constants
 * @since 15/10/2026
 */
public final class ZfpConstants {
    private ZfpConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final byte CMD_READ_FD_NUMBERS = 0x60;
    public static final byte CMD_GET_STATUS = 0x20;
    public static final byte CMD_VERSION = 0x21;
    public static final byte CMD_PRINT_DAILY_REPORT = 0x7C;
    public static final byte CMD_MONEY_TRANSFER = 0x3B;
    public static final byte CMD_OPEN_RECEIPT = 0x30;
    public static final byte CMD_CLOSE_RECEIPT = 0x38;
    public static final byte CMD_FULL_PAYMENT_AND_CLOSE = 0x36;
    public static final byte CMD_ABORT_RECEIPT = 0x39;
    public static final byte CMD_SELL = 0x31;
    public static final byte CMD_SELL_DEPARTMENT = 0x34;
    public static final byte CMD_FREE_TEXT = 0x37;
    public static final byte CMD_PAYMENT = 0x35;
    public static final byte CMD_GET_DATE_TIME = 0x68;
    public static final byte CMD_SET_DATE_TIME = 0x48;
    public static final byte CMD_SUBTOTAL = 0x33;
    public static final byte CMD_READ_LAST_RECEIPT_QR = 0x72;
    public static final byte CMD_PRINT_DUPLICATE = 0x3A;
    public static final byte CMD_BRIEF_REPORT_FOR_DATE = 0x7B;
    public static final byte CMD_DETAILED_REPORT_FOR_DATE = 0x7A;

    public static final int STATUS_BYTES = 7;
    public static final char FIELD_DELIMITER = ';';
    // 36 symbols for the article name, 34 are printed; shorter names are a syntax error
    public static final int ITEM_TEXT_MANDATORY_LENGTH = 36;
    public static final int ITEM_TEXT_MAX_LENGTH = 34;
    public static final int COMMENT_TEXT_MAX_LENGTH = 30;
    public static final int OPERATOR_PASSWORD_MAX_LENGTH = 6;

    public static final String DATE_TIME_READ_FORMAT = "dd-MM-yyyy HH:mm";
    public static final String DATE_TIME_WRITE_FORMAT = "dd-MM-yy HH:mm:ss";
    public static final String REPORT_DATE_FORMAT = "ddMMyy";
}
