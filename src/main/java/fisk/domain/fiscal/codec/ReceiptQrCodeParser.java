package fisk.domain.fiscal.codec;

import fisk.common.ProtocolConstants;
import fisk.domain.fiscal.ReceiptInfo;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.math.BigDecimal;

/**
 * Parses the last receipt QR code data, e.g. {@code 50163145*000002*2020-01-28*15:29:00*30.00}
 * @since 15/10/2026
 */
public final class ReceiptQrCodeParser {
    private static final DateTimeFormatter DATE_TIME = DateTimeFormat.forPattern(ProtocolConstants.RECEIPT_QR_DATE_TIME_FORMAT);

    private ReceiptQrCodeParser() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static ReceiptInfo parse(String qrCodeData) throws ProtocolException {
        if (qrCodeData == null) {
            throw new ProtocolException("Last receipt QR code data is empty");
        }
        String[] fields = qrCodeData.trim().split("\\" + ProtocolConstants.RECEIPT_QR_DELIMITER, -1);
        if (fields.length < ProtocolConstants.RECEIPT_QR_FIELDS) {
            throw new ProtocolException("Wrong number of fields in last receipt QR code data");
        }

        BigDecimal amount;
        try {
            amount = new BigDecimal(fields[4].trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Wrong format of receipt amount");
        }

        LocalDateTime dateTime;
        try {
            dateTime = DATE_TIME.parseLocalDateTime(fields[2].trim() + " " + fields[3].trim());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Wrong format of receipt date and time");
        }

        String receiptNumber = fields[1].trim();
        if (receiptNumber.isEmpty()) {
            throw new ProtocolException("Last receipt number is empty");
        }
        return new ReceiptInfo(fields[0].trim(), receiptNumber, dateTime, amount);
    }
}
