package fisk.domain.fiscal;

import org.joda.time.LocalDateTime;

import java.math.BigDecimal;

/**
 * Receipt data read back from the device after a successful close
 * @since 14/10/2026
 */
public record ReceiptInfo(String fiscalMemorySerialNumber,
                          String receiptNumber,
                          LocalDateTime receiptDateTime,
                          BigDecimal receiptAmount) {

    public static ReceiptInfo empty() {
        return new ReceiptInfo("", "", null, BigDecimal.ZERO);
    }

    public boolean isEmpty() {
        return receiptNumber == null || receiptNumber.isEmpty();
    }
}
