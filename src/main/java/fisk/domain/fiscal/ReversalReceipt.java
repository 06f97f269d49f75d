package fisk.domain.fiscal;

import org.joda.time.LocalDateTime;

/**
 * Receipt voiding or refunding a previously printed receipt
 * @since 14/10/2026
 */
public class ReversalReceipt extends Receipt {
    private EReversalReason reason = EReversalReason.OPERATOR_ERROR;
    private String receiptNumber = "";
    private LocalDateTime receiptDateTime;
    private String fiscalMemorySerialNumber = "";

    public EReversalReason getReason() {
        return reason == null ? EReversalReason.OPERATOR_ERROR : reason;
    }
    public void setReason(EReversalReason reason) {
        this.reason = reason;
    }

    public String getReceiptNumber() {
        return receiptNumber == null ? "" : receiptNumber;
    }
    public void setReceiptNumber(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }

    public LocalDateTime getReceiptDateTime() {
        return receiptDateTime;
    }
    public void setReceiptDateTime(LocalDateTime receiptDateTime) {
        this.receiptDateTime = receiptDateTime;
    }

    public String getFiscalMemorySerialNumber() {
        return fiscalMemorySerialNumber == null ? "" : fiscalMemorySerialNumber;
    }
    public void setFiscalMemorySerialNumber(String fiscalMemorySerialNumber) {
        this.fiscalMemorySerialNumber = fiscalMemorySerialNumber;
    }
}
