package fisk.domain.fiscal;

/**
 * Result of printing a receipt
 * @since 14/10/2026
 */
public class DeviceStatusWithReceiptInfo extends DeviceStatus {
    private final ReceiptInfo receiptInfo;

    public DeviceStatusWithReceiptInfo(DeviceStatus status, ReceiptInfo receiptInfo) {
        super(status);
        this.receiptInfo = receiptInfo;
    }

    public ReceiptInfo getReceiptInfo() {
        return receiptInfo;
    }
}
