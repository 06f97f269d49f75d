package fisk.domain.fiscal.driver;

import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.EItemType;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.Item;
import fisk.domain.fiscal.Payment;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.ReceiptInfo;
import fisk.domain.fiscal.ReversalReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Vendor independent receipt life-cycle on top of the driver primitives.
 * <p>Any receipt left open on the device is aborted first. The first failing
 * step aborts the receipt and returns its status with a contextual info line;
 * nothing after it is sent. Receipt info is always re-read from the device
 * after a successful close. Documents missing an item type or an amount are
 * rejected before anything is sent.</p>
 * One instance prints one receipt.
 * @since 15/10/2026
 */
public class ReceiptOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ReceiptOrchestrator.class);

    private final IFiscalDriver driver;
    private EReceiptState state = EReceiptState.IDLE;

    public ReceiptOrchestrator(IFiscalDriver driver) {
        this.driver = driver;
    }

    public EReceiptState getState() {
        return state;
    }

    public DeviceStatusWithReceiptInfo printReceipt(Receipt receipt) {
        DeviceStatusWithReceiptInfo invalid = validate(receipt);
        if (invalid != null) {
            return invalid;
        }
        resetDevice();
        DeviceStatus status = step(() -> driver.openReceipt(
                receipt.getUniqueSaleNumber(),
                receipt.getOperator(),
                receipt.getOperatorPassword()));
        if (!status.isOk()) {
            return failed(status, "Error occurred while opening new fiscal receipt");
        }
        state = EReceiptState.OPENED;
        return printBody(receipt);
    }

    public DeviceStatusWithReceiptInfo printReversalReceipt(ReversalReceipt reversalReceipt) {
        DeviceStatusWithReceiptInfo invalid = validate(reversalReceipt);
        if (invalid != null) {
            return invalid;
        }
        resetDevice();
        DeviceStatus status = step(() -> driver.openReversalReceipt(reversalReceipt));
        if (!status.isOk()) {
            return failed(status, "Error occurred while opening new fiscal reversal receipt");
        }
        state = EReceiptState.OPENED;
        return printBody(reversalReceipt);
    }

    private DeviceStatusWithReceiptInfo printBody(Receipt receipt) {
        List<Item> items = receipt.getItems();
        DeviceStatus status;

        int itemNumber = 0;
        for (Item item : items) {
            itemNumber++;
            status = step(() -> addItem(item));
            if (!status.isOk()) {
                return failed(status, "Error occurred in Item " + itemNumber);
            }
        }

        List<Payment> payments = receipt.getPayments();
        if (payments.isEmpty()) {
            state = EReceiptState.PAYING;
            status = step(driver::fullPaymentAndCloseReceipt);
            if (!status.isOk()) {
                return failed(status, "Error occurred while making full payment in cash and closing the receipt");
            }
        } else {
            state = EReceiptState.PAYING;
            int paymentNumber = 0;
            for (Payment payment : payments) {
                paymentNumber++;
                if (payment.paymentType() == EPaymentType.CHANGE) {
                    continue;
                }
                status = step(() -> driver.addPayment(payment.amount(), payment.paymentType()));
                if (!status.isOk()) {
                    return failed(status, "Error occurred in Payment " + paymentNumber);
                }
            }

            itemNumber = 0;
            for (Item item : items) {
                itemNumber++;
                if (item.getType() != EItemType.FOOTER_COMMENT) {
                    continue;
                }
                status = step(() -> driver.addComment(item.getText()));
                if (!status.isOk()) {
                    return failed(status, "Error occurred in Item " + itemNumber);
                }
            }

            status = step(driver::closeReceipt);
            if (!status.isOk()) {
                return failed(status, "Error occurred while closing the receipt");
            }
        }

        state = EReceiptState.CLOSED;
        return driver.getLastReceiptInfo();
    }

    /**
     * @return status of the sent command, an empty status for deferred footer comments
     */
    private DeviceStatus addItem(Item item) {
        switch (item.getType()) {
            case COMMENT:
                state = EReceiptState.SELLING;
                return driver.addComment(item.getText());
            case SALE:
                state = EReceiptState.SELLING;
                return driver.addItem(item);
            case SURCHARGE_AMOUNT:
                state = EReceiptState.SELLING;
                return driver.subtotalChangeAmount(item.getAmount());
            case DISCOUNT_AMOUNT:
                state = EReceiptState.SELLING;
                return driver.subtotalChangeAmount(item.getAmount().negate());
            case FOOTER_COMMENT:
            default:
                return new DeviceStatus();
        }
    }

    /**
     * @return the rejection, {@code null} when every item and payment is complete
     */
    private DeviceStatusWithReceiptInfo validate(Receipt receipt) {
        int itemNumber = 0;
        for (Item item : receipt.getItems()) {
            itemNumber++;
            if (item == null || item.getType() == null) {
                return rejected("Item type is required", "Error occurred in Item " + itemNumber);
            }
            boolean subtotalChange = item.getType() == EItemType.SURCHARGE_AMOUNT
                    || item.getType() == EItemType.DISCOUNT_AMOUNT;
            if (subtotalChange && item.getAmount() == null) {
                return rejected("Amount is required", "Error occurred in Item " + itemNumber);
            }
        }
        int paymentNumber = 0;
        for (Payment payment : receipt.getPayments()) {
            paymentNumber++;
            if (payment == null || payment.amount() == null) {
                return rejected("Payment amount is required", "Error occurred in Payment " + paymentNumber);
            }
        }
        return null;
    }

    private DeviceStatusWithReceiptInfo rejected(String error, String context) {
        DeviceStatus result = DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, error);
        result.addInfo(context);
        logger.info("{}: {}", context, error);
        return new DeviceStatusWithReceiptInfo(result, ReceiptInfo.empty());
    }

    /**
     * Run one driver call, turning a runtime failure into an error status
     */
    private DeviceStatus step(Supplier<DeviceStatus> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            logger.error("Receipt step rejected: {}", e.getMessage());
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Receipt step failed", e);
            return DeviceStatus.ofError(EErrorKind.DEVICE_ERROR, "Unexpected error: " + e.getMessage());
        }
    }

    private void resetDevice() {
        DeviceStatus abortStatus = step(driver::abortReceipt);
        if (!abortStatus.isOk()) {
            logger.debug("Abort before receipt returned {}", abortStatus);
        }
        state = EReceiptState.IDLE;
    }

    private DeviceStatusWithReceiptInfo failed(DeviceStatus status, String context) {
        DeviceStatus abortStatus = step(driver::abortReceipt);
        if (!abortStatus.isOk()) {
            logger.warn("Abort after failure returned {}", abortStatus);
        }
        state = EReceiptState.ABORTED;
        DeviceStatus result = new DeviceStatus(status);
        result.addInfo(context);
        logger.info("{}: {}", context, status.getErrors());
        return new DeviceStatusWithReceiptInfo(result, ReceiptInfo.empty());
    }
}
