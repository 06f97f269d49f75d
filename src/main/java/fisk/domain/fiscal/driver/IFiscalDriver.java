package fisk.domain.fiscal.driver;

import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EReportType;
import fisk.domain.fiscal.Item;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;

import java.math.BigDecimal;

/**
 * Fiscal primitives of one device. Every call sends at most a few commands and
 * reports failures through the returned status, never by throwing.
 * @since 15/10/2026
 */
public interface IFiscalDriver {
    DeviceStatus getStatus();

    /**
     * Read the device clock. The date time is {@code null} when the answer cannot be parsed.
     */
    DeviceStatusWithDateTime getDateTime();

    DeviceStatus setDateTime(LocalDateTime dateTime);

    DeviceStatus openReceipt(String uniqueSaleNumber, String operator, String operatorPassword);

    DeviceStatus openReversalReceipt(ReversalReceipt reversalReceipt);

    DeviceStatus addItem(Item item);

    DeviceStatus addComment(String text);

    DeviceStatus addPayment(BigDecimal amount, EPaymentType paymentType);

    DeviceStatus subtotalChangeAmount(BigDecimal amount);

    DeviceStatus closeReceipt();

    DeviceStatus abortReceipt();

    DeviceStatus fullPaymentAndCloseReceipt();

    DeviceStatus printDailyReport(boolean zeroing);

    DeviceStatus printReportForDate(LocalDate startDate, LocalDate endDate, EReportType type);

    /**
     * Re-read the last closed receipt from the device
     */
    DeviceStatusWithReceiptInfo getLastReceiptInfo();

    DeviceStatus moneyTransfer(TransferAmount transferAmount);

    DeviceStatus printDuplicate();

    /**
     * Query identity and firmware; updates the device info on success
     */
    DeviceStatus readDeviceInfo();

    DeviceResponse rawRequest(byte opcode, String payload);
}
