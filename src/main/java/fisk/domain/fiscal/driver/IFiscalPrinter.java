package fisk.domain.fiscal.driver;

import fisk.domain.fiscal.Credentials;
import fisk.domain.fiscal.CurrentDateTime;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.FiscalReport;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;

/**
 * Fiscal printer operations executed by print jobs
 * @since 15/10/2026
 */
public interface IFiscalPrinter extends AutoCloseable {
    DeviceInfo getDeviceInfo();

    DeviceStatusWithDateTime checkStatus();

    DeviceStatus setDateTime(CurrentDateTime currentDateTime);

    DeviceStatusWithReceiptInfo printReceipt(Receipt receipt);

    DeviceStatusWithReceiptInfo printReversalReceipt(ReversalReceipt reversalReceipt);

    DeviceStatus printMoneyDeposit(TransferAmount transferAmount);

    DeviceStatus printMoneyWithdraw(TransferAmount transferAmount);

    /**
     * Print the daily report without zeroing.
     * @param credentials not sent; the supported devices print daily reports without an operator login
     */
    DeviceStatus printXReport(Credentials credentials);

    /**
     * Print the daily report and zero the day totals.
     * @param credentials not sent; the supported devices print daily reports without an operator login
     */
    DeviceStatus printZReport(Credentials credentials);

    /**
     * Reprint the last receipt.
     * @param credentials not sent; the supported devices print duplicates without an operator login
     */
    DeviceStatus printDuplicate(Credentials credentials);

    DeviceStatus printFiscalReport(FiscalReport fiscalReport);

    /**
     * Abort or close whatever receipt is open and read the status
     */
    DeviceStatusWithDateTime reset(Credentials credentials);

    @Override
    void close();
}
