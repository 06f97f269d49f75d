package fisk.domain.jobs;

import fisk.domain.fiscal.Credentials;
import fisk.domain.fiscal.CurrentDateTime;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.FiscalReport;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;
import fisk.domain.fiscal.driver.IFiscalPrinter;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One queued printer operation. Status moves ENQUEUED, RUNNING, FINISHED and
 * is written only by the worker; the result is visible once finished.
 * @since 16/10/2026
 */
public class PrintJob {
    private final String taskId;
    private final IFiscalPrinter printer;
    private final EPrintJobAction action;
    private final Object document;
    private final CountDownLatch finished = new CountDownLatch(1);

    private ETaskStatus status = ETaskStatus.ENQUEUED;
    private DeviceStatus result;
    private long finishedAt;

    public PrintJob(String taskId, IFiscalPrinter printer, EPrintJobAction action, Object document) {
        this.taskId = taskId;
        this.printer = printer;
        this.action = action;
        this.document = document;
    }

    public String getTaskId() {
        return taskId;
    }

    public EPrintJobAction getAction() {
        return action;
    }

    public IFiscalPrinter getPrinter() {
        return printer;
    }

    public synchronized ETaskStatus getStatus() {
        return status;
    }

    public synchronized DeviceStatus getResult() {
        return result;
    }

    public synchronized long getFinishedAt() {
        return finishedAt;
    }

    public synchronized TaskInfoResult toTaskInfo() {
        return new TaskInfoResult(status, result);
    }

    synchronized void markRunning() {
        status = ETaskStatus.RUNNING;
    }

    void finish(DeviceStatus jobResult) {
        synchronized (this) {
            result = jobResult;
            status = ETaskStatus.FINISHED;
            finishedAt = System.currentTimeMillis();
        }
        finished.countDown();
    }

    /**
     * @return true when the job finished within the timeout
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isExpired(long now, long retentionMs) {
        return status == ETaskStatus.FINISHED && now - finishedAt > retentionMs;
    }

    /**
     * Execute the action on the printer
     * @throws IllegalArgumentException when the document does not match the action
     */
    DeviceStatus execute() {
        switch (action) {
            case CHECK_STATUS:
                return printer.checkStatus();
            case SET_DATE_TIME:
                return printer.setDateTime(document(CurrentDateTime.class));
            case PRINT_RECEIPT:
                return printer.printReceipt(document(Receipt.class));
            case PRINT_REVERSAL_RECEIPT:
                return printer.printReversalReceipt(document(ReversalReceipt.class));
            case PRINT_MONEY_DEPOSIT:
                return printer.printMoneyDeposit(document(TransferAmount.class));
            case PRINT_MONEY_WITHDRAW:
                return printer.printMoneyWithdraw(document(TransferAmount.class));
            case PRINT_X_REPORT:
                return printer.printXReport(credentials());
            case PRINT_Z_REPORT:
                return printer.printZReport(credentials());
            case PRINT_DUPLICATE:
                return printer.printDuplicate(credentials());
            case PRINT_FISCAL_REPORT:
                return printer.printFiscalReport(document(FiscalReport.class));
            case RESET:
                return printer.reset(credentials());
            default:
                throw new IllegalArgumentException("Unsupported action: " + action);
        }
    }

    private <T> T document(Class<T> type) {
        if (!type.isInstance(document)) {
            throw new IllegalArgumentException(String.format("%s expects %s document, got %s",
                    action, type.getSimpleName(), document == null ? "none" : document.getClass().getSimpleName()));
        }
        return type.cast(document);
    }

    private Credentials credentials() {
        return document instanceof Credentials ? (Credentials) document : Credentials.empty();
    }

    @Override
    public String toString() {
        return String.format("PrintJob{task=%s, action=%s, status=%s}", taskId, action, getStatus());
    }
}
