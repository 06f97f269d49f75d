package fisk.domain.jobs;

import fisk.dal.JobConfig;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.TransferAmount;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the single worker print job queue
 * @since 17/10/2026
 */
@Timeout(10)
class PrintJobQueueTest {

    private final PrintJobQueue queue = new PrintJobQueue(new JobConfig(5000, 60000, 60000));
    private final IFiscalPrinter printer = mock(IFiscalPrinter.class);

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    @DisplayName("Should return the job result when it finishes in time")
    void shouldReturnResultWhenFinished() {
        // Given
        DeviceStatusWithDateTime status = new DeviceStatusWithDateTime(new DeviceStatus());
        when(printer.checkStatus()).thenReturn(status);

        // When
        Object result = queue.runAsync(printer, EPrintJobAction.CHECK_STATUS, null, -1);

        // Then
        assertThat(result).isSameAs(status);
    }

    @Test
    @DisplayName("Should return the task id at once for a zero timeout")
    void shouldReturnTaskIdForZeroTimeout() throws InterruptedException {
        // Given
        CountDownLatch finished = new CountDownLatch(1);
        queue.getEvents()
                .filter(event -> event.status() == ETaskStatus.FINISHED)
                .subscribe(event -> finished.countDown());
        when(printer.printXReport(any())).thenReturn(new DeviceStatus());

        // When
        Object result = queue.runAsync(printer, EPrintJobAction.PRINT_X_REPORT, null, 0);

        // Then
        assertThat(result).isInstanceOf(TaskIdResult.class);
        String taskId = ((TaskIdResult) result).taskId();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        TaskInfoResult info = queue.getTaskInfo(taskId);
        assertThat(info.taskStatus()).isEqualTo(ETaskStatus.FINISHED);
        assertThat(info.result().isOk()).isTrue();
    }

    @Test
    @DisplayName("Should report unknown tasks")
    void shouldReportUnknownTask() {
        assertThat(queue.getTaskInfo("nope").taskStatus()).isEqualTo(ETaskStatus.UNKNOWN);
        assertThat(queue.getTaskInfo(null).result()).isNull();
    }

    @Test
    @DisplayName("Should run jobs one at a time in arrival order")
    void shouldRunJobsSequentially() throws InterruptedException {
        // Given
        List<String> trace = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        when(printer.printMoneyDeposit(any())).thenAnswer(invocation -> {
            TransferAmount amount = invocation.getArgument(0);
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            trace.add("start " + amount.amount());
            Thread.sleep(20);
            trace.add("end " + amount.amount());
            concurrent.decrementAndGet();
            return new DeviceStatus();
        });
        CountDownLatch finished = new CountDownLatch(3);
        queue.getEvents()
                .filter(event -> event.status() == ETaskStatus.FINISHED)
                .subscribe(event -> finished.countDown());

        // When
        for (int i = 1; i <= 3; i++) {
            queue.enqueue(printer, EPrintJobAction.PRINT_MONEY_DEPOSIT,
                    new TransferAmount(null, null, BigDecimal.valueOf(i)));
        }

        // Then
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(trace).containsExactly("start 1", "end 1", "start 2", "end 2", "start 3", "end 3");
    }

    @Test
    @DisplayName("Should publish enqueued, running and finished events in order")
    void shouldPublishEventsInOrder() throws InterruptedException {
        // Given
        List<PrintJobEvent> events = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch finished = new CountDownLatch(1);
        queue.getEvents().subscribe(event -> {
            events.add(event);
            if (event.status() == ETaskStatus.FINISHED) {
                finished.countDown();
            }
        });
        when(printer.printZReport(any())).thenReturn(new DeviceStatus());

        // When
        String taskId = queue.enqueue(printer, EPrintJobAction.PRINT_Z_REPORT, null);

        // Then
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(events).extracting(PrintJobEvent::status)
                .containsExactly(ETaskStatus.ENQUEUED, ETaskStatus.RUNNING, ETaskStatus.FINISHED);
        assertThat(events).extracting(PrintJobEvent::taskId).containsOnly(taskId);
        assertThat(events).extracting(PrintJobEvent::action).containsOnly(EPrintJobAction.PRINT_Z_REPORT);
    }

    @Test
    @DisplayName("Should finish a job with a mismatched document as invalid argument")
    void shouldRejectWrongDocument() {
        // When
        Object result = queue.runAsync(printer, EPrintJobAction.PRINT_RECEIPT, "not a receipt", -1);

        // Then
        assertThat(result).isInstanceOf(DeviceStatus.class);
        DeviceStatus status = (DeviceStatus) result;
        assertThat(status.isOk()).isFalse();
        assertThat(status.getErrors()).extracting(m -> m.code())
                .containsExactly(EErrorKind.INVALID_ARGUMENT.getCode());
    }

    @Test
    @DisplayName("Should finish a job whose printer throws as device error")
    void shouldReportUnexpectedFailure() {
        // Given
        when(printer.checkStatus()).thenThrow(new IllegalStateException("boom"));

        // When
        Object result = queue.runAsync(printer, EPrintJobAction.CHECK_STATUS, null, -1);

        // Then
        DeviceStatus status = (DeviceStatus) result;
        assertThat(status.getErrors()).extracting(m -> m.code())
                .containsExactly(EErrorKind.DEVICE_ERROR.getCode());
        assertThat(status.getErrors().get(0).text()).contains("boom");
    }

    @Test
    @DisplayName("Should purge only finished jobs past retention")
    void shouldPurgeExpiredJobs() {
        // Given
        when(printer.checkStatus()).thenReturn(new DeviceStatusWithDateTime(new DeviceStatus()));
        queue.runAsync(printer, EPrintJobAction.CHECK_STATUS, null, -1);
        assertThat(queue.getJobCount()).isEqualTo(1);

        // When & Then
        assertThat(queue.purgeFinished(System.currentTimeMillis())).isZero();
        assertThat(queue.purgeFinished(System.currentTimeMillis() + 120000)).isEqualTo(1);
        assertThat(queue.getJobCount()).isZero();
    }

    @Test
    @DisplayName("Should generate 22 character URL-safe task ids")
    void shouldGenerateTaskIds() {
        // When
        String first = PrintJobQueue.newTaskId();
        String second = PrintJobQueue.newTaskId();

        // Then
        assertThat(first).hasSize(22).matches("[A-Za-z0-9_-]+");
        assertThat(first).isNotEqualTo(second);
    }
}
