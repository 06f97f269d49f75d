package fisk.domain.jobs;

import fisk.common.ELogger;
import fisk.dal.JobConfig;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * FIFO print job queue with a single worker thread.
 * <p>Jobs run strictly in arrival order, one at a time across all printers.
 * The worker is started lazily and exits when the queue drains; the next
 * enqueue starts a new one. Finished jobs stay queryable until purged.</p>
 * @since 16/10/2026
 */
@Singleton
public class PrintJobQueue {
    private static final Logger logger = ELogger.JOBS.getLogger();

    private final JobConfig config;
    private final Map<String, PrintJob> jobs = new ConcurrentHashMap<>();
    private final Queue<PrintJob> queue = new ConcurrentLinkedQueue<>();
    private final Subject<PrintJobEvent> events = PublishSubject.<PrintJobEvent>create().toSerialized();
    private final Object workerLock = new Object();

    private Thread worker;
    private volatile PrintJob running;
    private ScheduledExecutorService cleanupScheduler;

    @Inject
    public PrintJobQueue(JobConfig config) {
        this.config = config;
    }

    /**
     * Start the periodic purge of finished jobs
     */
    public synchronized void start() {
        if (cleanupScheduler != null) {
            return;
        }
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "print-job-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupScheduler.scheduleAtFixedRate(() -> purgeFinished(System.currentTimeMillis()),
                config.cleanupIntervalMs(), config.cleanupIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public synchronized void shutdown() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
        }
        events.onComplete();
    }

    public Observable<PrintJobEvent> getEvents() {
        return events;
    }

    /**
     * Append a job and make sure a worker is running
     * @return task id of the new job
     */
    public String enqueue(IFiscalPrinter printer, EPrintJobAction action, Object document) {
        PrintJob job = new PrintJob(newTaskId(), printer, action, document);
        jobs.put(job.getTaskId(), job);
        publish(job, ETaskStatus.ENQUEUED);
        synchronized (workerLock) {
            queue.add(job);
            if (worker == null || !worker.isAlive()) {
                worker = new Thread(this::drain, "print-job-worker");
                worker.setDaemon(true);
                worker.start();
                logger.debug("Started print job worker");
            }
        }
        return job.getTaskId();
    }

    /**
     * Enqueue a job and wait for it.
     *
     * @param timeoutMs 0 returns the task id at once, a negative value waits the default timeout
     * @return the job result when it finished in time, otherwise a {@link TaskIdResult}
     */
    public Object runAsync(IFiscalPrinter printer, EPrintJobAction action, Object document, long timeoutMs) {
        String taskId = enqueue(printer, action, document);
        if (timeoutMs == 0) {
            return new TaskIdResult(taskId);
        }
        long wait = timeoutMs < 0 ? config.defaultTaskTimeoutMs() : timeoutMs;
        PrintJob job = jobs.get(taskId);
        try {
            if (job != null && job.await(wait)) {
                return job.getResult();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for task {}", taskId);
        }
        return new TaskIdResult(taskId);
    }

    public TaskInfoResult getTaskInfo(String taskId) {
        PrintJob job = taskId == null ? null : jobs.get(taskId);
        return job == null ? TaskInfoResult.unknown() : job.toTaskInfo();
    }

    /**
     * @return true while a job is queued or running
     */
    public boolean hasPendingJobs() {
        synchronized (workerLock) {
            return !queue.isEmpty() || running != null;
        }
    }

    /**
     * Remove finished jobs older than the retention period
     * @return number of removed jobs
     */
    public int purgeFinished(long now) {
        int removed = 0;
        for (Map.Entry<String, PrintJob> entry : jobs.entrySet()) {
            if (entry.getValue().isExpired(now, config.retentionMs())) {
                jobs.remove(entry.getKey());
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged {} finished print jobs", removed);
        }
        return removed;
    }

    public int getJobCount() {
        return jobs.size();
    }

    private void drain() {
        while (true) {
            PrintJob job;
            synchronized (workerLock) {
                job = queue.poll();
                if (job == null) {
                    worker = null;
                    return;
                }
                running = job;
            }
            try {
                execute(job);
            } finally {
                running = null;
            }
        }
    }

    private void execute(PrintJob job) {
        job.markRunning();
        publish(job, ETaskStatus.RUNNING);
        DeviceStatus result;
        try {
            result = job.execute();
        } catch (IllegalArgumentException e) {
            logger.error("Task {} rejected: {}", job.getTaskId(), e.getMessage());
            result = DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Task " + job.getTaskId() + " failed", e);
            result = DeviceStatus.ofError(EErrorKind.DEVICE_ERROR, "Unexpected error: " + e.getMessage());
        }
        job.finish(result);
        publish(job, ETaskStatus.FINISHED);
    }

    private void publish(PrintJob job, ETaskStatus status) {
        logger.info("Task {} {} {}", job.getTaskId(), job.getAction(), status);
        events.onNext(new PrintJobEvent(job.getTaskId(), job.getAction(), status, System.currentTimeMillis()));
    }

    /**
     * URL-safe base64 of a random UUID, 22 characters
     */
    static String newTaskId() {
        UUID uuid = UUID.randomUUID();
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(uuid.getMostSignificantBits());
        buffer.putLong(uuid.getLeastSignificantBits());
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
    }
}
