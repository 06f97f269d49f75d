package fisk.domain;

import fisk.common.ELogger;
import fisk.dal.PrinterConfig;
import fisk.dal.ServiceOptions;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.jobs.EPrintJobAction;
import fisk.domain.jobs.ETaskStatus;
import fisk.domain.jobs.PrintJobQueue;
import fisk.domain.jobs.TaskInfoResult;
import fisk.domain.registry.PrinterRegistry;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Map;
import java.util.Optional;

/**
 * Service context built once at start-up: routes client requests to the
 * printer registry and the print job queue.
 * @since 17/10/2026
 */
@Singleton
public class FiscalServiceController {
    private static final Logger logger = LoggerFactory.getLogger(FiscalServiceController.class);
    private static final Logger jobsLogger = ELogger.JOBS.getLogger();

    private final PrinterRegistry registry;
    private final PrintJobQueue jobQueue;
    private final ServiceOptions options;

    private Disposable jobEventsSubscription;

    @Inject
    public FiscalServiceController(PrinterRegistry registry, PrintJobQueue jobQueue, ServiceOptions options) {
        this.registry = registry;
        this.jobQueue = jobQueue;
        this.options = options;
    }

    /**
     * Start the job queue housekeeping and detect printers
     */
    public synchronized void start() {
        if (jobEventsSubscription == null) {
            jobEventsSubscription = jobQueue.getEvents()
                    .filter(event -> event.status() == ETaskStatus.FINISHED)
                    .subscribe(event -> jobsLogger.debug("Print job {} ({}) done, {} job(s) retained",
                            event.taskId(), event.action(), jobQueue.getJobCount()));
        }
        jobQueue.start();
        if (!registry.detect(false)) {
            logger.warn("Initial printer detection did not run");
        }
    }

    public synchronized void stop() {
        if (jobEventsSubscription != null) {
            jobEventsSubscription.dispose();
            jobEventsSubscription = null;
        }
        jobQueue.shutdown();
        registry.closeAll();
    }

    public Map<String, DeviceInfo> getPrinters() {
        return registry.getPrintersInfo();
    }

    public Optional<DeviceInfo> getPrinterInfo(String printerId) {
        return registry.get(printerId).map(printer -> printer.getDeviceInfo());
    }

    /**
     * Queue an action for a printer and wait for it.
     *
     * @param asyncTimeoutMs 0 returns the task id at once, a negative value waits the default timeout
     * @return the result or task id, empty when the printer is unknown
     */
    public Optional<Object> run(String printerId, EPrintJobAction action, Object document, long asyncTimeoutMs) {
        return registry.get(printerId)
                .map(printer -> jobQueue.runAsync(printer, action, document, asyncTimeoutMs));
    }

    public TaskInfoResult getTaskInfo(String taskId) {
        return jobQueue.getTaskInfo(taskId);
    }

    public boolean detect() {
        return registry.detect(true);
    }

    public boolean configurePrinter(String printerId, String uri) {
        return registry.configurePrinter(printerId, uri);
    }

    public boolean deletePrinter(String printerId) {
        return registry.deletePrinter(printerId);
    }

    public ServiceInfo getServiceInfo() {
        return new ServiceInfo(options.getServerId(), options.isAutoDetect(), registry.isReady(),
                options.getPrinters());
    }

    /**
     * Service identity and configured printers as exposed to clients
     */
    public record ServiceInfo(String serverId, boolean autoDetect, boolean ready,
                              Map<String, PrinterConfig> printers) {
    }
}
