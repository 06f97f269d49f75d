package fisk.domain.registry;

import fisk.dal.ConfigurationException;
import fisk.dal.PrinterConfig;
import fisk.dal.ServiceOptions;
import fisk.dal.ServiceOptionsStore;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import fisk.domain.fiscal.provider.IPrinterProvider;
import fisk.domain.fiscal.provider.PrinterConnectException;
import fisk.domain.jobs.PrintJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connected printers indexed by printer id.
 * <p>Detected printers get the lower-cased serial number as id, with a
 * {@code _n} suffix when the id is taken by a printer on another URI; the same
 * printer found twice on the same URI is ignored. Configured printers keep the
 * id they were configured with.</p>
 * @since 16/10/2026
 */
@Singleton
public class PrinterRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PrinterRegistry.class);

    private final IPrinterProvider provider;
    private final ServiceOptions options;
    private final ServiceOptionsStore optionsStore;
    private final PrintJobQueue jobQueue;
    private final Map<String, IFiscalPrinter> printers = new ConcurrentHashMap<>();
    private final List<IFiscalPrinter> retired = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean ready = true;

    @Inject
    public PrinterRegistry(IPrinterProvider provider, ServiceOptions options,
                           ServiceOptionsStore optionsStore, PrintJobQueue jobQueue) {
        this.provider = provider;
        this.options = options;
        this.optionsStore = optionsStore;
        this.jobQueue = jobQueue;
    }

    public boolean isReady() {
        return ready;
    }

    /**
     * Register a detected printer under its serial number
     * @return assigned printer id, empty when the printer is already registered on the same URI
     */
    public Optional<String> add(IFiscalPrinter printer) {
        DeviceInfo info = printer.getDeviceInfo();
        String baseId = info.getSerialNumber().toLowerCase(Locale.ROOT);
        lock.lock();
        try {
            String printerId = baseId;
            int duplicateNumber = 0;
            while (printers.containsKey(printerId)) {
                if (Objects.equals(printers.get(printerId).getDeviceInfo().getUri(), info.getUri())) {
                    logger.debug("Printer {} already registered on {}", printerId, info.getUri());
                    return Optional.empty();
                }
                duplicateNumber++;
                printerId = baseId + "_" + duplicateNumber;
            }
            printers.put(printerId, printer);
            logger.info("Found {}: {}", printerId, info.getUri());
            return Optional.of(printerId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<IFiscalPrinter> get(String printerId) {
        return printerId == null ? Optional.empty() : Optional.ofNullable(printers.get(printerId));
    }

    /**
     * @return device info of all printers, sorted by id
     */
    public Map<String, DeviceInfo> getPrintersInfo() {
        Map<String, DeviceInfo> result = new TreeMap<>();
        printers.forEach((id, printer) -> result.put(id, printer.getDeviceInfo()));
        return result;
    }

    /**
     * Auto-detect local printers (when enabled or forced) and connect every configured one.
     * Runs only while no print job is pending and no other detection is in progress.
     *
     * @return false when the detection was skipped
     */
    public boolean detect(boolean forceAutoDetect) {
        lock.lock();
        try {
            if (jobQueue.hasPendingJobs() || !ready) {
                logger.info("Printer detection skipped (ready={}, pending jobs={})", ready, jobQueue.hasPendingJobs());
                return false;
            }
            ready = false;
            try {
                closeRetired();
                if (forceAutoDetect || options.isAutoDetect()) {
                    logger.info("Autodetecting local printers...");
                    for (IFiscalPrinter detected : provider.detectAvailablePrinters(options.toPrinterOptions()).values()) {
                        if (add(detected).isEmpty()) {
                            detected.close();
                        }
                    }
                }

                logger.info("Detecting configured printers...");
                for (Map.Entry<String, PrinterConfig> entry : options.getPrinters().entrySet()) {
                    connectConfigured(entry.getKey(), entry.getValue().uri());
                }

                // Every registered printer is persisted, aliases included
                for (Map.Entry<String, IFiscalPrinter> entry : printers.entrySet()) {
                    options.putPrinter(entry.getKey(), new PrinterConfig(entry.getValue().getDeviceInfo().getUri()));
                }
                saveOptions();
                logger.info("Detecting done. Found {} available printer(s).", printers.size());
            } finally {
                ready = true;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void connectConfigured(String printerId, String uri) {
        if (uri == null || uri.isEmpty()) {
            return;
        }
        IFiscalPrinter existing = printers.get(printerId);
        if (existing != null && uri.equals(existing.getDeviceInfo().getUri())) {
            logger.debug("Printer {} already connected on {}", printerId, uri);
            return;
        }
        try {
            IFiscalPrinter printer = provider.connect(uri, options.toPrinterOptions());
            IFiscalPrinter replaced = printers.put(printerId, printer);
            if (replaced != null) {
                retire(replaced);
            }
            logger.info("Trying {}: {}, OK", printerId, uri);
        } catch (PrinterConnectException e) {
            logger.warn("Trying {}: {}, failed: {}", printerId, uri, e.getMessage());
        }
    }

    public boolean configurePrinter(String printerId, String uri) {
        if (printerId == null || printerId.isEmpty() || uri == null || uri.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            options.putPrinter(printerId, new PrinterConfig(uri));
            return saveOptions();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the printer from the configuration and from the registry.
     * Its channel is closed once no print job is pending.
     * @return false when the id is not configured or the options cannot be saved
     */
    public boolean deletePrinter(String printerId) {
        if (printerId == null || printerId.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            if (!options.removePrinter(printerId)) {
                return false;
            }
            IFiscalPrinter removed = printers.remove(printerId);
            if (removed != null) {
                retire(removed);
            }
            logger.info("Printer {} deleted", printerId);
            return saveOptions();
        } finally {
            lock.unlock();
        }
    }

    public void closeAll() {
        lock.lock();
        try {
            printers.values().forEach(IFiscalPrinter::close);
            printers.clear();
            closeRetired();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close a printer taken out of the registry, or keep it for later while a
     * queued job may still hold it
     */
    private void retire(IFiscalPrinter printer) {
        if (jobQueue.hasPendingJobs()) {
            logger.debug("Closing {} deferred until print jobs are done", printer.getDeviceInfo().getUri());
            retired.add(printer);
        } else {
            printer.close();
        }
    }

    private void closeRetired() {
        retired.forEach(IFiscalPrinter::close);
        retired.clear();
    }

    private boolean saveOptions() {
        try {
            optionsStore.save(options);
            return true;
        } catch (ConfigurationException e) {
            logger.error("Failed to persist service options: {}", e.getMessage());
            return false;
        }
    }
}
