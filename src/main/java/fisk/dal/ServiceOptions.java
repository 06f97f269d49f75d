package fisk.dal;

import fisk.domain.fiscal.EPaymentType;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted service options: server identity, auto detection, configured
 * printers, operator defaults and payment type overrides per serial number.
 * @since 15/10/2026
 */
public class ServiceOptions {
    private static final SecureRandom RANDOM = new SecureRandom();

    private String serverId;
    private boolean autoDetect = true;
    private Map<String, PrinterConfig> printers = new LinkedHashMap<>();
    private String operatorId;
    private String operatorPassword;
    private String operatorName;
    private Map<String, Map<EPaymentType, String>> paymentTypeRemap = new LinkedHashMap<>();

    public synchronized String getServerId() {
        return serverId;
    }

    /**
     * Generate the server id once
     * @return true when a new id was generated
     */
    public synchronized boolean ensureServerId() {
        if (serverId != null && !serverId.isEmpty()) {
            return false;
        }
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        serverId = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return true;
    }

    public synchronized boolean isAutoDetect() {
        return autoDetect;
    }

    public synchronized void setAutoDetect(boolean autoDetect) {
        this.autoDetect = autoDetect;
    }

    /**
     * @return copy of the printer id to connection map
     */
    public synchronized Map<String, PrinterConfig> getPrinters() {
        return printers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(printers);
    }

    public synchronized void setPrinters(Map<String, PrinterConfig> printers) {
        this.printers = new LinkedHashMap<>(printers);
    }

    public synchronized void putPrinter(String id, PrinterConfig config) {
        if (printers == null) {
            printers = new LinkedHashMap<>();
        }
        printers.put(id, config);
    }

    public synchronized boolean removePrinter(String id) {
        return printers != null && printers.remove(id) != null;
    }

    public synchronized void setOperator(String operatorId, String operatorPassword, String operatorName) {
        this.operatorId = operatorId;
        this.operatorPassword = operatorPassword;
        this.operatorName = operatorName;
    }

    public synchronized void setPaymentTypeRemap(String serialNumber, Map<EPaymentType, String> tokens) {
        if (paymentTypeRemap == null) {
            paymentTypeRemap = new LinkedHashMap<>();
        }
        paymentTypeRemap.put(serialNumber, new LinkedHashMap<>(tokens));
    }

    public synchronized PrinterOptions toPrinterOptions() {
        return new PrinterOptions(operatorId, operatorPassword, operatorName, paymentTypeRemap);
    }

    @Override
    public synchronized String toString() {
        return String.format("ServiceOptions{serverId='%s', autoDetect=%s, printers=%s}",
                serverId, autoDetect, printers);
    }
}
