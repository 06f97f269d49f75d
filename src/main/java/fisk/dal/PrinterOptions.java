package fisk.dal;

import fisk.common.ProtocolConstants;
import fisk.domain.fiscal.EPaymentType;

import java.util.Map;

/**
 * Driver settings taken from the service options: operator defaults and
 * per device payment type token overrides keyed by serial number.
 * @since 15/10/2026
 */
public record PrinterOptions(String operatorId,
                             String operatorPassword,
                             String operatorName,
                             Map<String, Map<EPaymentType, String>> paymentTypeRemap) {

    public PrinterOptions {
        operatorId = isBlank(operatorId) ? ProtocolConstants.DEFAULT_OPERATOR_ID : operatorId;
        operatorPassword = isBlank(operatorPassword) ? ProtocolConstants.DEFAULT_OPERATOR_PASSWORD : operatorPassword;
        operatorName = isBlank(operatorName) ? ProtocolConstants.DEFAULT_OPERATOR_NAME : operatorName;
        paymentTypeRemap = paymentTypeRemap == null ? Map.of() : Map.copyOf(paymentTypeRemap);
    }

    public static PrinterOptions defaults() {
        return new PrinterOptions(null, null, null, null);
    }

    /**
     * Apply the overrides configured for the given serial number onto the token map
     */
    public void remapPaymentTypes(String serialNumber, Map<EPaymentType, String> tokens) {
        if (serialNumber == null) {
            return;
        }
        Map<EPaymentType, String> overrides = paymentTypeRemap.get(serialNumber);
        if (overrides != null) {
            tokens.putAll(overrides);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
