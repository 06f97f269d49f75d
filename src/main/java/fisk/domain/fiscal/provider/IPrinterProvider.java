package fisk.domain.fiscal.provider;

import fisk.dal.PrinterOptions;
import fisk.domain.fiscal.driver.IFiscalPrinter;

import java.util.Map;

/**
 * Connection factory for fiscal printers
 * @since 15/10/2026
 */
public interface IPrinterProvider {
    /**
     * Scan local ports for printers answering any supported protocol
     * @return connected printers by URI
     */
    Map<String, IFiscalPrinter> detectAvailablePrinters(PrinterOptions options);

    IFiscalPrinter connect(String uri, PrinterOptions options) throws PrinterConnectException;
}
