package fisk.domain.fiscal.provider;

import com.fazecast.jSerialComm.SerialPort;
import fisk.dal.PrinterOptions;
import fisk.dal.SerialConfig;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.channel.ChannelException;
import fisk.domain.fiscal.channel.IChannel;
import fisk.domain.fiscal.channel.IslFrameCodec;
import fisk.domain.fiscal.channel.SerialChannel;
import fisk.domain.fiscal.channel.ZfpFrameCodec;
import fisk.domain.fiscal.driver.FiscalPrinterBase;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import fisk.domain.fiscal.driver.IslFiscalPrinter;
import fisk.domain.fiscal.driver.ZfpFiscalPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serial port printer provider. The URI scheme selects the driver, the device
 * must answer the identification query to count as connected.
 * @since 15/10/2026
 */
public class PrinterProvider implements IPrinterProvider {
    private static final Logger logger = LoggerFactory.getLogger(PrinterProvider.class);

    private final SerialConfig serialConfig;

    @Inject
    public PrinterProvider(SerialConfig serialConfig) {
        this.serialConfig = serialConfig;
    }

    @Override
    public Map<String, IFiscalPrinter> detectAvailablePrinters(PrinterOptions options) {
        Map<String, IFiscalPrinter> found = new LinkedHashMap<>();
        for (SerialPort port : SerialPort.getCommPorts()) {
            for (EProtocol protocol : EProtocol.values()) {
                String uri = new PrinterUri(protocol, port.getSystemPortName(), 0).toString();
                try {
                    found.put(uri, connect(uri, options));
                    logger.info("Detected printer at {}", uri);
                    break;
                } catch (PrinterConnectException e) {
                    logger.debug("No {} printer at {}: {}", protocol, port.getSystemPortName(), e.getMessage());
                }
            }
        }
        return found;
    }

    @Override
    public IFiscalPrinter connect(String uri, PrinterOptions options) throws PrinterConnectException {
        PrinterUri printerUri;
        try {
            printerUri = PrinterUri.parse(uri);
        } catch (IllegalArgumentException e) {
            throw new PrinterConnectException(e.getMessage(), e);
        }

        IChannel channel;
        try {
            channel = openChannel(printerUri);
        } catch (ChannelException e) {
            throw new PrinterConnectException("Cannot open " + uri + ": " + e.getMessage(), e);
        }

        FiscalPrinterBase printer = createPrinter(printerUri.protocol(), channel, options);
        DeviceStatus status = printer.readDeviceInfo();
        if (!status.isOk()) {
            printer.close();
            throw new PrinterConnectException("Printer at " + uri + " did not identify: " + status.getErrors());
        }
        printer.setUri(uri);
        logger.info("Connected {}", printer.getDeviceInfo());
        return printer;
    }

    protected IChannel openChannel(PrinterUri uri) throws ChannelException {
        int baudRate = uri.baudRate() > 0 ? uri.baudRate() : serialConfig.defaultBaudRate();
        return SerialChannel.open(uri.port(), baudRate,
                uri.protocol() == EProtocol.ELTRADE_ISL ? new IslFrameCodec() : new ZfpFrameCodec(),
                serialConfig.readTimeoutMs(), serialConfig.writeTimeoutMs());
    }

    static FiscalPrinterBase createPrinter(EProtocol protocol, IChannel channel, PrinterOptions options) {
        switch (protocol) {
            case TREMOL_ZFP:
                return new ZfpFiscalPrinter(channel, options);
            case ELTRADE_ISL:
                return new IslFiscalPrinter(channel, options);
            default:
                throw new IllegalArgumentException("Unsupported protocol: " + protocol);
        }
    }
}
