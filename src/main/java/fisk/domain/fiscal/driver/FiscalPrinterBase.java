package fisk.domain.fiscal.driver;

import fisk.common.ELogger;
import fisk.dal.PrinterOptions;
import fisk.domain.fiscal.Credentials;
import fisk.domain.fiscal.CurrentDateTime;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.FiscalReport;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.ReceiptInfo;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;
import fisk.domain.fiscal.channel.ChannelException;
import fisk.domain.fiscal.channel.IChannel;
import fisk.domain.fiscal.codec.Command;
import fisk.domain.fiscal.codec.ICommandCodec;
import fisk.domain.fiscal.codec.ProtocolException;
import fisk.domain.fiscal.codec.RawResponse;
import fisk.domain.fiscal.codec.ReceiptQrCodeParser;
import fisk.domain.fiscal.status.StatusDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Common plumbing of all fiscal printers: request round trip through the
 * channel, codec and status decoder, operator defaults, payment type tokens
 * and the high level operations built on the driver primitives.
 * @since 15/10/2026
 */
public abstract class FiscalPrinterBase implements IFiscalDriver, IFiscalPrinter {
    private static final Logger logger = LoggerFactory.getLogger(FiscalPrinterBase.class);
    private static final Logger wireLogger = ELogger.PROTOCOL.getLogger();

    private final IChannel channel;
    private final ICommandCodec codec;
    private final StatusDecoder statusDecoder;
    private final ReentrantLock requestLock = new ReentrantLock();
    protected final PrinterOptions options;
    protected final DeviceInfo info = new DeviceInfo();

    protected FiscalPrinterBase(IChannel channel, ICommandCodec codec, StatusDecoder statusDecoder,
                                PrinterOptions options) {
        this.channel = channel;
        this.codec = codec;
        this.statusDecoder = statusDecoder;
        this.options = options == null ? PrinterOptions.defaults() : options;
    }

    /**
     * Send one command and decode the answer. Transport and decoding failures
     * are returned as error statuses.
     */
    protected DeviceResponse request(Command command) {
        requestLock.lock();
        try {
            wireLogger.debug("{} >>> {}", channel.getDescriptor(), command);
            channel.send(codec.encode(command));
            RawResponse response = codec.decode(channel.receive());
            DeviceStatus status = statusDecoder.decode(response.getStatusBytes());
            wireLogger.debug("{} <<< {} {}", channel.getDescriptor(), response, status);
            return new DeviceResponse(response.getPayload(), status);
        } catch (ChannelException e) {
            logger.error("Transport failure on {} for {}: {}", channel.getDescriptor(), command, e.getMessage());
            return DeviceResponse.failed(DeviceStatus.ofError(EErrorKind.TRANSPORT_FAILURE, e.getMessage()));
        } catch (ProtocolException e) {
            logger.error("Malformed answer on {} for {}: {}", channel.getDescriptor(), command, e.getMessage());
            return DeviceResponse.failed(DeviceStatus.ofError(e.getKind(), e.getMessage()));
        } finally {
            requestLock.unlock();
        }
    }

    protected DeviceStatus send(Command command) {
        return request(command).status();
    }

    @Override
    public DeviceResponse rawRequest(byte opcode, String payload) {
        return request(new Command(opcode, payload));
    }

    protected ICommandCodec getCodec() {
        return codec;
    }

    // Payload fields separated by the vendor delimiter, empty trailing fields kept
    protected String[] fields(DeviceResponse response) {
        return response.payload().split(Pattern.quote(String.valueOf(codec.getFieldDelimiter())), -1);
    }

    protected String operatorId(String operator) {
        return operator == null || operator.isEmpty() ? options.operatorId() : operator;
    }

    protected String operatorPassword(String password) {
        return password == null || password.isEmpty() ? options.operatorPassword() : password;
    }

    protected String operatorName(String operator) {
        return operator == null || operator.isEmpty() ? options.operatorName() : operator;
    }

    /**
     * Vendor tokens with the overrides configured for this device applied
     */
    public Map<EPaymentType, String> getPaymentTypeTokens() {
        Map<EPaymentType, String> tokens = new EnumMap<>(EPaymentType.class);
        tokens.putAll(codec.getDefaultPaymentTypeTokens());
        options.remapPaymentTypes(info.getSerialNumber(), tokens);
        return tokens;
    }

    protected Optional<String> paymentTypeToken(EPaymentType paymentType) {
        if (paymentType == null || paymentType == EPaymentType.CHANGE) {
            return Optional.empty();
        }
        return Optional.ofNullable(getPaymentTypeTokens().get(paymentType));
    }

    protected static DeviceStatus unsupported(String text) {
        return DeviceStatus.ofError(EErrorKind.UNSUPPORTED_VALUE, text);
    }

    @Override
    public DeviceStatusWithReceiptInfo getLastReceiptInfo() {
        DeviceResponse response = request(lastReceiptQrCodeCommand());
        DeviceStatus status = new DeviceStatus(response.status());
        if (!status.isOk()) {
            status.addInfo("Error occurred while reading last receipt QR code data");
            return new DeviceStatusWithReceiptInfo(status, ReceiptInfo.empty());
        }
        try {
            return new DeviceStatusWithReceiptInfo(status, ReceiptQrCodeParser.parse(response.payload()));
        } catch (ProtocolException e) {
            status.addInfo("Error occurred while parsing last receipt QR code data");
            status.addError(e.getKind(), e.getMessage());
            return new DeviceStatusWithReceiptInfo(status, ReceiptInfo.empty());
        }
    }

    protected abstract Command lastReceiptQrCodeCommand();

    // High level operations

    public void setUri(String uri) {
        info.setUri(uri);
    }

    @Override
    public DeviceInfo getDeviceInfo() {
        return new DeviceInfo(info);
    }

    @Override
    public DeviceStatusWithDateTime checkStatus() {
        DeviceStatusWithDateTime status = getDateTime();
        if (status.getDeviceDateTime() == null) {
            status.addInfo("Error occurred while reading current status");
            status.addError(EErrorKind.PROTOCOL_SYNTAX_ERROR, "Cannot read current date and time");
        }
        return status;
    }

    @Override
    public DeviceStatus setDateTime(CurrentDateTime currentDateTime) {
        if (currentDateTime == null || currentDateTime.deviceDateTime() == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Date and time is required");
        }
        return setDateTime(currentDateTime.deviceDateTime());
    }

    @Override
    public DeviceStatusWithReceiptInfo printReceipt(Receipt receipt) {
        return new ReceiptOrchestrator(this).printReceipt(receipt);
    }

    @Override
    public DeviceStatusWithReceiptInfo printReversalReceipt(ReversalReceipt reversalReceipt) {
        return new ReceiptOrchestrator(this).printReversalReceipt(reversalReceipt);
    }

    @Override
    public DeviceStatus printMoneyDeposit(TransferAmount transferAmount) {
        return moneyTransfer(transferAmount);
    }

    @Override
    public DeviceStatus printMoneyWithdraw(TransferAmount transferAmount) {
        BigDecimal amount = transferAmount.amount() == null ? BigDecimal.ZERO : transferAmount.amount();
        if (amount.signum() < 0) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Withdraw amount must be positive number");
        }
        return moneyTransfer(transferAmount.withAmount(amount.negate()));
    }

    @Override
    public DeviceStatus printXReport(Credentials credentials) {
        return printDailyReport(false);
    }

    @Override
    public DeviceStatus printZReport(Credentials credentials) {
        return printDailyReport(true);
    }

    @Override
    public DeviceStatus printDuplicate(Credentials credentials) {
        return printDuplicate();
    }

    @Override
    public DeviceStatus printFiscalReport(FiscalReport fiscalReport) {
        DeviceStatus status = printReportForDate(fiscalReport.startDate(), fiscalReport.endDate(), fiscalReport.type());
        if (!status.isOk()) {
            DeviceStatus result = new DeviceStatus(status);
            result.addInfo("Error occurred while printing fiscal report");
            return result;
        }
        return status;
    }

    @Override
    public DeviceStatusWithDateTime reset(Credentials credentials) {
        abortReceipt();
        fullPaymentAndCloseReceipt();
        return checkStatus();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String toString() {
        return String.format("%s{%s}", getClass().getSimpleName(), info);
    }
}
