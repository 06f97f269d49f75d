package fisk.domain.fiscal.driver;

import fisk.common.IslConstants;
import fisk.dal.PrinterOptions;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EReportType;
import fisk.domain.fiscal.Item;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;
import fisk.domain.fiscal.channel.IChannel;
import fisk.domain.fiscal.codec.Command;
import fisk.domain.fiscal.codec.IslCommandCodec;
import fisk.domain.fiscal.status.IslStatusBits;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Fiscal printer speaking the Eltrade ISL protocol.
 * The operator is identified by name; ISL receipts carry no operator password.
 * @since 15/10/2026
 */
public class IslFiscalPrinter extends FiscalPrinterBase {
    private static final DateTimeFormatter DATE_TIME = DateTimeFormat.forPattern(IslConstants.DATE_TIME_FORMAT);

    private final IslCommandCodec isl;

    public IslFiscalPrinter(IChannel channel, PrinterOptions options) {
        this(channel, new IslCommandCodec(), options);
    }

    private IslFiscalPrinter(IChannel channel, IslCommandCodec codec, PrinterOptions options) {
        super(channel, codec, IslStatusBits.decoder(), options);
        this.isl = codec;
        info.setManufacturer("Eltrade");
        info.setModel("ISL");
        info.setItemTextMaxLength(IslConstants.ITEM_TEXT_MAX_LENGTH);
        info.setCommentTextMaxLength(IslConstants.COMMENT_TEXT_MAX_LENGTH);
        info.setOperatorPasswordMaxLength(IslConstants.OPERATOR_PASSWORD_MAX_LENGTH);
        info.setSupportedPaymentTypes(new ArrayList<>(isl.getDefaultPaymentTypeTokens().keySet()));
    }

    @Override
    public DeviceStatus getStatus() {
        return send(isl.getStatus());
    }

    @Override
    public DeviceStatusWithDateTime getDateTime() {
        DeviceResponse response = request(isl.getDateTime());
        DeviceStatusWithDateTime status = new DeviceStatusWithDateTime(response.status());
        if (!status.isOk()) {
            status.addInfo("Error occurred while reading current date and time");
            return status;
        }
        try {
            status.setDeviceDateTime(DATE_TIME.parseLocalDateTime(response.payload().trim()));
        } catch (IllegalArgumentException e) {
            status.addInfo("Error occurred while parsing current date and time");
            status.addError(EErrorKind.PROTOCOL_SYNTAX_ERROR, "Wrong format of date and time");
        }
        return status;
    }

    @Override
    public DeviceStatus setDateTime(LocalDateTime dateTime) {
        return send(isl.setDateTime(dateTime));
    }

    @Override
    public DeviceStatus openReceipt(String uniqueSaleNumber, String operator, String operatorPassword) {
        return send(isl.openReceipt(operatorName(operator), uniqueSaleNumber));
    }

    @Override
    public DeviceStatus openReversalReceipt(ReversalReceipt reversalReceipt) {
        Optional<String> reason = isl.getReversalReasonToken(reversalReceipt.getReason());
        if (reason.isEmpty()) {
            return unsupported("Unsupported reversal reason: " + reversalReceipt.getReason());
        }
        if (reversalReceipt.getReceiptDateTime() == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Original receipt date and time is required");
        }
        return send(isl.openReversalReceipt(
                operatorName(reversalReceipt.getOperator()),
                reversalReceipt.getUniqueSaleNumber(),
                reversalReceipt.getFiscalMemorySerialNumber(),
                reason.get(),
                reversalReceipt.getReceiptNumber(),
                reversalReceipt.getReceiptDateTime()));
    }

    @Override
    public DeviceStatus addItem(Item item) {
        String taxGroupToken = "";
        if (item.getDepartment() <= 0) {
            Optional<String> token = isl.getTaxGroupToken(item.getTaxGroup());
            if (token.isEmpty()) {
                return unsupported("Unsupported tax group: " + item.getTaxGroup());
            }
            taxGroupToken = token.get();
        }
        return send(isl.sell(item, taxGroupToken, info.getItemTextMaxLength()));
    }

    @Override
    public DeviceStatus addComment(String text) {
        return send(isl.fiscalText(text, info.getCommentTextMaxLength()));
    }

    @Override
    public DeviceStatus addPayment(BigDecimal amount, EPaymentType paymentType) {
        Optional<String> token = paymentTypeToken(paymentType);
        if (token.isEmpty()) {
            return unsupported("Unsupported payment type: " + paymentType);
        }
        return send(isl.payment(token.get(), amount));
    }

    @Override
    public DeviceStatus subtotalChangeAmount(BigDecimal amount) {
        return send(isl.subtotalChangeAmount(amount));
    }

    @Override
    public DeviceStatus closeReceipt() {
        return send(isl.closeReceipt());
    }

    @Override
    public DeviceStatus abortReceipt() {
        return send(isl.abortReceipt());
    }

    @Override
    public DeviceStatus fullPaymentAndCloseReceipt() {
        DeviceStatus status = send(isl.fullPayment());
        if (!status.isOk()) {
            return status;
        }
        return closeReceipt();
    }

    @Override
    public DeviceStatus printDailyReport(boolean zeroing) {
        return send(isl.printDailyReport(zeroing));
    }

    @Override
    public DeviceStatus printReportForDate(LocalDate startDate, LocalDate endDate, EReportType type) {
        if (startDate == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Start date is required");
        }
        return send(isl.printReportForDate(startDate));
    }

    @Override
    public DeviceStatus moneyTransfer(TransferAmount transferAmount) {
        if (transferAmount.amount() == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Amount is required");
        }
        return send(isl.moneyTransfer(transferAmount.amount()));
    }

    @Override
    public DeviceStatus printDuplicate() {
        return send(isl.printDuplicate());
    }

    @Override
    public DeviceStatus readDeviceInfo() {
        DeviceResponse response = request(isl.readDiagnosticInfo());
        DeviceStatus status = new DeviceStatus(response.status());
        if (!status.isOk()) {
            status.addInfo("Error occurred while reading device info");
            return status;
        }
        // <FwRev> <FwDate> <FwTime>,<Checksum>,<Switches>,<Country>,<SerialNumber>,<FMNumber>
        String[] diagnostic = fields(response);
        if (diagnostic.length < 6) {
            status.addInfo("Error occurred while reading device info");
            status.addError(EErrorKind.PROTOCOL_SYNTAX_ERROR, "Wrong number of fields");
            return status;
        }
        info.setFirmwareVersion(diagnostic[0].trim());
        info.setSerialNumber(diagnostic[4].trim());
        info.setFiscalMemorySerialNumber(diagnostic[5].trim());
        return status;
    }

    @Override
    protected Command lastReceiptQrCodeCommand() {
        return isl.readLastReceiptQrCodeData();
    }
}
