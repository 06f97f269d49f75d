package fisk.domain.fiscal.driver;

import fisk.common.ZfpConstants;
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
import fisk.domain.fiscal.codec.ZfpCommandCodec;
import fisk.domain.fiscal.status.ZfpStatusBits;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Fiscal printer speaking the Tremol ZFP protocol
 * @since 15/10/2026
 */
public class ZfpFiscalPrinter extends FiscalPrinterBase {
    private static final DateTimeFormatter READ_DATE_TIME = DateTimeFormat.forPattern(ZfpConstants.DATE_TIME_READ_FORMAT);

    private final ZfpCommandCodec zfp;

    public ZfpFiscalPrinter(IChannel channel, PrinterOptions options) {
        this(channel, new ZfpCommandCodec(), options);
    }

    private ZfpFiscalPrinter(IChannel channel, ZfpCommandCodec codec, PrinterOptions options) {
        super(channel, codec, ZfpStatusBits.decoder(), options);
        this.zfp = codec;
        info.setManufacturer("Tremol");
        info.setModel("ZFP");
        info.setItemTextMaxLength(ZfpConstants.ITEM_TEXT_MAX_LENGTH);
        info.setCommentTextMaxLength(ZfpConstants.COMMENT_TEXT_MAX_LENGTH);
        info.setOperatorPasswordMaxLength(ZfpConstants.OPERATOR_PASSWORD_MAX_LENGTH);
        info.setSupportedPaymentTypes(new ArrayList<>(zfp.getDefaultPaymentTypeTokens().keySet()));
    }

    @Override
    public DeviceStatus getStatus() {
        return send(zfp.getStatus());
    }

    @Override
    public DeviceStatusWithDateTime getDateTime() {
        DeviceResponse response = request(zfp.getDateTime());
        DeviceStatusWithDateTime status = new DeviceStatusWithDateTime(response.status());
        if (!status.isOk()) {
            status.addInfo("Error occurred while reading current date and time");
            return status;
        }
        try {
            status.setDeviceDateTime(READ_DATE_TIME.parseLocalDateTime(response.payload().trim()));
        } catch (IllegalArgumentException e) {
            status.addInfo("Error occurred while parsing current date and time");
            status.addError(EErrorKind.PROTOCOL_SYNTAX_ERROR, "Wrong format of date and time");
        }
        return status;
    }

    @Override
    public DeviceStatus setDateTime(LocalDateTime dateTime) {
        return send(zfp.setDateTime(dateTime));
    }

    @Override
    public DeviceStatus openReceipt(String uniqueSaleNumber, String operator, String operatorPassword) {
        return send(zfp.openReceipt(uniqueSaleNumber, operatorId(operator), operatorPassword(operatorPassword)));
    }

    @Override
    public DeviceStatus openReversalReceipt(ReversalReceipt reversalReceipt) {
        Optional<String> reason = zfp.getReversalReasonToken(reversalReceipt.getReason());
        if (reason.isEmpty()) {
            return unsupported("Unsupported reversal reason: " + reversalReceipt.getReason());
        }
        if (reversalReceipt.getReceiptDateTime() == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Original receipt date and time is required");
        }
        return send(zfp.openReversalReceipt(
                operatorId(reversalReceipt.getOperator()),
                operatorPassword(reversalReceipt.getOperatorPassword()),
                reason.get(),
                reversalReceipt.getReceiptNumber(),
                reversalReceipt.getReceiptDateTime(),
                reversalReceipt.getFiscalMemorySerialNumber(),
                reversalReceipt.getUniqueSaleNumber()));
    }

    @Override
    public DeviceStatus addItem(Item item) {
        String taxGroupToken = "";
        if (item.getDepartment() <= 0) {
            Optional<String> token = zfp.getTaxGroupToken(item.getTaxGroup());
            if (token.isEmpty()) {
                return unsupported("Unsupported tax group: " + item.getTaxGroup());
            }
            taxGroupToken = token.get();
        }
        return send(zfp.sell(item, taxGroupToken, info.getItemTextMaxLength()));
    }

    @Override
    public DeviceStatus addComment(String text) {
        return send(zfp.freeText(text, info.getCommentTextMaxLength()));
    }

    @Override
    public DeviceStatus addPayment(BigDecimal amount, EPaymentType paymentType) {
        Optional<String> token = paymentTypeToken(paymentType);
        if (token.isEmpty()) {
            return unsupported("Unsupported payment type: " + paymentType);
        }
        return send(zfp.payment(token.get(), amount));
    }

    @Override
    public DeviceStatus subtotalChangeAmount(BigDecimal amount) {
        return send(zfp.subtotalChangeAmount(amount));
    }

    @Override
    public DeviceStatus closeReceipt() {
        return send(zfp.closeReceipt());
    }

    @Override
    public DeviceStatus abortReceipt() {
        return send(zfp.abortReceipt());
    }

    @Override
    public DeviceStatus fullPaymentAndCloseReceipt() {
        return send(zfp.fullPaymentAndCloseReceipt());
    }

    @Override
    public DeviceStatus printDailyReport(boolean zeroing) {
        return send(zfp.printDailyReport(zeroing));
    }

    @Override
    public DeviceStatus printReportForDate(LocalDate startDate, LocalDate endDate, EReportType type) {
        if (startDate == null || endDate == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Start and end date are required");
        }
        return send(zfp.printReportForDate(startDate, endDate, type));
    }

    @Override
    public DeviceStatus moneyTransfer(TransferAmount transferAmount) {
        if (transferAmount.amount() == null) {
            return DeviceStatus.ofError(EErrorKind.INVALID_ARGUMENT, "Amount is required");
        }
        return send(zfp.moneyTransfer(
                operatorId(transferAmount.operator()),
                operatorPassword(transferAmount.operatorPassword()),
                transferAmount.amount()));
    }

    @Override
    public DeviceStatus printDuplicate() {
        return send(zfp.printDuplicate());
    }

    @Override
    public DeviceStatus readDeviceInfo() {
        DeviceResponse numbers = request(zfp.readFiscalDeviceNumbers());
        if (!numbers.isOk()) {
            DeviceStatus status = new DeviceStatus(numbers.status());
            status.addInfo("Error occurred while reading device info");
            return status;
        }
        DeviceResponse version = request(zfp.readVersion());
        DeviceStatus status = new DeviceStatus(version.status());
        if (!status.isOk()) {
            status.addInfo("Error occurred while reading device info");
            return status;
        }

        // <SerialNumber>;<FMNumber>
        String[] numberFields = fields(numbers);
        if (numberFields.length < 2) {
            status.addInfo("Error occurred while reading device info");
            status.addError(EErrorKind.PROTOCOL_SYNTAX_ERROR, "Wrong number of fields");
            return status;
        }
        info.setSerialNumber(numberFields[0].trim());
        info.setFiscalMemorySerialNumber(numberFields[numberFields.length - 1].trim());

        // <DeviceType>;<CertificateNum>;<CertificateDateTime>;<Model>;<Version>
        String[] versionFields = fields(version);
        if (versionFields.length >= 5) {
            info.setModel(versionFields[3].trim());
        }
        info.setFirmwareVersion(versionFields[versionFields.length - 1].trim());
        return status;
    }

    @Override
    protected Command lastReceiptQrCodeCommand() {
        return zfp.readLastReceiptQrCodeData();
    }
}
