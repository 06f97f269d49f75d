package fisk.domain.fiscal.codec;

import fisk.common.IslConstants;
import fisk.common.ProtocolConstants;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EPriceModifierType;
import fisk.domain.fiscal.EReversalReason;
import fisk.domain.fiscal.ETaxGroup;
import fisk.domain.fiscal.Item;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Eltrade ISL command grammar.
 * <p>Request packet is {@code [cmd][payload]}, response packet is
 * {@code [payload][0x04][6 status bytes]}. Header fields are separated by ',',
 * sale fields by TAB.</p>
 * @since 15/10/2026
 */
public class IslCommandCodec implements ICommandCodec {
    private static final Charset CHARSET = Charset.forName(ProtocolConstants.DEVICE_CHARSET);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormat.forPattern(IslConstants.DATE_TIME_FORMAT);
    private static final DateTimeFormatter REVERSAL_DATE_TIME = DateTimeFormat.forPattern(IslConstants.REVERSAL_DATE_TIME_FORMAT);
    private static final DateTimeFormatter REPORT_DATE = DateTimeFormat.forPattern(IslConstants.REPORT_DATE_FORMAT);

    private static final Map<ETaxGroup, String> TAX_GROUPS;
    private static final Map<EPaymentType, String> PAYMENT_TYPES;

    static {
        Map<ETaxGroup, String> taxGroups = new EnumMap<>(ETaxGroup.class);
        taxGroups.put(ETaxGroup.TAX_GROUP_1, "А");
        taxGroups.put(ETaxGroup.TAX_GROUP_2, "Б");
        taxGroups.put(ETaxGroup.TAX_GROUP_3, "В");
        taxGroups.put(ETaxGroup.TAX_GROUP_4, "Г");
        taxGroups.put(ETaxGroup.TAX_GROUP_5, "Д");
        taxGroups.put(ETaxGroup.TAX_GROUP_6, "Е");
        taxGroups.put(ETaxGroup.TAX_GROUP_7, "Ж");
        taxGroups.put(ETaxGroup.TAX_GROUP_8, "З");
        TAX_GROUPS = Collections.unmodifiableMap(taxGroups);

        Map<EPaymentType, String> paymentTypes = new EnumMap<>(EPaymentType.class);
        paymentTypes.put(EPaymentType.CASH, "P");
        paymentTypes.put(EPaymentType.CHECK, "N");
        paymentTypes.put(EPaymentType.COUPONS, "C");
        paymentTypes.put(EPaymentType.EXT_COUPONS, "D");
        paymentTypes.put(EPaymentType.PACKAGING, "I");
        paymentTypes.put(EPaymentType.INTERNAL_USAGE, "J");
        paymentTypes.put(EPaymentType.DAMAGE, "K");
        paymentTypes.put(EPaymentType.CARD, "L");
        paymentTypes.put(EPaymentType.BANK, "M");
        paymentTypes.put(EPaymentType.RESERVED_1, "Q");
        paymentTypes.put(EPaymentType.RESERVED_2, "R");
        PAYMENT_TYPES = Collections.unmodifiableMap(paymentTypes);
    }

    @Override
    public byte[] encode(Command command) {
        byte[] payload = command.payload().getBytes(CHARSET);
        byte[] packet = new byte[payload.length + 1];
        packet[0] = command.opcode();
        System.arraycopy(payload, 0, packet, 1, payload.length);
        return packet;
    }

    @Override
    public RawResponse decode(byte[] packet) throws ProtocolException {
        int statusLength = IslConstants.STATUS_BYTES + 1;
        if (packet == null || packet.length < statusLength) {
            throw new ProtocolException(String.format("Response is shorter than %d status bytes",
                    IslConstants.STATUS_BYTES));
        }
        int separator = packet.length - statusLength;
        if (packet[separator] != IslConstants.STATUS_SEPARATOR) {
            throw new ProtocolException("Status separator not found in response");
        }
        String payload = new String(packet, 0, separator, CHARSET);
        byte[] status = Arrays.copyOfRange(packet, separator + 1, packet.length);
        return new RawResponse(payload, status);
    }

    @Override
    public char getFieldDelimiter() {
        return IslConstants.FIELD_DELIMITER;
    }

    @Override
    public Optional<String> getTaxGroupToken(ETaxGroup taxGroup) {
        return taxGroup == null ? Optional.empty() : Optional.ofNullable(TAX_GROUPS.get(taxGroup));
    }

    @Override
    public Optional<String> getReversalReasonToken(EReversalReason reason) {
        if (reason == null) {
            return Optional.empty();
        }
        switch (reason) {
            case OPERATOR_ERROR:
                return Optional.of("O");
            case REFUND:
                return Optional.of("R");
            case TAX_BASE_REDUCTION:
                return Optional.of("T");
            default:
                return Optional.empty();
        }
    }

    @Override
    public Map<EPaymentType, String> getDefaultPaymentTypeTokens() {
        return PAYMENT_TYPES;
    }

    // Command builders

    public Command getStatus() {
        return Command.of(IslConstants.CMD_GET_STATUS);
    }

    public Command readDiagnosticInfo() {
        // "1" asks for the diagnostic info without printing it
        return new Command(IslConstants.CMD_DIAGNOSTIC_INFO, "1");
    }

    public Command getDateTime() {
        return Command.of(IslConstants.CMD_GET_DATE_TIME);
    }

    public Command setDateTime(LocalDateTime dateTime) {
        return new Command(IslConstants.CMD_SET_DATE_TIME, DATE_TIME.print(dateTime));
    }

    public Command moneyTransfer(BigDecimal amount) {
        // Positive amount is a deposit, negative a withdraw
        return new Command(IslConstants.CMD_MONEY_TRANSFER, ProtocolFormat.amount(amount));
    }

    public Command openReceipt(String operatorName, String uniqueSaleNumber) {
        return new Command(IslConstants.CMD_OPEN_FISCAL_RECEIPT, String.join(",", operatorName, uniqueSaleNumber));
    }

    public Command openReversalReceipt(String operatorName, String uniqueSaleNumber, String fiscalMemorySerialNumber,
                                       String reasonToken, String receiptNumber, LocalDateTime receiptDateTime) {
        // <OperName>,<UNP>,<Type>,<FMIN>,<Reason>,<num>,<time>
        return new Command(IslConstants.CMD_OPEN_FISCAL_RECEIPT, String.join(",",
                operatorName,
                uniqueSaleNumber,
                "S",
                fiscalMemorySerialNumber,
                reasonToken,
                receiptNumber,
                REVERSAL_DATE_TIME.print(receiptDateTime)));
    }

    /**
     * Sale on a tax group or, when the item department is positive, on a department.
     */
    public Command sell(Item item, String taxGroupToken, int itemTextMaxLength) {
        boolean departmentSale = item.getDepartment() > 0;
        StringBuilder data = new StringBuilder()
                .append(ProtocolFormat.withMaxLength(item.getText(), itemTextMaxLength))
                .append(IslConstants.SALE_FIELD_DELIMITER);
        if (departmentSale) {
            data.append(item.getDepartment())
                    .append(IslConstants.SALE_FIELD_DELIMITER);
        } else {
            data.append(taxGroupToken);
        }
        data.append(ProtocolFormat.amount(item.getUnitPrice()));

        if (item.getQuantity().signum() != 0) {
            data.append('*').append(ProtocolFormat.quantity(item.getQuantity()));
        }
        appendPriceModifier(data, item.getPriceModifierType(), item.getPriceModifierValue());

        return new Command(departmentSale ? IslConstants.CMD_SELL_DEPARTMENT : IslConstants.CMD_SELL,
                data.toString());
    }

    private static void appendPriceModifier(StringBuilder data, EPriceModifierType type, BigDecimal value) {
        if (type == EPriceModifierType.NONE) {
            return;
        }
        BigDecimal signed = type.isDiscount() ? value.negate() : value;
        data.append(type.isPercent() ? ',' : ';').append(ProtocolFormat.amount(signed));
    }

    public Command fiscalText(String text, int maxLength) {
        return new Command(IslConstants.CMD_FISCAL_TEXT, ProtocolFormat.withMaxLength(text, maxLength));
    }

    public Command payment(String paymentTypeToken, BigDecimal amount) {
        return new Command(IslConstants.CMD_TOTAL,
                IslConstants.SALE_FIELD_DELIMITER + paymentTypeToken + ProtocolFormat.amount(amount));
    }

    public Command fullPayment() {
        return new Command(IslConstants.CMD_TOTAL, String.valueOf(IslConstants.SALE_FIELD_DELIMITER));
    }

    public Command subtotalChangeAmount(BigDecimal amount) {
        // <Print><Display>;<DiscAddV>
        return new Command(IslConstants.CMD_SUBTOTAL, "10;" + ProtocolFormat.amount(amount));
    }

    public Command closeReceipt() {
        return Command.of(IslConstants.CMD_CLOSE_FISCAL_RECEIPT);
    }

    public Command abortReceipt() {
        return Command.of(IslConstants.CMD_ABORT_FISCAL_RECEIPT);
    }

    public Command printDailyReport(boolean zeroing) {
        return new Command(IslConstants.CMD_PRINT_DAILY_REPORT, zeroing ? "0" : "2");
    }

    /**
     * The device prints the report for the month of the start date; the end date is not sent.
     */
    public Command printReportForDate(LocalDate startDate) {
        return new Command(IslConstants.CMD_PRINT_REPORT_FOR_DATE, REPORT_DATE.print(startDate));
    }

    public Command readLastReceiptQrCodeData() {
        return Command.of(IslConstants.CMD_READ_LAST_RECEIPT_QR);
    }

    public Command printDuplicate() {
        return new Command(IslConstants.CMD_PRINT_DUPLICATE, "1");
    }
}
