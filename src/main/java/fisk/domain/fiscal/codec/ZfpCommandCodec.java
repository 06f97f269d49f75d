package fisk.domain.fiscal.codec;

import fisk.common.ProtocolConstants;
import fisk.common.ZfpConstants;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EPriceModifierType;
import fisk.domain.fiscal.EReportType;
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
 * Tremol ZFP command grammar.
 * <p>Request packet is {@code [cmd][payload]}, response packet is
 * {@code [7 status bytes][payload]}. Fields are separated by ';'.</p>
 * @since 15/10/2026
 */
public class ZfpCommandCodec implements ICommandCodec {
    private static final Charset CHARSET = Charset.forName(ProtocolConstants.DEVICE_CHARSET);
    private static final DateTimeFormatter WRITE_DATE_TIME = DateTimeFormat.forPattern(ZfpConstants.DATE_TIME_WRITE_FORMAT);
    private static final DateTimeFormatter REPORT_DATE = DateTimeFormat.forPattern(ZfpConstants.REPORT_DATE_FORMAT);

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
        paymentTypes.put(EPaymentType.CASH, "0");
        paymentTypes.put(EPaymentType.CHECK, "1");
        paymentTypes.put(EPaymentType.COUPONS, "2");
        paymentTypes.put(EPaymentType.EXT_COUPONS, "3");
        paymentTypes.put(EPaymentType.PACKAGING, "4");
        paymentTypes.put(EPaymentType.INTERNAL_USAGE, "5");
        paymentTypes.put(EPaymentType.DAMAGE, "6");
        paymentTypes.put(EPaymentType.CARD, "7");
        paymentTypes.put(EPaymentType.BANK, "8");
        paymentTypes.put(EPaymentType.RESERVED_1, "9");
        paymentTypes.put(EPaymentType.RESERVED_2, "10");
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
        if (packet == null || packet.length < ZfpConstants.STATUS_BYTES) {
            throw new ProtocolException(String.format("Response is shorter than %d status bytes",
                    ZfpConstants.STATUS_BYTES));
        }
        byte[] status = Arrays.copyOfRange(packet, 0, ZfpConstants.STATUS_BYTES);
        String payload = new String(packet, ZfpConstants.STATUS_BYTES,
                packet.length - ZfpConstants.STATUS_BYTES, CHARSET);
        return new RawResponse(payload, status);
    }

    @Override
    public char getFieldDelimiter() {
        return ZfpConstants.FIELD_DELIMITER;
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
                return Optional.of("0");
            case REFUND:
                return Optional.of("1");
            case TAX_BASE_REDUCTION:
                return Optional.of("2");
            default:
                return Optional.empty();
        }
    }

    @Override
    public Map<EPaymentType, String> getDefaultPaymentTypeTokens() {
        return PAYMENT_TYPES;
    }

    // Command builders

    public Command readFiscalDeviceNumbers() {
        return Command.of(ZfpConstants.CMD_READ_FD_NUMBERS);
    }

    public Command readVersion() {
        return Command.of(ZfpConstants.CMD_VERSION);
    }

    public Command getStatus() {
        return Command.of(ZfpConstants.CMD_GET_STATUS);
    }

    public Command getDateTime() {
        return Command.of(ZfpConstants.CMD_GET_DATE_TIME);
    }

    public Command setDateTime(LocalDateTime dateTime) {
        return new Command(ZfpConstants.CMD_SET_DATE_TIME, WRITE_DATE_TIME.print(dateTime));
    }

    public Command moneyTransfer(String operator, String password, BigDecimal amount) {
        // <OperNum>;<OperPass>;<reserved>;<Amount>
        return new Command(ZfpConstants.CMD_MONEY_TRANSFER,
                String.join(";", operator, password, "0", ProtocolFormat.amount(amount)));
    }

    public Command openReceipt(String uniqueSaleNumber, String operator, String password) {
        // <OperNum>;<OperPass>;<ReceiptFormat>;<PrintVAT>;<FiscalRcpPrintType>$<UniqueReceiptNumber>
        return new Command(ZfpConstants.CMD_OPEN_RECEIPT,
                String.join(";", operator, password, "1", "1", "2$" + uniqueSaleNumber));
    }

    public Command openReversalReceipt(String operator, String password, String reasonToken,
                                       String receiptNumber, LocalDateTime receiptDateTime,
                                       String fiscalMemorySerialNumber, String uniqueSaleNumber) {
        return new Command(ZfpConstants.CMD_OPEN_RECEIPT, String.join(";",
                operator,
                password,
                "1",
                "1",
                "D",
                reasonToken,
                receiptNumber,
                WRITE_DATE_TIME.print(receiptDateTime),
                fiscalMemorySerialNumber,
                uniqueSaleNumber));
    }

    /**
     * Sale on a tax group or, when the item department is positive, on a department.
     *
     * @param item          sale line
     * @param taxGroupToken resolved tax group token, ignored for department sales
     * @param itemTextMaxLength printed width of the article name
     */
    public Command sell(Item item, String taxGroupToken, int itemTextMaxLength) {
        boolean departmentSale = item.getDepartment() > 0;
        StringBuilder data = new StringBuilder()
                .append(ProtocolFormat.padRight(
                        ProtocolFormat.withMaxLength(item.getText(), itemTextMaxLength),
                        ZfpConstants.ITEM_TEXT_MANDATORY_LENGTH))
                .append(';')
                .append(departmentSale ? ProtocolFormat.department(item.getDepartment()) : taxGroupToken)
                .append(';')
                .append(ProtocolFormat.amount(item.getUnitPrice()));

        if (item.getQuantity().signum() != 0) {
            data.append('*').append(ProtocolFormat.quantity(item.getQuantity()));
        }
        appendPriceModifier(data, item.getPriceModifierType(), item.getPriceModifierValue());

        return new Command(departmentSale ? ZfpConstants.CMD_SELL_DEPARTMENT : ZfpConstants.CMD_SELL,
                data.toString());
    }

    private static void appendPriceModifier(StringBuilder data, EPriceModifierType type, BigDecimal value) {
        if (type == EPriceModifierType.NONE) {
            return;
        }
        BigDecimal signed = type.isDiscount() ? value.negate() : value;
        data.append(type.isPercent() ? ',' : ':').append(ProtocolFormat.amount(signed));
    }

    public Command freeText(String text, int maxLength) {
        return new Command(ZfpConstants.CMD_FREE_TEXT, ProtocolFormat.withMaxLength(text, maxLength));
    }

    public Command payment(String paymentTypeToken, BigDecimal amount) {
        // <PaymentType>;<OptionChange>;<Amount>*  ("1" = without change)
        return new Command(ZfpConstants.CMD_PAYMENT,
                String.join(";", paymentTypeToken, "1", ProtocolFormat.amount(amount) + "*"));
    }

    public Command subtotalChangeAmount(BigDecimal amount) {
        // <OptionPrinting>;<OptionDisplay>:<DiscAddV>
        return new Command(ZfpConstants.CMD_SUBTOTAL, "1;0:" + ProtocolFormat.amount(amount));
    }

    public Command closeReceipt() {
        return Command.of(ZfpConstants.CMD_CLOSE_RECEIPT);
    }

    public Command abortReceipt() {
        return Command.of(ZfpConstants.CMD_ABORT_RECEIPT);
    }

    public Command fullPaymentAndCloseReceipt() {
        return Command.of(ZfpConstants.CMD_FULL_PAYMENT_AND_CLOSE);
    }

    public Command printDailyReport(boolean zeroing) {
        return new Command(ZfpConstants.CMD_PRINT_DAILY_REPORT, zeroing ? "Z" : "X");
    }

    public Command printReportForDate(LocalDate startDate, LocalDate endDate, EReportType type) {
        byte opcode = type == EReportType.DETAILED
                ? ZfpConstants.CMD_DETAILED_REPORT_FOR_DATE
                : ZfpConstants.CMD_BRIEF_REPORT_FOR_DATE;
        return new Command(opcode, REPORT_DATE.print(startDate) + ";" + REPORT_DATE.print(endDate));
    }

    public Command readLastReceiptQrCodeData() {
        return new Command(ZfpConstants.CMD_READ_LAST_RECEIPT_QR, "B");
    }

    public Command printDuplicate() {
        return Command.of(ZfpConstants.CMD_PRINT_DUPLICATE);
    }
}
