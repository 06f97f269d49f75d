package fisk.domain.fiscal.driver;

import fisk.dal.PrinterOptions;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EReportType;
import fisk.domain.fiscal.ETaxGroup;
import fisk.domain.fiscal.FiscalReport;
import fisk.domain.fiscal.Item;
import fisk.domain.fiscal.Payment;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.StatusMessage;
import fisk.domain.fiscal.codec.Command;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static fisk.domain.fiscal.driver.ScriptedChannel.islAnswer;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the Eltrade ISL driver against a scripted channel
 * @since 17/10/2026
 */
class IslFiscalPrinterTest {

    private final ScriptedChannel channel = new ScriptedChannel();
    private final IslFiscalPrinter printer = new IslFiscalPrinter(channel, PrinterOptions.defaults());

    private static Receipt receipt(Payment... payments) {
        Receipt receipt = new Receipt();
        receipt.setUniqueSaleNumber("USN1");
        receipt.setItems(List.of(
                Item.sale("Bread", new BigDecimal("1.50"), ETaxGroup.TAX_GROUP_2, new BigDecimal("2")),
                Item.footerComment("Thank you")));
        receipt.setPayments(List.of(payments));
        return receipt;
    }

    @Test
    @DisplayName("Should pay, print footer comments and close the receipt")
    void shouldPrintReceiptWithPayments() {
        // Given
        for (int i = 0; i < 6; i++) {
            channel.answer(islAnswer(""));
        }
        channel.answer(islAnswer("44123456*000010*2020-01-28*15:29:00*3.00"));

        // When
        DeviceStatusWithReceiptInfo result = printer.printReceipt(receipt(
                new Payment(new BigDecimal("5.00"), EPaymentType.CASH),
                new Payment(new BigDecimal("2.00"), EPaymentType.CHANGE)));

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(channel.getSentCommands()).containsExactly(
                Command.of((byte) 0x3C),
                new Command((byte) 0x90, "Operator,USN1"),
                new Command((byte) 0x31, "Bread\tБ1.50*2"),
                new Command((byte) 0x35, "\tP5.00"),
                new Command((byte) 0x36, "Thank you"),
                Command.of((byte) 0x38),
                Command.of((byte) 0x74));
        assertThat(result.getReceiptInfo().fiscalMemorySerialNumber()).isEqualTo("44123456");
    }

    @Test
    @DisplayName("Should pay in full and close when the receipt has no payments")
    void shouldPayInFullWithoutPayments() {
        // Given
        Receipt receipt = receipt();
        receipt.setItems(List.of(Item.sale("Bread", BigDecimal.ONE, ETaxGroup.TAX_GROUP_1, BigDecimal.ZERO)));
        for (int i = 0; i < 5; i++) {
            channel.answer(islAnswer(""));
        }
        channel.answer(islAnswer("44123456*000011*2020-01-28*15:30:00*1.00"));

        // When
        DeviceStatusWithReceiptInfo result = printer.printReceipt(receipt);

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(channel.getSentOpcodes()).containsExactly(
                (byte) 0x3C, (byte) 0x90, (byte) 0x31, (byte) 0x35, (byte) 0x38, (byte) 0x74);
    }

    @Test
    @DisplayName("Should read the device clock")
    void shouldReadDateTime() {
        // Given
        channel.answer(islAnswer("28-01-20 15:29:00"));

        // When
        DeviceStatusWithDateTime status = printer.getDateTime();

        // Then
        assertThat(status.getDeviceDateTime()).isEqualTo(new LocalDateTime(2020, 1, 28, 15, 29, 0));
    }

    @Test
    @DisplayName("Should read firmware and serial numbers from the diagnostic info")
    void shouldReadDeviceInfo() {
        // Given
        channel.answer(islAnswer("ISL5011 1.00 01Jan20 1200,ABCD,00000000,BG,ED123456,44123456"));

        // When
        DeviceStatus status = printer.readDeviceInfo();

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(printer.getDeviceInfo().getSerialNumber()).isEqualTo("ED123456");
        assertThat(printer.getDeviceInfo().getFiscalMemorySerialNumber()).isEqualTo("44123456");
        assertThat(printer.getDeviceInfo().getFirmwareVersion()).isEqualTo("ISL5011 1.00 01Jan20 1200");
        assertThat(channel.getSentCommands()).containsExactly(new Command((byte) 0x5A, "1"));
    }

    @Test
    @DisplayName("Should split the diagnostic info only on the device field delimiter")
    void shouldSplitDiagnosticInfoOnDeviceDelimiter() {
        // Given
        channel.answer(islAnswer("ISL5011 1.00;01Jan20 1200,ABCD,00000000,BG,ED123456,44123456"));

        // When
        DeviceStatus status = printer.readDeviceInfo();

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(printer.getDeviceInfo().getFirmwareVersion()).isEqualTo("ISL5011 1.00;01Jan20 1200");
        assertThat(printer.getDeviceInfo().getSerialNumber()).isEqualTo("ED123456");
    }

    @Test
    @DisplayName("Should reject diagnostic info with too few fields")
    void shouldRejectShortDiagnosticInfo() {
        // Given
        channel.answer(islAnswer("ISL5011,ABCD"));

        // When
        DeviceStatus status = printer.readDeviceInfo();

        // Then
        assertThat(status.getErrors()).containsExactly(StatusMessage.error("E409", "Wrong number of fields"));
    }

    @Test
    @DisplayName("Should send only the start date of a fiscal report")
    void shouldPrintFiscalReport() {
        // Given
        channel.answer(islAnswer(""));

        // When
        DeviceStatus status = printer.printFiscalReport(
                new FiscalReport(new LocalDate(2024, 5, 16), new LocalDate(2024, 5, 31), EReportType.BRIEF));

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(channel.getSentCommands()).containsExactly(new Command((byte) 0x4F, "1605"));
    }

    @Test
    @DisplayName("Should add context when the fiscal report fails")
    void shouldReportFiscalReportFailure() {
        // Given
        channel.fail("Port closed");

        // When
        DeviceStatus status = printer.printFiscalReport(
                new FiscalReport(new LocalDate(2024, 5, 16), null, null));

        // Then
        assertThat(status.getErrors()).extracting(StatusMessage::code).containsExactly("E101");
        assertThat(status.getMessages()).contains(StatusMessage.info("Error occurred while printing fiscal report"));
    }
}
