package fisk.domain.fiscal.codec;

import fisk.domain.fiscal.EErrorKind;
import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EPriceModifierType;
import fisk.domain.fiscal.EReportType;
import fisk.domain.fiscal.EReversalReason;
import fisk.domain.fiscal.ETaxGroup;
import fisk.domain.fiscal.Item;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Tremol ZFP command grammar
 * @since 17/10/2026
 */
class ZfpCommandCodecTest {

    private final ZfpCommandCodec codec = new ZfpCommandCodec();

    @Test
    @DisplayName("Should pad the article name to 36 characters")
    void shouldPadItemText() {
        // Given
        Item item = Item.sale("Bread", new BigDecimal("1.50"), ETaxGroup.TAX_GROUP_2, new BigDecimal("2"));

        // When
        Command command = codec.sell(item, "Б", 34);

        // Then
        assertThat(command.opcode()).isEqualTo((byte) 0x31);
        assertThat(command.payload()).isEqualTo(String.format("%-36s", "Bread") + ";Б;1.50*2");
        assertThat(command.payload().indexOf(';')).isEqualTo(36);
    }

    @Test
    @DisplayName("Should truncate the article name to the device maximum before padding")
    void shouldTruncateItemText() {
        // Given
        String text = "0123456789012345678901234567890123456789";
        Item item = Item.sale(text, new BigDecimal("3"), ETaxGroup.TAX_GROUP_1, BigDecimal.ZERO);

        // When
        Command command = codec.sell(item, "А", 34);

        // Then
        assertThat(command.payload()).isEqualTo(text.substring(0, 34) + "  ;А;3.00");
    }

    @Test
    @DisplayName("Should sell on a department as department plus 0x80 in hex")
    void shouldSellOnDepartment() {
        // Given
        Item item = Item.sale("Coffee", new BigDecimal("2.2"), null, new BigDecimal("1.500"));
        item.setDepartment(1);

        // When
        Command command = codec.sell(item, "", 34);

        // Then
        assertThat(command.opcode()).isEqualTo((byte) 0x34);
        assertThat(command.payload()).endsWith(";81;2.20*1.5");
    }

    @Test
    @DisplayName("Should negate discounts and keep surcharges positive")
    void shouldSignPriceModifiers() {
        // Given
        Item discount = Item.sale("A", BigDecimal.TEN, ETaxGroup.TAX_GROUP_2, BigDecimal.ZERO);
        discount.setPriceModifierType(EPriceModifierType.DISCOUNT_PERCENT);
        discount.setPriceModifierValue(new BigDecimal("10"));
        Item surcharge = Item.sale("B", BigDecimal.TEN, ETaxGroup.TAX_GROUP_2, BigDecimal.ZERO);
        surcharge.setPriceModifierType(EPriceModifierType.SURCHARGE_AMOUNT);
        surcharge.setPriceModifierValue(new BigDecimal("1.5"));

        // When & Then
        assertThat(codec.sell(discount, "Б", 34).payload()).endsWith(";Б;10.00,-10.00");
        assertThat(codec.sell(surcharge, "Б", 34).payload()).endsWith(";Б;10.00:1.50");
    }

    @Test
    @DisplayName("Should format header and payment commands")
    void shouldFormatHeaderCommands() {
        assertThat(codec.openReceipt("DT000001-0001-0000001", "1", "0000").payload())
                .isEqualTo("1;0000;1;1;2$DT000001-0001-0000001");
        assertThat(codec.payment("7", new BigDecimal("12.5")).payload()).isEqualTo("7;1;12.50*");
        assertThat(codec.moneyTransfer("1", "0000", new BigDecimal("-5")).payload()).isEqualTo("1;0000;0;-5.00");
        assertThat(codec.subtotalChangeAmount(new BigDecimal("-0.5")).payload()).isEqualTo("1;0:-0.50");
        assertThat(codec.printDailyReport(true).payload()).isEqualTo("Z");
        assertThat(codec.printDailyReport(false).payload()).isEqualTo("X");
    }

    @Test
    @DisplayName("Should format reversal receipt and date fields")
    void shouldFormatDates() {
        // Given
        LocalDateTime dateTime = new LocalDateTime(2024, 3, 5, 14, 7, 9);

        // When
        Command reversal = codec.openReversalReceipt("1", "0000", "1", "000123", dateTime, "50163145", "USN1");
        Command report = codec.printReportForDate(new LocalDate(2024, 1, 1), new LocalDate(2024, 1, 31),
                EReportType.DETAILED);

        // Then
        assertThat(codec.setDateTime(dateTime).payload()).isEqualTo("05-03-24 14:07:09");
        assertThat(reversal.payload()).isEqualTo("1;0000;1;1;D;1;000123;05-03-24 14:07:09;50163145;USN1");
        assertThat(report.opcode()).isEqualTo((byte) 0x7A);
        assertThat(report.payload()).isEqualTo("010124;310124");
    }

    @Test
    @DisplayName("Should map enums to Tremol tokens")
    void shouldMapTokens() {
        assertThat(codec.getTaxGroupToken(ETaxGroup.TAX_GROUP_1)).contains("А");
        assertThat(codec.getTaxGroupToken(ETaxGroup.TAX_GROUP_8)).contains("З");
        assertThat(codec.getTaxGroupToken(null)).isEmpty();
        assertThat(codec.getReversalReasonToken(EReversalReason.TAX_BASE_REDUCTION)).contains("2");
        assertThat(codec.getDefaultPaymentTypeTokens())
                .containsEntry(EPaymentType.CASH, "0")
                .containsEntry(EPaymentType.RESERVED_2, "10")
                .doesNotContainKey(EPaymentType.CHANGE);
    }

    @Test
    @DisplayName("Should encode payload in windows-1251 after the opcode")
    void shouldEncodeCp1251() {
        // When
        byte[] packet = codec.encode(new Command((byte) 0x31, "Б;1"));

        // Then
        assertThat(packet).containsExactly(0x31, 0xC1, ';', '1');
    }

    @Test
    @DisplayName("Should split the leading status segment from the payload")
    void shouldDecodeResponse() throws ProtocolException {
        // Given
        byte[] packet = {(byte) 0x80, (byte) 0x81, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80,
                '2', '8', '-', '0', '1'};

        // When
        RawResponse response = codec.decode(packet);

        // Then
        assertThat(response.getPayload()).isEqualTo("28-01");
        assertThat(response.getStatusBytes()).hasSize(7);
        assertThat(response.getStatusBytes()[1]).isEqualTo((byte) 0x81);
    }

    @Test
    @DisplayName("Should reject a response shorter than the status segment")
    void shouldRejectShortResponse() {
        assertThatThrownBy(() -> codec.decode(new byte[]{(byte) 0x80, (byte) 0x80}))
                .isInstanceOf(ProtocolException.class)
                .extracting(e -> ((ProtocolException) e).getKind())
                .isEqualTo(EErrorKind.PROTOCOL_SYNTAX_ERROR);
        assertThat(EErrorKind.PROTOCOL_SYNTAX_ERROR.getCode()).isEqualTo("E409");
    }
}
