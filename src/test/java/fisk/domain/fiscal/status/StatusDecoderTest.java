package fisk.domain.fiscal.status;

import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.EStatusMessageType;
import fisk.domain.fiscal.StatusMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for StatusDecoder with the Tremol and Eltrade bit tables
 * @since 17/10/2026
 */
class StatusDecoderTest {

    private static byte[] zfpStatus() {
        return new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80};
    }

    @Test
    @DisplayName("Should report no messages when only reserved bits are set")
    void shouldIgnoreReservedBits() {
        // Given
        StatusDecoder decoder = ZfpStatusBits.decoder();

        // When
        DeviceStatus status = decoder.decode(zfpStatus());

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(status.getMessages()).isEmpty();
    }

    @Test
    @DisplayName("Should map bit 0 of byte 1 to the no paper error")
    void shouldDecodeNoPaper() {
        // Given
        byte[] bytes = zfpStatus();
        bytes[1] |= 0x01;

        // When
        DeviceStatus status = ZfpStatusBits.decoder().decode(bytes);

        // Then
        assertThat(status.isOk()).isFalse();
        assertThat(status.getErrors())
                .containsExactly(new StatusMessage(EStatusMessageType.ERROR, "E301", "No paper"));
    }

    @Test
    @DisplayName("Should scan each byte from the high bit down")
    void shouldScanHighBitFirst() {
        // Given
        byte[] bytes = zfpStatus();
        bytes[0] |= 0x09;

        // When
        DeviceStatus status = ZfpStatusBits.decoder().decode(bytes);

        // Then
        assertThat(status.getMessages())
                .extracting(StatusMessage::text)
                .containsExactly("Date and time not set", "FM read only");
    }

    @Test
    @DisplayName("Should keep warnings and info without failing the status")
    void shouldKeepWarningsOk() {
        // Given
        byte[] bytes = zfpStatus();
        bytes[6] |= 0x10;
        bytes[2] |= 0x02;

        // When
        DeviceStatus status = ZfpStatusBits.decoder().decode(bytes);

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(status.hasWarnings()).isTrue();
        assertThat(status.getMessages())
                .extracting(StatusMessage::type)
                .containsExactly(EStatusMessageType.INFO, EStatusMessageType.WARNING);
    }

    @Test
    @DisplayName("Should give equal results for equal input")
    void shouldBePure() {
        // Given
        StatusDecoder decoder = ZfpStatusBits.decoder();
        byte[] bytes = zfpStatus();
        bytes[0] |= 0x7F;
        bytes[5] |= 0x41;

        // When
        DeviceStatus first = decoder.decode(bytes);
        DeviceStatus second = decoder.decode(bytes.clone());

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(bytes[0]).isEqualTo((byte) 0xFF);
    }

    @Test
    @DisplayName("Should render the Eltrade switch byte as one info line")
    void shouldRenderSwitchStates() {
        // Given
        byte[] bytes = {0, 0, 0, (byte) 0x85, 0, 0};

        // When
        DeviceStatus status = IslStatusBits.decoder().decode(bytes);

        // Then
        assertThat(status.isOk()).isTrue();
        assertThat(status.getMessages())
                .containsExactly(StatusMessage.info("SW7=OFF, SW6=OFF, SW5=OFF, SW4=OFF, SW3=ON, SW2=OFF, SW1=ON"));
    }

    @Test
    @DisplayName("Should decode Eltrade fiscal receipt opened flag as info")
    void shouldDecodeIslReceiptOpened() {
        // Given
        byte[] bytes = {0, 0, 0x08, 0, 0, 0x20};

        // When
        DeviceStatus status = IslStatusBits.decoder().decode(bytes);

        // Then
        assertThat(status.getMessages())
                .extracting(StatusMessage::text)
                .contains("A fiscal receipt is opened", "Fiscal memory read error");
        assertThat(status.getErrors()).extracting(StatusMessage::code).containsExactly("E203");
    }

    @Test
    @DisplayName("Should expose one byte per eight table entries")
    void shouldCountStatusBytes() {
        assertThat(ZfpStatusBits.decoder().getByteCount()).isEqualTo(7);
        assertThat(IslStatusBits.decoder().getByteCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should reject a table that does not cover whole bytes")
    void shouldRejectPartialTable() {
        // Given
        List<StatusBit> table = Collections.nCopies(7, StatusBit.RESERVED);

        // When & Then
        assertThatThrownBy(() -> new StatusDecoder(table))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("8 entries per byte");
    }
}
