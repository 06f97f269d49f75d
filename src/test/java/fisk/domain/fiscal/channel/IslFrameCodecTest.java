package fisk.domain.fiscal.channel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Eltrade frame envelope
 * @since 17/10/2026
 */
class IslFrameCodecTest {

    @Test
    @DisplayName("Should wrap a packet with postamble and four nibble checksum")
    void shouldWrapPacket() {
        // Given
        IslFrameCodec codec = new IslFrameCodec();

        // When
        byte[] frame = codec.wrap(new byte[]{0x4A});

        // Then
        assertThat(frame).containsExactly(0x01, 0x24, 0x20, 0x4A, 0x05, 0x30, 0x30, 0x39, 0x33, 0x03);
    }

    @Test
    @DisplayName("Should strip the echoed command byte from an answer")
    void shouldUnwrapAnswer() throws ChannelException {
        // Given
        IslFrameCodec codec = new IslFrameCodec();
        byte[] frame = codec.wrap(new byte[]{0x4A, 'O', 'K', 0x04});

        // When
        byte[] packet = codec.unwrap(frame);

        // Then
        assertThat(packet).containsExactly('O', 'K', 0x04);
    }

    @Test
    @DisplayName("Should reject a frame without postamble")
    void shouldRejectMissingPostamble() {
        // Given
        IslFrameCodec codec = new IslFrameCodec();
        byte[] frame = codec.wrap(new byte[]{0x4A, 'O', 'K'});
        frame[frame.length - 6] = 0x00;

        // When & Then
        assertThatThrownBy(() -> codec.unwrap(frame))
                .isInstanceOf(ChannelException.class)
                .hasMessage("Frame postamble not found");
    }

    @Test
    @DisplayName("Should reject a frame with a wrong checksum")
    void shouldRejectChecksumMismatch() {
        // Given
        IslFrameCodec codec = new IslFrameCodec();
        byte[] frame = codec.wrap(new byte[]{0x4A, 'O', 'K'});
        frame[4] = 'X';

        // When & Then
        assertThatThrownBy(() -> codec.unwrap(frame))
                .isInstanceOf(ChannelException.class)
                .hasMessageContaining("checksum mismatch");
    }
}
