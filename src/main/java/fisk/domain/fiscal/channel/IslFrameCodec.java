package fisk.domain.fiscal.channel;

import java.util.Arrays;

/**
 * ISL frame: {@code 01 LEN SEQ <packet> 05 BCC[4] 03}.
 * <p>LEN counts LEN, SEQ, the packet and the postamble plus 0x20. BCC is the
 * sum of LEN up to the postamble sent as four nibbles offset by 0x30.
 * Answers echo the command byte first, it is stripped from the returned packet.
 * SYN bytes sent while the device is busy are skipped.</p>
 * @since 15/10/2026
 */
public class IslFrameCodec implements IFrameCodec {
    static final byte PREAMBLE = 0x01;
    static final byte POSTAMBLE = 0x05;
    static final byte TERMINATOR = 0x03;
    private static final int HEADER = 3;
    private static final int TRAILER = 6;

    private int sequence = 0x20;

    @Override
    public synchronized byte[] wrap(byte[] packet) {
        byte[] frame = new byte[packet.length + HEADER + TRAILER];
        frame[0] = PREAMBLE;
        frame[1] = (byte) (packet.length + 3 + 0x20);
        frame[2] = (byte) nextSequence();
        System.arraycopy(packet, 0, frame, HEADER, packet.length);
        int postamble = HEADER + packet.length;
        frame[postamble] = POSTAMBLE;
        int bcc = bcc(frame, 1, postamble + 1);
        for (int i = 0; i < 4; i++) {
            frame[postamble + 1 + i] = (byte) (((bcc >> (12 - 4 * i)) & 0x0F) + 0x30);
        }
        frame[frame.length - 1] = TERMINATOR;
        return frame;
    }

    @Override
    public boolean isFrameStart(byte b) {
        return b == PREAMBLE;
    }

    @Override
    public boolean isFrameEnd(byte b) {
        return b == TERMINATOR;
    }

    @Override
    public byte[] unwrap(byte[] frame) throws ChannelException {
        if (frame.length < HEADER + TRAILER + 1) {
            throw new ChannelException("Frame too short: " + frame.length + " bytes");
        }
        int postamble = frame.length - TRAILER;
        if (frame[postamble] != POSTAMBLE) {
            throw new ChannelException("Frame postamble not found");
        }
        int expected = bcc(frame, 1, postamble + 1);
        int received = 0;
        for (int i = 0; i < 4; i++) {
            received = (received << 4) | ((frame[postamble + 1 + i] - 0x30) & 0x0F);
        }
        if (expected != received) {
            throw new ChannelException(String.format("Frame checksum mismatch: expected %04X, received %04X",
                    expected, received));
        }
        // Skip LEN, SEQ and the echoed command byte
        return Arrays.copyOfRange(frame, HEADER + 1, postamble);
    }

    private int nextSequence() {
        int current = sequence;
        sequence = sequence >= 0x7F ? 0x20 : sequence + 1;
        return current;
    }

    private static int bcc(byte[] data, int from, int to) {
        int sum = 0;
        for (int i = from; i < to; i++) {
            sum += data[i] & 0xFF;
        }
        return sum & 0xFFFF;
    }
}
