package fisk.domain.fiscal.channel;

import java.util.Arrays;

/**
 * Tremol frame: {@code STX LEN NBL <packet> CS1 CS2 ETX}.
 * <p>LEN counts LEN, NBL and the packet plus 0x20, NBL is a rolling sequence
 * number, the checksum is the XOR of LEN up to the end of the packet sent as
 * two nibbles offset by 0x30.</p>
 * @since 15/10/2026
 */
public class ZfpFrameCodec implements IFrameCodec {
    static final byte STX = 0x02;
    static final byte ACK = 0x06;
    static final byte ETX = 0x0A;
    private static final int HEADER = 3;
    private static final int TRAILER = 3;

    private int sequence = 0x20;

    @Override
    public synchronized byte[] wrap(byte[] packet) {
        byte[] frame = new byte[packet.length + HEADER + TRAILER];
        frame[0] = STX;
        frame[1] = (byte) (packet.length + 2 + 0x20);
        frame[2] = (byte) nextSequence();
        System.arraycopy(packet, 0, frame, HEADER, packet.length);
        int checksum = checksum(frame, 1, HEADER + packet.length);
        frame[frame.length - 3] = (byte) (((checksum >> 4) & 0x0F) + 0x30);
        frame[frame.length - 2] = (byte) ((checksum & 0x0F) + 0x30);
        frame[frame.length - 1] = ETX;
        return frame;
    }

    @Override
    public boolean isFrameStart(byte b) {
        return b == STX || b == ACK;
    }

    @Override
    public boolean isFrameEnd(byte b) {
        return b == ETX;
    }

    @Override
    public byte[] unwrap(byte[] frame) throws ChannelException {
        if (frame.length < HEADER + TRAILER) {
            throw new ChannelException("Frame too short: " + frame.length + " bytes");
        }
        int end = frame.length - TRAILER;
        int checksum = checksum(frame, 1, end);
        int received = ((frame[end] - 0x30) << 4) | (frame[end + 1] - 0x30);
        if ((checksum & 0xFF) != (received & 0xFF)) {
            throw new ChannelException(String.format("Frame checksum mismatch: expected %02X, received %02X",
                    checksum, received & 0xFF));
        }
        return Arrays.copyOfRange(frame, HEADER, end);
    }

    private int nextSequence() {
        int current = sequence;
        sequence = sequence >= 0xFF ? 0x20 : sequence + 1;
        return current;
    }

    private static int checksum(byte[] data, int from, int to) {
        int cs = 0;
        for (int i = from; i < to; i++) {
            cs ^= data[i] & 0xFF;
        }
        return cs;
    }
}
