package fisk.domain.fiscal.channel;

/**
 * Transport envelope of a protocol packet
 * @since 15/10/2026
 */
public interface IFrameCodec {
    byte[] wrap(byte[] packet);

    boolean isFrameStart(byte b);

    boolean isFrameEnd(byte b);

    /**
     * @param frame complete frame from start to end marker
     * @return the packet carried by the frame
     */
    byte[] unwrap(byte[] frame) throws ChannelException;
}
