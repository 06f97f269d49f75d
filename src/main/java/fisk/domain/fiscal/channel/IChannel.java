package fisk.domain.fiscal.channel;

/**
 * Byte transport to one device. Implementations own framing and checksums,
 * callers see only protocol packets.
 * @since 15/10/2026
 */
public interface IChannel extends AutoCloseable {
    String getDescriptor();
    void send(byte[] packet) throws ChannelException;
    byte[] receive() throws ChannelException;

    @Override
    void close();
}
