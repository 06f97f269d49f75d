package fisk.domain.fiscal.channel;

import com.fazecast.jSerialComm.SerialPort;
import fisk.common.ELogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serial (COM / USB CDC) channel over jSerialComm
 * @since 15/10/2026
 */
public class SerialChannel implements IChannel {
    private static final Logger logger = LoggerFactory.getLogger(SerialChannel.class);
    private static final Logger wireLogger = ELogger.PROTOCOL.getLogger();

    private final SerialPort serialPort;
    private final IFrameCodec frameCodec;
    private final int readTimeoutMs;
    private final ReentrantLock lock = new ReentrantLock();

    SerialChannel(SerialPort serialPort, IFrameCodec frameCodec, int readTimeoutMs) {
        this.serialPort = serialPort;
        this.frameCodec = frameCodec;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Open the port 8N1 at the given speed
     */
    public static SerialChannel open(String portName, int baudRate, IFrameCodec frameCodec,
                                     int readTimeoutMs, int writeTimeoutMs) throws ChannelException {
        SerialPort port = SerialPort.getCommPort(portName);
        port.setBaudRate(baudRate);
        port.setNumDataBits(8);
        port.setNumStopBits(1);
        port.setParity(SerialPort.NO_PARITY);
        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING | SerialPort.TIMEOUT_WRITE_BLOCKING,
                readTimeoutMs, writeTimeoutMs);
        if (!port.openPort()) {
            throw new ChannelException("Failed to open port: " + portName);
        }
        logger.info("Opened {} at {} baud", portName, baudRate);
        return new SerialChannel(port, frameCodec, readTimeoutMs);
    }

    @Override
    public String getDescriptor() {
        return serialPort.getSystemPortName();
    }

    @Override
    public void send(byte[] packet) throws ChannelException {
        byte[] frame = frameCodec.wrap(packet);
        lock.lock();
        try {
            wireLogger.trace("{} >>> {}", getDescriptor(), hex(frame));
            int written = serialPort.writeBytes(frame, frame.length);
            if (written != frame.length) {
                throw new ChannelException(String.format("Only %d of %d bytes written to %s",
                        Math.max(written, 0), frame.length, getDescriptor()));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] receive() throws ChannelException {
        lock.lock();
        try {
            ByteArrayOutputStream frame = new ByteArrayOutputStream();
            byte[] one = new byte[1];
            boolean started = false;
            long deadline = System.currentTimeMillis() + readTimeoutMs;
            while (System.currentTimeMillis() < deadline) {
                int read = serialPort.readBytes(one, 1);
                if (read < 0) {
                    throw new ChannelException("Read error on " + getDescriptor());
                }
                if (read == 0) {
                    continue;
                }
                if (!started) {
                    // Busy markers and noise before the frame start are skipped
                    if (frameCodec.isFrameStart(one[0])) {
                        started = true;
                        frame.write(one[0]);
                    }
                    continue;
                }
                frame.write(one[0]);
                if (frameCodec.isFrameEnd(one[0])) {
                    byte[] bytes = frame.toByteArray();
                    wireLogger.trace("{} <<< {}", getDescriptor(), hex(bytes));
                    return frameCodec.unwrap(bytes);
                }
            }
            throw new ChannelException("Timeout waiting for response from " + getDescriptor());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (serialPort.isOpen()) {
            serialPort.closePort();
            logger.info("Closed {}", getDescriptor());
        }
    }

    private static String hex(byte[] data) {
        StringBuilder sb = new StringBuilder(data.length * 3);
        for (byte b : data) {
            sb.append(String.format("%02X ", b & 0xFF));
        }
        return sb.toString().trim();
    }
}
