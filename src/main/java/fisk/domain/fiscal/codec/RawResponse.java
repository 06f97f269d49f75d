package fisk.domain.fiscal.codec;

import java.util.Arrays;

/**
 * Decoded device answer: payload text and the fixed length status segment
 * @since 15/10/2026
 */
public final class RawResponse {
    private final String payload;
    private final byte[] statusBytes;

    public RawResponse(String payload, byte[] statusBytes) {
        this.payload = payload == null ? "" : payload;
        this.statusBytes = statusBytes == null ? new byte[0] : statusBytes.clone();
    }

    public String getPayload() {
        return payload;
    }

    public byte[] getStatusBytes() {
        return statusBytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawResponse that = (RawResponse) o;
        return payload.equals(that.payload) && Arrays.equals(statusBytes, that.statusBytes);
    }

    @Override
    public int hashCode() {
        return 31 * payload.hashCode() + Arrays.hashCode(statusBytes);
    }

    @Override
    public String toString() {
        StringBuilder hex = new StringBuilder();
        for (byte b : statusBytes) {
            hex.append(String.format("%02X", b & 0xFF));
        }
        return String.format("RawResponse{payload='%s', status=%s}", payload, hex);
    }
}
