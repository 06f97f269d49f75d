package fisk.domain.fiscal.status;

import fisk.domain.fiscal.DeviceStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a vendor status byte vector to status messages through a bit table.
 * <p>Bit {@code b} (0 = LSB) of byte {@code i} maps to table entry {@code i * 8 + b}.
 * Bits are scanned from the high bit down, reserved entries are never reported.
 * An optional switch state byte is rendered as a single info line
 * {@code SW7=ON/OFF, ..., SW1=ON/OFF} with its top bit ignored.</p>
 * Instances are immutable and thread safe.
 * @since 15/10/2026
 */
public final class StatusDecoder {
    public static final int NO_SWITCH_STATE_BYTE = -1;

    private final List<StatusBit> table;
    private final int switchStateByte;

    public StatusDecoder(List<StatusBit> table) {
        this(table, NO_SWITCH_STATE_BYTE);
    }

    public StatusDecoder(List<StatusBit> table, int switchStateByte) {
        if (table.size() % 8 != 0) {
            throw new IllegalArgumentException("Status bit table must have 8 entries per byte, got " + table.size());
        }
        this.table = List.copyOf(table);
        this.switchStateByte = switchStateByte;
    }

    public int getByteCount() {
        return table.size() / 8;
    }

    public DeviceStatus decode(byte[] status) {
        DeviceStatus deviceStatus = new DeviceStatus();
        if (status == null) {
            return deviceStatus;
        }
        int byteCount = Math.min(status.length, getByteCount());
        for (int i = 0; i < byteCount; i++) {
            int value = status[i] & 0xFF;
            if (i == switchStateByte) {
                deviceStatus.addInfo(switchStates(value));
                continue;
            }
            for (int bit = 7; bit >= 0; bit--) {
                if ((value & (1 << bit)) != 0) {
                    deviceStatus.addMessage(table.get(i * 8 + bit).toMessage());
                }
            }
        }
        return deviceStatus;
    }

    private static String switchStates(int value) {
        List<String> switches = new ArrayList<>(7);
        for (int bit = 6; bit >= 0; bit--) {
            switches.add(String.format("SW%d=%s", bit + 1, (value & (1 << bit)) != 0 ? "ON" : "OFF"));
        }
        return String.join(", ", switches);
    }
}
