package fisk.domain.fiscal;

import org.joda.time.LocalDateTime;

/**
 * Device status together with the device clock
 * @since 14/10/2026
 */
public class DeviceStatusWithDateTime extends DeviceStatus {
    private LocalDateTime deviceDateTime;

    public DeviceStatusWithDateTime(DeviceStatus status) {
        super(status);
    }

    public LocalDateTime getDeviceDateTime() {
        return deviceDateTime;
    }

    public void setDeviceDateTime(LocalDateTime deviceDateTime) {
        this.deviceDateTime = deviceDateTime;
    }
}
