package fisk.domain.fiscal.driver;

import fisk.domain.fiscal.DeviceStatus;

/**
 * Answer text of one request together with its decoded status
 * @since 15/10/2026
 */
public record DeviceResponse(String payload, DeviceStatus status) {

    public DeviceResponse {
        if (payload == null) {
            payload = "";
        }
    }

    public static DeviceResponse failed(DeviceStatus status) {
        return new DeviceResponse("", status);
    }

    public boolean isOk() {
        return status.isOk();
    }
}
