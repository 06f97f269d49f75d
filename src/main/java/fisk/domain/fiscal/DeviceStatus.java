package fisk.domain.fiscal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Status of a device operation. The status is ok as long as no message
 * of type {@link EStatusMessageType#ERROR} has been added.
 * @since 14/10/2026
 */
public class DeviceStatus {
    private final List<StatusMessage> messages = new ArrayList<>();

    public DeviceStatus() {
    }

    public DeviceStatus(DeviceStatus other) {
        this.messages.addAll(other.messages);
    }

    public static DeviceStatus ofError(EErrorKind kind, String text) {
        DeviceStatus status = new DeviceStatus();
        status.addError(kind, text);
        return status;
    }

    public boolean isOk() {
        for (StatusMessage message : messages) {
            if (message.type() == EStatusMessageType.ERROR) {
                return false;
            }
        }
        return true;
    }

    public void addMessage(StatusMessage message) {
        if (message.type() == EStatusMessageType.RESERVED) {
            return;
        }
        messages.add(message);
    }

    public void addInfo(String text) {
        messages.add(StatusMessage.info(text));
    }

    public void addWarning(String code, String text) {
        messages.add(StatusMessage.warning(code, text));
    }

    public void addError(String code, String text) {
        messages.add(StatusMessage.error(code, text));
    }

    public void addError(EErrorKind kind, String text) {
        addError(kind.getCode(), text);
    }

    public void addAll(DeviceStatus other) {
        messages.addAll(other.messages);
    }

    public List<StatusMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<StatusMessage> getErrors() {
        return messages.stream().filter(m -> m.type() == EStatusMessageType.ERROR).toList();
    }

    public boolean hasWarnings() {
        return messages.stream().anyMatch(m -> m.type() == EStatusMessageType.WARNING);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return messages.equals(((DeviceStatus) o).messages);
    }

    @Override
    public int hashCode() {
        return messages.hashCode();
    }

    @Override
    public String toString() {
        return String.format("DeviceStatus{ok=%s, messages=%s}", isOk(), messages);
    }
}
