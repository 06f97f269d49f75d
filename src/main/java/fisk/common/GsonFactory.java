package fisk.common;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.DeviceStatusWithDateTime;
import fisk.domain.fiscal.DeviceStatusWithReceiptInfo;
import fisk.domain.fiscal.ReceiptInfo;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;

import java.io.IOException;

/**
 * Gson instances shared by the REST surface and the options store.
 * Joda dates travel as ISO-8601 text; device statuses carry a derived "ok" flag
 * and the fields of their result shape.
 * @since 15/10/2026
 */
public final class GsonFactory {
    private GsonFactory() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static Gson create() {
        return builder().create();
    }

    public static Gson createPretty() {
        return builder().setPrettyPrinting().create();
    }

    private static GsonBuilder builder() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter().nullSafe())
                .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
                .registerTypeHierarchyAdapter(DeviceStatus.class, deviceStatusSerializer());
    }

    private static JsonSerializer<DeviceStatus> deviceStatusSerializer() {
        return (status, type, context) -> {
            JsonObject json = new JsonObject();
            json.addProperty("ok", status.isOk());
            json.add("messages", context.serialize(status.getMessages()));
            if (status instanceof DeviceStatusWithDateTime) {
                LocalDateTime dateTime = ((DeviceStatusWithDateTime) status).getDeviceDateTime();
                json.add("deviceDateTime", context.serialize(dateTime, LocalDateTime.class));
            }
            if (status instanceof DeviceStatusWithReceiptInfo) {
                ReceiptInfo info = ((DeviceStatusWithReceiptInfo) status).getReceiptInfo();
                JsonElement receipt = context.serialize(info == null ? ReceiptInfo.empty() : info);
                for (var entry : receipt.getAsJsonObject().entrySet()) {
                    json.add(entry.getKey(), entry.getValue());
                }
            }
            return json;
        };
    }

    static class LocalDateTimeAdapter extends TypeAdapter<LocalDateTime> {
        @Override
        public void write(JsonWriter out, LocalDateTime value) throws IOException {
            out.value(value.toString("yyyy-MM-dd'T'HH:mm:ss"));
        }

        @Override
        public LocalDateTime read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return LocalDateTime.parse(in.nextString());
        }
    }

    static class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return LocalDate.parse(in.nextString());
        }
    }
}
