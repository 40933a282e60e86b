package telesim.client.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import telesim.core.model.LogEntry;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.model.SensorReading;
import telesim.core.model.Severity;
import telesim.core.utils.SimUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire representation of a {@link Message}.
 * <p>
 * Encoded form:
 * <pre>
 * {"device_id":"...","firmware_version":"1.0-sim","kind":"log","timestamp":"2024-05-01T10:00:00.000Z",
 *  "log_message":{"severity":"Error","message":"..."}}
 * {"device_id":"...","firmware_version":"1.0-sim","kind":"sensorData","timestamp":"...",
 *  "sensor_data":[{"name":"Temp1","value":42.5}]}
 * </pre>
 * The decoder also accepts the legacy field names {@code device}, {@code firmware} and {@code message_type}.
 */
public class MessageCodec {

    public static final String DEVICE_ID = "device_id";
    public static final String FIRMWARE_VERSION = "firmware_version";
    public static final String KIND = "kind";
    public static final String TIMESTAMP = "timestamp";
    public static final String LOG_MESSAGE = "log_message";
    public static final String SENSOR_DATA = "sensor_data";

    private static final String LEGACY_DEVICE = "device";
    private static final String LEGACY_FIRMWARE = "firmware";
    private static final String LEGACY_KIND = "message_type";

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public String encode(Message message) {
        return gson.toJson(toJson(message));
    }

    public JsonObject toJson(Message message) {
        JsonObject json = new JsonObject();
        json.addProperty(DEVICE_ID, message.deviceId());
        json.addProperty(FIRMWARE_VERSION, message.firmwareVersion());
        json.addProperty(KIND, message.kind().getWireName());
        json.addProperty(TIMESTAMP, SimUtils.formatTimestamp(message.timestamp()));
        if (message.logEntry() != null) {
            JsonObject log = new JsonObject();
            log.addProperty("severity", message.logEntry().severity().getLabel());
            log.addProperty("message", message.logEntry().message());
            json.add(LOG_MESSAGE, log);
        }
        if (message.sensorData() != null) {
            JsonArray readings = new JsonArray();
            for (SensorReading reading : message.sensorData()) {
                JsonObject item = new JsonObject();
                item.addProperty("name", reading.name());
                item.addProperty("value", reading.value());
                readings.add(item);
            }
            json.add(SENSOR_DATA, readings);
        }
        return json;
    }

    /**
     * Parses one JSON document into a message.
     *
     * @throws MalformedMessageException if the text is not JSON or does not describe a valid message
     */
    public Message decode(String text) throws MalformedMessageException {
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new MalformedMessageException("Invalid JSON", e);
        }
        if (!element.isJsonObject()) {
            throw new MalformedMessageException("Expected a JSON object");
        }
        return fromJson(element.getAsJsonObject());
    }

    public Message fromJson(JsonObject json) throws MalformedMessageException {
        try {
            String deviceId = requireString(json, DEVICE_ID, LEGACY_DEVICE);
            String firmware = requireString(json, FIRMWARE_VERSION, LEGACY_FIRMWARE);
            MessageKind kind = MessageKind.fromName(requireString(json, KIND, LEGACY_KIND));
            Instant timestamp = SimUtils.parseTimestamp(requireString(json, TIMESTAMP, TIMESTAMP));

            LogEntry logEntry = null;
            if (json.has(LOG_MESSAGE) && !json.get(LOG_MESSAGE).isJsonNull()) {
                JsonObject log = json.getAsJsonObject(LOG_MESSAGE);
                logEntry = new LogEntry(Severity.fromLabel(requireString(log, "severity", "severity")),
                        requireString(log, "message", "message"));
            }
            List<SensorReading> readings = null;
            if (json.has(SENSOR_DATA) && !json.get(SENSOR_DATA).isJsonNull()) {
                readings = new ArrayList<>();
                for (JsonElement item : json.getAsJsonArray(SENSOR_DATA)) {
                    JsonObject reading = item.getAsJsonObject();
                    if (!reading.has("value")) {
                        throw new MalformedMessageException("Sensor reading without a value");
                    }
                    readings.add(new SensorReading(requireString(reading, "name", "name"), reading.get("value").getAsDouble()));
                }
            }
            return new Message(deviceId, firmware, kind, Message.UNRANKED_PRIORITY, timestamp, logEntry, readings);
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException
                 | ClassCastException | DateTimeParseException e) {
            // Gson signals wrong element types with unchecked exceptions
            throw new MalformedMessageException("Invalid message: " + e.getMessage(), e);
        }
    }

    private static String requireString(JsonObject json, String field, String legacyField) throws MalformedMessageException {
        JsonElement value = json.has(field) ? json.get(field) : json.get(legacyField);
        if (value == null || value.isJsonNull()) {
            throw new MalformedMessageException("Missing field '%s'".formatted(field));
        }
        return value.getAsString();
    }
}
