package telesim.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One telemetry or log event emitted by a simulated device.
 * <p>
 * The payload is kind-specific: a {@code LOG} message carries a {@link LogEntry} and no sensor
 * data, a {@code SENSOR_DATA} message carries at least one {@link SensorReading} and no log entry.
 * Construction fails with {@link IllegalArgumentException} when the payload does not match the kind.
 */
public record Message(
                String deviceId,
                String firmwareVersion,
                MessageKind kind,
                int priority,
                Instant timestamp,
                LogEntry logEntry,
                List<SensorReading> sensorData) {

    /**
     * Priority given to messages that have not been ranked by a policy yet
     */
    public static final int UNRANKED_PRIORITY = 0;

    public Message {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(firmwareVersion, "firmwareVersion");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        switch (kind) {
            case LOG -> {
                if (logEntry == null || sensorData != null) {
                    throw new IllegalArgumentException("A log message needs a log entry and no sensor data");
                }
            }
            case SENSOR_DATA -> {
                if (sensorData == null || sensorData.isEmpty() || logEntry != null) {
                    throw new IllegalArgumentException("A sensor message needs at least one reading and no log entry");
                }
            }
        }
        sensorData = sensorData != null ? List.copyOf(sensorData) : null;
    }

    /**
     * Creates an unranked log message
     */
    public static Message log(String deviceId, String firmwareVersion, Instant timestamp, LogEntry entry) {
        return new Message(deviceId, firmwareVersion, MessageKind.LOG, UNRANKED_PRIORITY, timestamp, entry, null);
    }

    /**
     * Creates an unranked sensor data message
     */
    public static Message sensorData(String deviceId, String firmwareVersion, Instant timestamp,
                                     List<SensorReading> readings) {
        return new Message(deviceId, firmwareVersion, MessageKind.SENSOR_DATA, UNRANKED_PRIORITY, timestamp, null, readings);
    }

    /**
     * Returns a copy of this message carrying the given priority.
     */
    public Message withPriority(int newPriority) {
        if (newPriority == priority) {
            return this;
        }
        return new Message(deviceId, firmwareVersion, kind, newPriority, timestamp, logEntry, sensorData);
    }
};
