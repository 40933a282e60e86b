package telesim.core.generator;

import telesim.core.model.LogEntry;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.model.SensorReading;
import telesim.core.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Factories producing the simulated device payloads.
 */
public final class SimulatedMessages {

    public static final String LOG_TEXT = "This is a simulated message.";
    public static final String SENSOR_NAME = "Temp1";
    public static final double SENSOR_MIN = 1.0;
    public static final double SENSOR_MAX = 100.0;

    private SimulatedMessages() {
    }

    /**
     * Log messages with {@code Error} or {@code Info} severity, each with probability one half.
     */
    public static MessageFactory logs(Random random) {
        return (deviceId, firmwareVersion, timestamp) -> {
            Severity severity = random.nextBoolean() ? Severity.ERROR : Severity.INFO;
            return Message.log(deviceId, firmwareVersion, timestamp, new LogEntry(severity, LOG_TEXT));
        };
    }

    /**
     * Single temperature readings drawn uniformly from [1.0, 100.0).
     */
    public static MessageFactory sensorReadings(Random random) {
        return (deviceId, firmwareVersion, timestamp) -> {
            double value = SENSOR_MIN + random.nextDouble() * (SENSOR_MAX - SENSOR_MIN);
            return Message.sensorData(deviceId, firmwareVersion, timestamp, List.of(new SensorReading(SENSOR_NAME, value)));
        };
    }

    /**
     * One factory per message kind, sharing the given random source.
     */
    public static Map<MessageKind, MessageFactory> forAllKinds(Random random) {
        Map<MessageKind, MessageFactory> factories = new EnumMap<>(MessageKind.class);
        factories.put(MessageKind.LOG, logs(random));
        factories.put(MessageKind.SENSOR_DATA, sensorReadings(random));
        return factories;
    }
}
