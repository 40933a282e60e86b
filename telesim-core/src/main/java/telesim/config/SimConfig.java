package telesim.config;

import telesim.core.priority.PriorityPolicies;
import telesim.core.priority.PriorityPolicy;

import java.time.Duration;

/**
 * Configuration template applied to every simulated device of a fleet.
 */
public record SimConfig(Integer deviceCount,
                        Duration logInterval,
                        Duration sensorInterval,
                        Duration writeInterval,
                        Integer bufferCapacity,
                        PriorityPolicy priorityPolicy,
                        String firmwareVersion,
                        Duration startStagger) {

    public static final int DEFAULT_DEVICE_COUNT = 3;
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_BUFFER_CAPACITY = 3;
    public static final String DEFAULT_FIRMWARE_VERSION = "1.0-sim";
    public static final Duration DEFAULT_START_STAGGER = Duration.ofMillis(20);

    public static class Builder {
        private Integer deviceCount = DEFAULT_DEVICE_COUNT;
        private Duration logInterval = DEFAULT_INTERVAL;
        private Duration sensorInterval = DEFAULT_INTERVAL;
        private Duration writeInterval = DEFAULT_INTERVAL;
        private Integer bufferCapacity = DEFAULT_BUFFER_CAPACITY;
        private PriorityPolicy priorityPolicy = PriorityPolicies.logFirst();
        private String firmwareVersion = DEFAULT_FIRMWARE_VERSION;
        private Duration startStagger = DEFAULT_START_STAGGER;

        public Builder DeviceCount(Integer deviceCount) {
            this.deviceCount = deviceCount != null ? deviceCount : DEFAULT_DEVICE_COUNT;
            return this;
        }

        public Builder LogInterval(Duration logInterval) {
            this.logInterval = logInterval != null ? logInterval : DEFAULT_INTERVAL;
            return this;
        }

        public Builder SensorInterval(Duration sensorInterval) {
            this.sensorInterval = sensorInterval != null ? sensorInterval : DEFAULT_INTERVAL;
            return this;
        }

        public Builder WriteInterval(Duration writeInterval) {
            this.writeInterval = writeInterval != null ? writeInterval : DEFAULT_INTERVAL;
            return this;
        }

        public Builder BufferCapacity(Integer bufferCapacity) {
            this.bufferCapacity = bufferCapacity != null ? bufferCapacity : DEFAULT_BUFFER_CAPACITY;
            return this;
        }

        public Builder PriorityPolicy(PriorityPolicy priorityPolicy) {
            this.priorityPolicy = priorityPolicy != null ? priorityPolicy : PriorityPolicies.logFirst();
            return this;
        }

        public Builder FirmwareVersion(String firmwareVersion) {
            this.firmwareVersion = firmwareVersion != null ? firmwareVersion : DEFAULT_FIRMWARE_VERSION;
            return this;
        }

        public Builder StartStagger(Duration startStagger) {
            this.startStagger = startStagger != null ? startStagger : DEFAULT_START_STAGGER;
            return this;
        }

        public SimConfig build() {
            if (deviceCount < 1) {
                throw new IllegalArgumentException("Device count must be greater than 0, got " + deviceCount);
            }
            requirePositive("Log interval", logInterval);
            requirePositive("Sensor interval", sensorInterval);
            requirePositive("Write interval", writeInterval);
            if (bufferCapacity < 0) {
                throw new IllegalArgumentException("Buffer capacity must not be negative, got " + bufferCapacity);
            }
            if (startStagger.isNegative()) {
                throw new IllegalArgumentException("Start stagger must not be negative, got " + startStagger);
            }
            return new SimConfig(deviceCount, logInterval, sensorInterval, writeInterval,
                    bufferCapacity, priorityPolicy, firmwareVersion, startStagger);
        }

        private static void requirePositive(String name, Duration value) {
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be greater than 0, got " + value);
            }
        }
    }
}
