package telesim.core.model;

import java.util.Locale;

public enum MessageKind {
    LOG("log"),
    SENSOR_DATA("sensorData");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a kind from its wire name or its enum constant name, ignoring case.
     *
     * @param name The name to resolve
     * @return The matching kind
     * @throws IllegalArgumentException if the name is not part of the closed kind set
     */
    public static MessageKind fromName(String name) {
        if (name != null) {
            for (MessageKind kind : values()) {
                if (kind.wireName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                    return kind;
                }
            }
            // "sensor_data" and "sensor-data" spellings
            String normalized = name.replace("-", "_").toUpperCase(Locale.ROOT);
            for (MessageKind kind : values()) {
                if (kind.name().equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + name);
    }
}
