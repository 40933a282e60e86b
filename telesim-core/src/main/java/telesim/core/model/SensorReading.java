package telesim.core.model;

import java.util.Objects;

public record SensorReading(String name, double value) {

    public SensorReading {
        Objects.requireNonNull(name, "name");
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Sensor reading '%s' is not a finite number".formatted(name));
        }
    }
}
