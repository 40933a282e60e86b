package telesim.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link MessageKind} and {@link Severity}.
 */
public class MessageKindTest {

    @Test
    public void testFromName() {
        assertEquals(MessageKind.LOG, MessageKind.fromName("log"));
        assertEquals(MessageKind.LOG, MessageKind.fromName("Log"));
        assertEquals(MessageKind.SENSOR_DATA, MessageKind.fromName("sensorData"));
        assertEquals(MessageKind.SENSOR_DATA, MessageKind.fromName("SensorData"));
        assertEquals(MessageKind.SENSOR_DATA, MessageKind.fromName("sensor_data"));
        assertEquals(MessageKind.SENSOR_DATA, MessageKind.fromName("sensor-data"));
    }

    @Test
    public void testFromNameRejectsUnknownKinds() {
        assertThrows(IllegalArgumentException.class, () -> MessageKind.fromName("metric"));
        assertThrows(IllegalArgumentException.class, () -> MessageKind.fromName(null));
    }

    @Test
    public void testSeverityLabels() {
        assertEquals("Error", Severity.ERROR.getLabel());
        assertEquals(Severity.ERROR, Severity.fromLabel("Error"));
        assertEquals(Severity.DEBUG, Severity.fromLabel("debug"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromLabel("Fatal"));
    }
}
