package telesim.core.priority;

import org.junit.jupiter.api.Test;
import telesim.core.model.LogEntry;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.model.SensorReading;
import telesim.core.model.Severity;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link PriorityPolicies} and the policies it creates.
 */
public class PriorityPoliciesTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final Message errorLog = Message.log("d", "f", NOW, new LogEntry(Severity.ERROR, "boom"));
    private final Message infoLog = Message.log("d", "f", NOW, new LogEntry(Severity.INFO, "ok"));
    private final Message sensor = Message.sensorData("d", "f", NOW, List.of(new SensorReading("Temp1", 20.0)));

    @Test
    public void testLogFirst() {
        PriorityPolicy policy = PriorityPolicies.logFirst();

        assertTrue(policy.priorityOf(infoLog) > policy.priorityOf(sensor));
        assertEquals(policy.priorityOf(errorLog), policy.priorityOf(infoLog));
        assertEquals("log>sensorData", policy.describe());
    }

    @Test
    public void testSensorFirst() {
        PriorityPolicy policy = PriorityPolicies.sensorFirst();

        assertTrue(policy.priorityOf(sensor) > policy.priorityOf(errorLog));
    }

    @Test
    public void testErrorsFirst() {
        PriorityPolicy policy = PriorityPolicies.errorsFirst();

        assertTrue(policy.priorityOf(errorLog) > policy.priorityOf(sensor));
        assertTrue(policy.priorityOf(sensor) > policy.priorityOf(infoLog));
    }

    @Test
    public void testRankCopiesThePriority() {
        PriorityPolicy policy = PriorityPolicies.logFirst();
        Message ranked = policy.rank(infoLog);

        assertEquals(policy.priorityOf(infoLog), ranked.priority());
        assertEquals(Message.UNRANKED_PRIORITY, infoLog.priority());
    }

    @Test
    public void testParse() {
        assertEquals("log>sensorData", PriorityPolicies.parse("log>sensorData").describe());
        assertEquals("sensorData>log", PriorityPolicies.parse(" SensorData > Log ").describe());
        assertEquals("errors-first", PriorityPolicies.parse("errors-first").describe());
        assertInstanceOf(ErrorsFirstPolicy.class, PriorityPolicies.parse("ERRORS-FIRST"));
    }

    @Test
    public void testParseRejectsIncompleteOrders() {
        assertThrows(IllegalArgumentException.class, () -> PriorityPolicies.parse("log"));
        assertThrows(IllegalArgumentException.class, () -> PriorityPolicies.parse("log>log"));
        assertThrows(IllegalArgumentException.class, () -> PriorityPolicies.parse("log>sensorData>log"));
        assertThrows(IllegalArgumentException.class, () -> PriorityPolicies.parse("log>metrics"));
        assertThrows(IllegalArgumentException.class, () -> PriorityPolicies.parse(""));
    }

    @Test
    public void testKindOrderPolicyRejectsMissingKinds() {
        assertThrows(IllegalArgumentException.class, () -> new KindOrderPolicy(List.of(MessageKind.LOG)));
        assertThrows(IllegalArgumentException.class, () -> new KindOrderPolicy(List.of()));
    }
}
