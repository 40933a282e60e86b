package telesim.client.impl;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import telesim.client.codec.MessageCodec;
import telesim.client.server.TelemetryServer;
import telesim.core.exceptions.TransportException;
import telesim.core.model.LogEntry;
import telesim.core.model.Message;
import telesim.core.model.SensorReading;
import telesim.core.model.Severity;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link HttpTransportSender}.
 */
public class HttpTransportSenderTest {

    private static final Instant TIME = Instant.parse("2024-05-01T10:00:00Z");

    private TelemetryServer server;
    private HttpTransportSender sender;

    @BeforeEach
    public void setUp() throws IOException {
        server = new TelemetryServer(0);
        server.start();
        sender = new HttpTransportSender("localhost", server.getPort(), "/");
    }

    @AfterEach
    public void tearDown() {
        sender.close();
        server.stop();
    }

    @Test
    public void testEndpoint() {
        assertEquals(URI.create("http://localhost:" + server.getPort() + "/"), sender.getEndpoint());
        HttpTransportSender withPath = new HttpTransportSender("example.org", 9000, "ingest");
        assertEquals(URI.create("http://example.org:9000/ingest"), withPath.getEndpoint());
    }

    @Test
    public void testSendSucceeds() throws Exception {
        Message log = Message.log("dev-1", "1.0-sim", TIME, new LogEntry(Severity.INFO, "hello"));
        Message sensor = Message.sensorData("dev-1", "1.0-sim", TIME, List.of(new SensorReading("Temp1", 20.0)));

        sender.send(log).get(5, TimeUnit.SECONDS);
        sender.send(sensor).get(5, TimeUnit.SECONDS);

        assertEquals(2, server.getAcceptedCount());
    }

    @Test
    public void testRejectionCarriesStatusCode() {
        // A codec that drops the kind produces documents the server refuses
        MessageCodec broken = new MessageCodec() {
            @Override
            public String encode(Message message) {
                JsonObject json = toJson(message);
                json.remove(KIND);
                return json.toString();
            }
        };
        HttpTransportSender rejecting = new HttpTransportSender(sender.getEndpoint(), broken, Duration.ofSeconds(5));
        Message log = Message.log("dev-2", "1.0-sim", TIME, new LogEntry(Severity.ERROR, "bad"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> rejecting.send(log).get(5, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, e.getCause());
        assertEquals(400, cause.getStatusCode());
        assertEquals("dev-2", cause.getContext());
        assertEquals(1, server.getRejectedCount());
    }

    @Test
    public void testUnreachableServer() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        HttpTransportSender unreachable = new HttpTransportSender(URI.create("http://localhost:" + freePort + "/"),
                new MessageCodec(), Duration.ofSeconds(2));
        Message log = Message.log("dev-3", "1.0-sim", TIME, new LogEntry(Severity.INFO, "lost"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> unreachable.send(log).get(10, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, e.getCause());
        assertEquals(-1, cause.getStatusCode());
        assertNotNull(cause.getCause());
    }
}
