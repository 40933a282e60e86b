package telesim.client.replay;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import telesim.client.codec.MessageCodec;
import telesim.core.exceptions.TransportException;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.transport.TransportSender;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link FileReplayer}.
 */
public class FileReplayerTest {

    private static final String LOG_LINE = "{\"device_id\":\"dev-1\",\"firmware_version\":\"1.0-sim\",\"kind\":\"log\","
            + "\"timestamp\":\"2024-05-01T10:00:00.000Z\",\"log_message\":{\"severity\":\"Info\",\"message\":\"one\"}}";
    private static final String SENSOR_LINE = "{\"device_id\":\"dev-2\",\"firmware_version\":\"1.0-sim\",\"kind\":\"sensorData\","
            + "\"timestamp\":\"2024-05-01T10:00:01.000Z\",\"sensor_data\":[{\"name\":\"Temp1\",\"value\":21.5}]}";

    @TempDir
    Path tempDir;

    /** Collects messages and fails those of devices listed as unreachable. */
    private static class CollectingTransport implements TransportSender {
        private final List<Message> sent = new CopyOnWriteArrayList<>();
        private final List<String> unreachable;

        CollectingTransport(String... unreachable) {
            this.unreachable = List.of(unreachable);
        }

        @Override
        public CompletableFuture<Void> send(Message message) {
            if (unreachable.contains(message.deviceId())) {
                return CompletableFuture.failedFuture(new TransportException("unreachable", null, message.deviceId()));
            }
            sent.add(message);
            return CompletableFuture.completedFuture(null);
        }
    }

    private Path write(String... lines) throws IOException {
        Path file = tempDir.resolve("messages.ndjson");
        Files.write(file, List.of(lines));
        return file;
    }

    @Test
    public void testReplaysEveryLineInOrder() throws IOException, InterruptedException {
        CollectingTransport transport = new CollectingTransport();
        FileReplayer replayer = new FileReplayer(transport, new MessageCodec(), Duration.ZERO);

        ReplaySummary summary = replayer.replay(write(LOG_LINE, "", SENSOR_LINE));

        assertEquals(2, summary.sent());
        assertEquals(0, summary.failed());
        assertEquals(0, summary.skipped());
        assertEquals(List.of(MessageKind.LOG, MessageKind.SENSOR_DATA), transport.sent.stream().map(Message::kind).toList());
        assertEquals("dev-1", transport.sent.get(0).deviceId());
    }

    @Test
    public void testSkipsUnparsableLines() throws IOException, InterruptedException {
        CollectingTransport transport = new CollectingTransport();
        FileReplayer replayer = new FileReplayer(transport, new MessageCodec(), Duration.ZERO);

        ReplaySummary summary = replayer.replay(write("not json", LOG_LINE, "{\"kind\":\"log\"}", SENSOR_LINE));

        assertEquals(2, summary.sent());
        assertEquals(2, summary.skipped());
        assertEquals(4, summary.total());
    }

    @Test
    public void testCountsFailedSendsWithoutStopping() throws IOException, InterruptedException {
        CollectingTransport transport = new CollectingTransport("dev-1");
        FileReplayer replayer = new FileReplayer(transport, new MessageCodec(), Duration.ZERO);

        ReplaySummary summary = replayer.replay(write(LOG_LINE, SENSOR_LINE, LOG_LINE));

        assertEquals(1, summary.sent());
        assertEquals(2, summary.failed());
        assertEquals("dev-2", transport.sent.get(0).deviceId());
    }

    @Test
    public void testWaitsBetweenMessages() throws IOException, InterruptedException {
        CollectingTransport transport = new CollectingTransport();
        FileReplayer replayer = new FileReplayer(transport, new MessageCodec(), Duration.ofMillis(60));

        long start = System.nanoTime();
        replayer.replay(write(LOG_LINE, SENSOR_LINE, LOG_LINE));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        // Two pauses for three messages
        assertTrue(elapsedMillis >= 120, "replay took only " + elapsedMillis + "ms");
        assertEquals(3, transport.sent.size());
    }

    @Test
    public void testMissingFile() {
        FileReplayer replayer = new FileReplayer(new CollectingTransport(), new MessageCodec(), Duration.ZERO);

        assertThrows(IOException.class, () -> replayer.replay(tempDir.resolve("absent.ndjson")));
    }

    @Test
    public void testNegativeInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileReplayer(new CollectingTransport(), new MessageCodec(), Duration.ofMillis(-1)));
    }
}
