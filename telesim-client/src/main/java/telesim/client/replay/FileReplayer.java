package telesim.client.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.client.codec.MalformedMessageException;
import telesim.client.codec.MessageCodec;
import telesim.core.model.Message;
import telesim.core.transport.TransportSender;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * Sends pre-recorded messages from a newline-delimited JSON file, one per interval.
 * Lines that do not parse are logged and skipped; failed sends are logged and not retried.
 */
public class FileReplayer {
    private static final Logger logger = LoggerFactory.getLogger(FileReplayer.class);

    private final TransportSender transport;
    private final MessageCodec codec;
    private final Duration interval;

    public FileReplayer(TransportSender transport, MessageCodec codec, Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Replay interval must not be negative: " + interval);
        }
        this.transport = transport;
        this.codec = codec;
        this.interval = interval;
    }

    /**
     * Replays the file line by line, waiting for each send to finish before pausing for the interval.
     *
     * @throws IOException if the file cannot be read
     * @throws InterruptedException if interrupted while pausing between messages
     */
    public ReplaySummary replay(Path file) throws IOException, InterruptedException {
        int sent = 0;
        int failed = 0;
        int skipped = 0;
        int lineNumber = 0;
        boolean first = true;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Message message;
                try {
                    message = codec.decode(line);
                } catch (MalformedMessageException e) {
                    logger.error("Error parsing line {}: {}", lineNumber, e.getMessage());
                    skipped++;
                    continue;
                }

                if (!first && !interval.isZero()) {
                    Thread.sleep(interval.toMillis());
                }
                first = false;

                try {
                    transport.send(message).join();
                    logger.info("Message sent successfully (line {})", lineNumber);
                    sent++;
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Failed to send message from line {}: {}", lineNumber, cause.getMessage());
                    failed++;
                }
            }
        }
        logger.info("Replay of {} finished: {} sent, {} failed, {} skipped", file, sent, failed, skipped);
        return new ReplaySummary(sent, failed, skipped);
    }
}
