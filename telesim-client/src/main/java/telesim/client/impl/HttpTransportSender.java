package telesim.client.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.client.codec.MessageCodec;
import telesim.core.exceptions.TransportException;
import telesim.core.model.Message;
import telesim.core.transport.TransportSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Posts each message as a JSON document to an HTTP endpoint.
 * Thread-safe; one instance may be shared by every device of a fleet.
 */
public class HttpTransportSender implements TransportSender {
    private static final Logger logger = LoggerFactory.getLogger(HttpTransportSender.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final URI endpoint;
    private final HttpClient client;
    private final MessageCodec codec;
    private final Duration timeout;

    /**
     * Creates a sender for {@code http://host:port/path}.
     */
    public HttpTransportSender(String host, int port, String path) {
        this(URI.create("http://%s:%d%s".formatted(host, port, path.startsWith("/") ? path : "/" + path)),
                new MessageCodec(), DEFAULT_TIMEOUT);
    }

    public HttpTransportSender(URI endpoint, MessageCodec codec, Duration timeout) {
        this.endpoint = endpoint;
        this.codec = codec;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        logger.debug("Created HttpTransportSender for {}", endpoint);
    }

    @Override
    public CompletableFuture<Void> send(Message message) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(codec.encode(message)))
                .build();

        CompletableFuture<Void> outcome = new CompletableFuture<>();
        client.sendAsync(request, HttpResponse.BodyHandlers.ofString()).whenComplete((response, error) -> {
            if (error != null) {
                outcome.completeExceptionally(new TransportException(
                        "Failed to send message without getting a response", error, message.deviceId()));
            } else if (response.statusCode() / 100 != 2) {
                outcome.completeExceptionally(new TransportException(
                        "Failed to send message. Code: %d, Body: %s".formatted(response.statusCode(), response.body()),
                        null, message.deviceId(), response.statusCode()));
            } else {
                logger.debug("Message sent successfully from device {}", message.deviceId());
                outcome.complete(null);
            }
        });
        return outcome;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public void close() {
        logger.debug("HttpTransportSender for {} closed", endpoint);
    }
}
