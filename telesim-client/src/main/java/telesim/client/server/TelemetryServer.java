package telesim.client.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.client.codec.MalformedMessageException;
import telesim.client.codec.MessageCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Collecting server for device messages.
 * <p>
 * Every {@code POST} body must be a message as understood by {@link MessageCodec}. Accepted
 * documents are stamped with {@code received_at} and logged; the reply is {@code {"status":"success"}}.
 * Anything else is answered with 400 and {@code {"status":"fail","message":...}}.
 */
public class TelemetryServer {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryServer.class);
    private static final Logger received = LoggerFactory.getLogger("telesim.received");

    private static final int HTTP_OK = 200;
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_METHOD_NOT_ALLOWED = 405;

    private final int requestedPort;
    private final MessageCodec codec = new MessageCodec();
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    private final AtomicLong acceptedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final Consumer<JsonObject> onAccepted;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param port The port to listen on, 0 picks a free one
     */
    public TelemetryServer(int port) {
        this(port, document -> { });
    }

    /**
     * @param port The port to listen on, 0 picks a free one
     * @param onAccepted Called with every accepted document, after {@code received_at} was added
     */
    public TelemetryServer(int port, Consumer<JsonObject> onAccepted) {
        this.requestedPort = port;
        this.onAccepted = onAccepted;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        server = HttpServer.create(new InetSocketAddress(requestedPort), 0);
        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
        logger.info("Starting telemetry server on port {}...", getPort());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdownNow();
            server = null;
            logger.info("Telemetry server stopped ({} accepted, {} rejected)", acceptedCount.get(), rejectedCount.get());
        }
    }

    public synchronized int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    public long getAcceptedCount() {
        return acceptedCount.get();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().add("Allow", "POST");
                reply(exchange, HTTP_METHOD_NOT_ALLOWED, failure("Method not allowed"));
                return;
            }
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }

            JsonObject document;
            try {
                JsonElement element = JsonParser.parseString(body);
                if (!element.isJsonObject()) {
                    throw new MalformedMessageException("Invalid JSON");
                }
                document = element.getAsJsonObject();
                codec.fromJson(document);
            } catch (JsonParseException e) {
                rejectedCount.incrementAndGet();
                reply(exchange, HTTP_BAD_REQUEST, failure("Invalid JSON"));
                return;
            } catch (MalformedMessageException e) {
                rejectedCount.incrementAndGet();
                logger.debug("Rejected message: {}", e.getMessage());
                reply(exchange, HTTP_BAD_REQUEST, failure(e.getMessage()));
                return;
            }

            document.addProperty("received_at", Instant.now().toString());
            received.info(gson.toJson(document));
            acceptedCount.incrementAndGet();
            onAccepted.accept(document);

            JsonObject ok = new JsonObject();
            ok.addProperty("status", "success");
            reply(exchange, HTTP_OK, ok);
        } finally {
            exchange.close();
        }
    }

    private static JsonObject failure(String message) {
        JsonObject fail = new JsonObject();
        fail.addProperty("status", "fail");
        fail.addProperty("message", message);
        return fail;
    }

    private void reply(HttpExchange exchange, int status, JsonObject body) throws IOException {
        byte[] bytes = gson.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
