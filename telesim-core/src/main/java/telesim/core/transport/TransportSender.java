package telesim.core.transport;

import telesim.core.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers single messages to the collecting server.
 */
public interface TransportSender {

    /**
     * Sends a message without waiting for the outcome.
     *
     * @param message The message to send
     * @return A CompletableFuture that completes when the server accepted the message, or completes
     *         exceptionally with a {@link telesim.core.exceptions.TransportException} on failure
     */
    CompletableFuture<Void> send(Message message);

    /**
     * Closes the sender and releases any resources.
     */
    default void close() {
    }
}
