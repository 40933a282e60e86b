package telesim.core.events;

import telesim.core.model.MessageKind;

/**
 * Observability sink for the events a device emits outward.
 * Implementations are called from scheduler and transport threads and must be thread-safe.
 */
public interface SimulationEvents {

    /**
     * A message was discarded during overflow resolution.
     */
    void messageDropped(String deviceId, MessageKind kind, DropReason reason);

    /**
     * The transport reported a failure for one message. The message is not retried.
     */
    void messageSendFailed(String deviceId, MessageKind kind, Throwable cause);

    /**
     * A flush finished resolving its pending set. Called for empty flushes too.
     */
    default void flushCompleted(String deviceId, int retained, int dropped) {
    }
}
