package telesim.core.priority;

import telesim.core.model.Message;

/**
 * Ranks messages for overflow resolution. Higher values are more important and are retained first.
 * Implementations must be deterministic and stateless.
 */
public interface PriorityPolicy {

    /**
     * Computes the priority of a message.
     *
     * @param message The message to rank, its current priority is ignored
     * @return The priority, higher is more important
     */
    int priorityOf(Message message);

    /**
     * Returns a copy of the message carrying the priority assigned by this policy.
     */
    default Message rank(Message message) {
        return message.withPriority(priorityOf(message));
    }

    /**
     * @return A short description used in logs, e.g. {@code log>sensorData}
     */
    String describe();
}
