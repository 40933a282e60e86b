package telesim.core;

/**
 * Receives the termination notice of a device worker.
 */
@FunctionalInterface
public interface WorkerListener {

    /**
     * @param deviceId The stopped device
     * @param cause The generation fault that stopped it, or null for an explicit stop
     */
    void onWorkerStopped(String deviceId, Throwable cause);

    WorkerListener NONE = (deviceId, cause) -> { };
}
