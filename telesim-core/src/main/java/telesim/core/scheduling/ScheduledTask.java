package telesim.core.scheduling;

/**
 * Handle on a periodic task registered with a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /**
     * Cancels future executions. An execution already running is allowed to finish.
     */
    void cancel();

    boolean isCancelled();
}
