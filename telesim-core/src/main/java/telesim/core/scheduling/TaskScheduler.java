package telesim.core.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and periodic task runner owned by a single device.
 * <p>
 * Production code uses {@link ExecutorTaskScheduler}; tests substitute a virtual-time implementation
 * so that generation and flush cadences can be driven deterministically.
 */
public interface TaskScheduler {

    /**
     * @return Wall-clock time, used to stamp messages
     */
    Instant now();

    /**
     * A monotonic reading in nanoseconds with an arbitrary origin, unaffected by wall-clock adjustments.
     * Only differences between two readings are meaningful.
     */
    long nanoTime();

    /**
     * Runs {@code task} every {@code period}, first after one full period has elapsed.
     *
     * @param name A short label for diagnostics
     * @param period The interval between executions
     * @param task The task, must not block
     * @return A handle used to cancel the task
     */
    ScheduledTask scheduleAtFixedRate(String name, Duration period, Runnable task);

    /**
     * Stops accepting tasks and cancels every periodic task.
     */
    void shutdown();

    /**
     * Blocks until running tasks have finished after a {@link #shutdown()}.
     *
     * @return true if everything finished within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * @return true if the calling thread is one of this scheduler's worker threads
     */
    boolean isSchedulerThread();
}
