package telesim.core.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} and a wall clock.
 */
public class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final String name;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final ThreadGroup threadGroup;

    /**
     * @param name Prefix for the scheduler's thread names
     * @param threads Number of worker threads; one per concurrently ticking task avoids queuing
     */
    public ExecutorTaskScheduler(String name, int threads) {
        this(name, threads, Clock.systemUTC());
    }

    public ExecutorTaskScheduler(String name, int threads, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.threadGroup = new ThreadGroup(name);
        this.executor = Executors.newScheduledThreadPool(threads, namedDaemonThreads());
        logger.debug("Created scheduler {} with {} threads", name, threads);
    }

    private ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(threadGroup, runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(String taskName, Duration period, Runnable task) {
        long periodNanos = period.toNanos();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // An escaping exception would silently suppress every later execution
                logger.error("Task {} on scheduler {} failed", taskName, name, e);
            }
        }, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        logger.debug("Scheduled task {} on {} every {}", taskName, name, period);
        return new ScheduledTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isSchedulerThread() {
        return Thread.currentThread().getThreadGroup() == threadGroup;
    }
}
