package telesim.core.support;

import telesim.core.scheduling.ScheduledTask;
import telesim.core.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Virtual-time scheduler. Tasks run on the calling thread inside {@link #advance(Duration)};
 * tasks due at the same instant run in registration order.
 * <p>
 * Scheduling follows a monotonic virtual clock. The wall clock reported by {@link #now()} follows it
 * too, but can additionally be stepped with {@link #stepWallClock(Duration)}.
 */
public class ManualTaskScheduler implements TaskScheduler {

    public static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private final List<Task> tasks = new ArrayList<>();
    private final Instant start;
    private Duration elapsed = Duration.ZERO;
    private Duration wallOffset = Duration.ZERO;
    private long registrations;
    private boolean shutdown;
    private boolean running;

    public ManualTaskScheduler() {
        this(EPOCH);
    }

    public ManualTaskScheduler(Instant start) {
        this.start = start;
    }

    private static final class Task implements ScheduledTask {
        private final String name;
        private final Duration period;
        private final Runnable runnable;
        private final long order;
        private Duration nextRun;
        private boolean cancelled;

        private Task(String name, Duration period, Runnable runnable, long order, Duration nextRun) {
            this.name = name;
            this.period = period;
            this.runnable = runnable;
            this.order = order;
            this.nextRun = nextRun;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

    @Override
    public Instant now() {
        return start.plus(elapsed).plus(wallOffset);
    }

    @Override
    public long nanoTime() {
        return elapsed.toNanos();
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(String name, Duration period, Runnable task) {
        if (shutdown) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        Task scheduled = new Task(name, period, task, registrations++, elapsed.plus(period));
        tasks.add(scheduled);
        return scheduled;
    }

    /**
     * Moves virtual time forward, running every task that falls due on the way.
     */
    public void advance(Duration duration) {
        Duration target = elapsed.plus(duration);
        while (true) {
            Optional<Task> due = tasks.stream()
                    .filter(t -> !t.cancelled && t.nextRun.compareTo(target) <= 0)
                    .min(Comparator.comparing((Task t) -> t.nextRun).thenComparingLong(t -> t.order));
            if (due.isEmpty()) {
                break;
            }
            Task task = due.get();
            elapsed = task.nextRun;
            task.nextRun = task.nextRun.plus(task.period);
            running = true;
            try {
                task.runnable.run();
            } finally {
                running = false;
            }
        }
        elapsed = target;
    }

    /**
     * Moves the clock without running anything, as if the scheduler threads had stalled.
     */
    public void stall(Duration duration) {
        elapsed = elapsed.plus(duration);
    }

    /**
     * Steps the wall clock only, as an NTP correction would. Negative values step it backward.
     */
    public void stepWallClock(Duration step) {
        wallOffset = wallOffset.plus(step);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        tasks.forEach(Task::cancel);
    }

    @Override
    public boolean awaitTermination(Duration timeout) {
        return true;
    }

    @Override
    public boolean isSchedulerThread() {
        return running;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public long activeTaskCount() {
        return tasks.stream().filter(t -> !t.cancelled).count();
    }

    public List<String> activeTaskNames() {
        return tasks.stream().filter(t -> !t.cancelled).map(t -> t.name).toList();
    }
}
