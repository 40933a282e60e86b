package telesim.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.config.SimConfig;
import telesim.core.events.DropReason;
import telesim.core.events.SimulationEvents;
import telesim.core.exceptions.GenerationException;
import telesim.core.generator.MessageFactory;
import telesim.core.generator.MessageGenerator;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.scheduling.ScheduledTask;
import telesim.core.scheduling.TaskScheduler;
import telesim.core.transport.TransportSender;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One simulated device: a generator per message kind feeding a {@link PriorityBuffer} that is
 * flushed to the transport every write interval.
 * <p>
 * Lifecycle is {@code IDLE -> RUNNING -> STOPPED}; a stopped worker cannot be restarted. The worker
 * stops on {@link #stop()} or on the first generation fault. Transport failures are reported and
 * otherwise ignored.
 */
public class DeviceWorker {
    private static final Logger logger = LoggerFactory.getLogger(DeviceWorker.class);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String deviceId;
    private final int capacity;
    private final Duration writeInterval;
    private final PriorityBuffer buffer = new PriorityBuffer();
    private final List<MessageGenerator> generators = new ArrayList<>();
    private final TransportSender transport;
    private final SimulationEvents events;
    private final TaskScheduler scheduler;
    private final WorkerListener listener;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.IDLE);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile ScheduledTask flushTask;
    private volatile Throwable failure;

    /**
     * Creates a device worker.
     *
     * @param deviceId The device identity stamped on every message
     * @param config Intervals, capacity, priority policy and firmware version
     * @param factories One factory per message kind to generate
     * @param transport Destination of retained messages
     * @param events Sink for drop and send failure events
     * @param scheduler Scheduler owned by this worker and shut down when it stops
     * @param listener Notified once when the worker stops
     */
    public DeviceWorker(String deviceId,
                        SimConfig config,
                        Map<MessageKind, MessageFactory> factories,
                        TransportSender transport,
                        SimulationEvents events,
                        TaskScheduler scheduler,
                        WorkerListener listener) {
        this.deviceId = deviceId;
        this.capacity = config.bufferCapacity();
        this.writeInterval = config.writeInterval();
        this.transport = transport;
        this.events = events;
        this.scheduler = scheduler;
        this.listener = listener != null ? listener : WorkerListener.NONE;

        for (Map.Entry<MessageKind, MessageFactory> entry : factories.entrySet()) {
            Duration interval = switch (entry.getKey()) {
                case LOG -> config.logInterval();
                case SENSOR_DATA -> config.sensorInterval();
            };
            generators.add(new MessageGenerator(deviceId, config.firmwareVersion(), entry.getKey(), interval,
                    entry.getValue(), config.priorityPolicy(), scheduler));
        }
    }

    /**
     * Starts every generator and the flush timer.
     *
     * @throws IllegalStateException if the worker is not idle
     */
    public void start() {
        if (!state.compareAndSet(WorkerState.IDLE, WorkerState.RUNNING)) {
            throw new IllegalStateException("Device %s cannot start from state %s".formatted(deviceId, state.get()));
        }
        for (MessageGenerator generator : generators) {
            generator.start(this::accept, this::onGenerationFault);
        }
        flushTask = scheduler.scheduleAtFixedRate("flush", writeInterval, this::flush);
        logger.info("Device {} started with {} generators, write interval {}ms, buffer capacity {}",
                deviceId, generators.size(), writeInterval.toMillis(), capacity);
    }

    private void accept(Message message) {
        buffer.accumulate(message);
        // A tick already running when the worker stopped may land after halt() cleared the buffer
        if (state.get() != WorkerState.RUNNING) {
            buffer.clear();
        }
    }

    /**
     * Drains the buffer, hands retained messages to the transport in priority order and reports drops.
     * Does nothing unless the worker is running.
     */
    public FlushResult flush() {
        if (state.get() != WorkerState.RUNNING) {
            return FlushResult.EMPTY;
        }
        FlushResult result = buffer.flush(capacity);
        for (Message message : result.retained()) {
            dispatch(message);
        }
        for (Message message : result.dropped()) {
            events.messageDropped(deviceId, message.kind(), DropReason.BUFFER_OVERFLOW);
        }
        events.flushCompleted(deviceId, result.retained().size(), result.dropped().size());
        return result;
    }

    private void dispatch(Message message) {
        CompletableFuture<Void> outcome;
        try {
            outcome = transport.send(message);
        } catch (RuntimeException e) {
            events.messageSendFailed(deviceId, message.kind(), e);
            return;
        }
        outcome.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                events.messageSendFailed(deviceId, message.kind(), cause);
            }
        });
    }

    private void onGenerationFault(GenerationException fault) {
        logger.error("Device {} stopping after generation fault: {}", deviceId, fault.toString(), fault);
        halt(fault);
    }

    /**
     * Stops the worker, cancelling its timers and waiting for a running flush to finish dispatching.
     * Messages still pending in the buffer are discarded. Calling it again has no effect.
     */
    public void stop() {
        halt(null);
    }

    private void halt(Throwable cause) {
        WorkerState previous = state.getAndSet(WorkerState.STOPPED);
        if (previous == WorkerState.STOPPED) {
            return;
        }
        failure = cause;
        for (MessageGenerator generator : generators) {
            generator.stop();
        }
        ScheduledTask flushing = flushTask;
        if (flushing != null) {
            flushing.cancel();
        }
        scheduler.shutdown();
        // A fault is reported from a scheduler thread, which cannot wait for its own pool
        if (!scheduler.isSchedulerThread()) {
            try {
                if (!scheduler.awaitTermination(DEFAULT_SHUTDOWN_TIMEOUT)) {
                    logger.warn("Device {} scheduler did not terminate within {}", deviceId, DEFAULT_SHUTDOWN_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int abandoned = buffer.clear();
        if (abandoned > 0) {
            logger.debug("Device {} discarded {} unsent messages on stop", deviceId, abandoned);
        }
        logger.info("Device {} stopped{}", deviceId, cause != null ? " after a fault" : "");
        terminated.countDown();
        listener.onWorkerStopped(deviceId, cause);
    }

    /**
     * Blocks until the worker has stopped.
     *
     * @return true if it stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public WorkerState getState() {
        return state.get();
    }

    /**
     * @return The fault that stopped the worker, or null
     */
    public Throwable getFailure() {
        return failure;
    }

    public int getPendingCount() {
        return buffer.size();
    }
}
