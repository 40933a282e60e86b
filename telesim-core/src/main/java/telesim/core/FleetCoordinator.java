package telesim.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.config.SimConfig;
import telesim.core.events.SimulationEvents;
import telesim.core.generator.MessageFactory;
import telesim.core.generator.SimulatedMessages;
import telesim.core.model.MessageKind;
import telesim.core.scheduling.ExecutorTaskScheduler;
import telesim.core.scheduling.TaskSchedulerFactory;
import telesim.core.transport.TransportSender;
import telesim.core.utils.SimUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs a fleet of independent device workers sharing one configuration template.
 * <p>
 * Every worker gets its own identity, buffer, scheduler and message factories; the only object the
 * workers have in common is the transport, which must be thread-safe.
 */
public class FleetCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(FleetCoordinator.class);

    private final SimConfig config;
    private final TransportSender transport;
    private final SimulationEvents events;
    private final TaskSchedulerFactory schedulerFactory;
    private final Supplier<Map<MessageKind, MessageFactory>> factoriesSupplier;
    private final WorkerListener listener;
    private final List<DeviceWorker> workers = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch allStopped;
    private final AtomicBoolean started = new AtomicBoolean();
    private final Object lifecycleLock = new Object();
    private boolean shuttingDown;

    /**
     * Creates a coordinator that runs simulated devices on thread-pool schedulers.
     */
    public FleetCoordinator(SimConfig config, TransportSender transport, SimulationEvents events) {
        this(config, transport, events,
                (deviceId, threads) -> new ExecutorTaskScheduler(schedulerName(deviceId), threads),
                () -> SimulatedMessages.forAllKinds(new Random()),
                WorkerListener.NONE);
    }

    /**
     * Creates a coordinator.
     *
     * @param config The template applied to every device
     * @param transport Shared, thread-safe transport
     * @param events Sink for device events
     * @param schedulerFactory Creates one private scheduler per device
     * @param factoriesSupplier Called once per device for its message factories
     * @param listener Receives every worker termination notice after the coordinator has logged it
     */
    public FleetCoordinator(SimConfig config,
                            TransportSender transport,
                            SimulationEvents events,
                            TaskSchedulerFactory schedulerFactory,
                            Supplier<Map<MessageKind, MessageFactory>> factoriesSupplier,
                            WorkerListener listener) {
        this.config = config;
        this.transport = transport;
        this.events = events;
        this.schedulerFactory = schedulerFactory;
        this.factoriesSupplier = factoriesSupplier;
        this.listener = listener != null ? listener : WorkerListener.NONE;
        this.allStopped = new CountDownLatch(config.deviceCount());
    }

    /**
     * Spawns and starts every device, pausing for the configured stagger between devices.
     *
     * @throws IllegalStateException if the fleet was already started
     * @throws InterruptedException if interrupted while staggering; devices started so far keep running
     */
    public void start() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Fleet already started");
        }
        logger.info("Starting fleet of {} devices (log {}, sensor {}, write {}, capacity {}, priority {})",
                config.deviceCount(),
                SimUtils.formatMillis(config.logInterval()),
                SimUtils.formatMillis(config.sensorInterval()),
                SimUtils.formatMillis(config.writeInterval()),
                config.bufferCapacity(),
                config.priorityPolicy().describe());

        for (int i = 0; i < config.deviceCount(); i++) {
            // Spawning and shutdown exclude each other, so no device starts after shutdown() took its snapshot
            synchronized (lifecycleLock) {
                if (shuttingDown) {
                    logger.info("Fleet shutdown requested, {} of {} devices were started", i, config.deviceCount());
                    return;
                }
                String deviceId = SimUtils.newDeviceId();
                Map<MessageKind, MessageFactory> factories = factoriesSupplier.get();
                DeviceWorker worker = new DeviceWorker(deviceId, config, factories, transport, events,
                        schedulerFactory.create(deviceId, factories.size() + 1), this::onWorkerStopped);
                workers.add(worker);
                worker.start();
            }

            if (i < config.deviceCount() - 1 && !config.startStagger().isZero()) {
                Thread.sleep(config.startStagger().toMillis());
            }
        }
    }

    private void onWorkerStopped(String deviceId, Throwable cause) {
        if (cause != null) {
            logger.error("Device {} terminated: {}", deviceId, cause.toString());
        } else {
            logger.debug("Device {} terminated", deviceId);
        }
        allStopped.countDown();
        try {
            listener.onWorkerStopped(deviceId, cause);
        } catch (RuntimeException e) {
            logger.warn("Worker listener failed for device {}", deviceId, e);
        }
    }

    /**
     * Blocks until every device has stopped.
     *
     * @return true if all devices stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return allStopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops every device and waits for their timers to quiesce.
     */
    public void shutdown() {
        List<DeviceWorker> snapshot;
        boolean first;
        synchronized (lifecycleLock) {
            first = !shuttingDown;
            shuttingDown = true;
            snapshot = getWorkers();
        }
        logger.info("Shutting down fleet of {} devices", snapshot.size());
        for (DeviceWorker worker : snapshot) {
            worker.stop();
        }
        if (first) {
            // Devices that were never spawned count as stopped
            for (int i = snapshot.size(); i < config.deviceCount(); i++) {
                allStopped.countDown();
            }
        }
        logger.info("Fleet stopped");
    }

    static String schedulerName(String deviceId) {
        // The leading digits of a time-based id are shared by devices created in the same instant
        return "device-" + deviceId.substring(deviceId.lastIndexOf('-') + 1);
    }

    public List<DeviceWorker> getWorkers() {
        synchronized (workers) {
            return List.copyOf(workers);
        }
    }

    public long getRunningCount() {
        return getWorkers().stream().filter(w -> w.getState() == WorkerState.RUNNING).count();
    }
}
