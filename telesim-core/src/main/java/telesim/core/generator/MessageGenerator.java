package telesim.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.core.exceptions.GenerationException;
import telesim.core.model.Message;
import telesim.core.model.MessageKind;
import telesim.core.priority.PriorityPolicy;
import telesim.core.scheduling.ScheduledTask;
import telesim.core.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Produces messages of one kind for one device, one per tick of its own interval.
 * <p>
 * Ticks that arrive less than half an interval after the previous emission are coalesced, so a
 * generator that fell behind fires once immediately instead of replaying every missed tick.
 */
public class MessageGenerator {
    private static final Logger logger = LoggerFactory.getLogger(MessageGenerator.class);

    private final String deviceId;
    private final String firmwareVersion;
    private final MessageKind kind;
    private final Duration interval;
    private final long minSpacingNanos;
    private final MessageFactory factory;
    private final PriorityPolicy policy;
    private final TaskScheduler scheduler;

    private Consumer<Message> sink;
    private Consumer<GenerationException> faultHandler;
    private volatile ScheduledTask task;
    private boolean emitted;
    private long lastEmittedNanos;
    private volatile long generated;
    private volatile long coalesced;

    public MessageGenerator(String deviceId,
                            String firmwareVersion,
                            MessageKind kind,
                            Duration interval,
                            MessageFactory factory,
                            PriorityPolicy policy,
                            TaskScheduler scheduler) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Generator interval must be positive: " + interval);
        }
        this.deviceId = deviceId;
        this.firmwareVersion = firmwareVersion;
        this.kind = kind;
        this.interval = interval;
        this.minSpacingNanos = interval.dividedBy(2).toNanos();
        this.factory = factory;
        this.policy = policy;
        this.scheduler = scheduler;
    }

    /**
     * Builds the next message, stamped with the scheduler's current time and ranked by the policy.
     *
     * @throws GenerationException if the factory fails or returns a message that does not belong to this generator
     */
    public Message next() throws GenerationException {
        Message draft;
        try {
            draft = factory.create(deviceId, firmwareVersion, scheduler.now());
        } catch (RuntimeException e) {
            throw new GenerationException("Failed to generate %s message".formatted(kind.getWireName()), e, deviceId);
        }
        if (draft == null || draft.kind() != kind || !deviceId.equals(draft.deviceId())) {
            throw new GenerationException("Generator for %s produced a malformed message: %s"
                    .formatted(kind.getWireName(), draft), null, deviceId);
        }
        return policy.rank(draft);
    }

    /**
     * The lazy, unending sequence of messages this generator produces, independent of any schedule.
     * A generation fault surfaces as an {@link IllegalStateException} wrapping the {@link GenerationException}.
     */
    public Stream<Message> messages() {
        return Stream.generate(() -> {
            try {
                return next();
            } catch (GenerationException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        });
    }

    /**
     * Starts pushing one message per tick into {@code sink}.
     *
     * @param sink Receives every generated message, must not block
     * @param faultHandler Called once if generation fails; the generator is stopped before the call
     */
    public void start(Consumer<Message> sink, Consumer<GenerationException> faultHandler) {
        if (task != null) {
            throw new IllegalStateException("Generator for %s on device %s already started".formatted(kind, deviceId));
        }
        this.sink = sink;
        this.faultHandler = faultHandler;
        this.task = scheduler.scheduleAtFixedRate(kind.getWireName() + "-generator", interval, this::tick);
    }

    void tick() {
        ScheduledTask current = task;
        if (current == null || current.isCancelled()) {
            return;
        }
        // Monotonic, a wall-clock step must not change the spacing
        long now = scheduler.nanoTime();
        if (emitted && now - lastEmittedNanos < minSpacingNanos) {
            coalesced++;
            logger.debug("Device {} coalesced a late {} tick", deviceId, kind.getWireName());
            return;
        }
        Message message;
        try {
            message = next();
        } catch (GenerationException e) {
            current.cancel();
            faultHandler.accept(e);
            return;
        }
        emitted = true;
        lastEmittedNanos = now;
        generated++;
        sink.accept(message);
    }

    public void stop() {
        ScheduledTask current = task;
        if (current != null) {
            current.cancel();
        }
    }

    public MessageKind getKind() {
        return kind;
    }

    public long getGeneratedCount() {
        return generated;
    }

    public long getCoalescedCount() {
        return coalesced;
    }
}
