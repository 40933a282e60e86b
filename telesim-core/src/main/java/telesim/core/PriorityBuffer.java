package telesim.core;

import telesim.core.model.Message;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-device accumulation buffer that resolves overflow by priority at flush time.
 * <p>
 * Any number of producers may call {@link #accumulate(Message)} concurrently. A flush swaps the
 * pending set out under the same lock, so every accumulation lands either entirely before or
 * entirely after it. Ordering and truncation happen outside the lock, which keeps producers from
 * waiting on the sort.
 * <p>
 * Because the whole inter-flush accumulation is ranked at once, a high priority message that
 * arrives late still displaces a low priority one that was buffered earlier.
 */
public class PriorityBuffer {

    private static final Comparator<Entry> SEND_ORDER = Comparator
            .comparingInt((Entry e) -> e.message().priority()).reversed()
            .thenComparingLong(Entry::sequence);

    private final ReentrantLock lock = new ReentrantLock();
    private List<Entry> pending = new ArrayList<>();
    private long nextSequence;

    private record Entry(long sequence, Message message) {}

    /**
     * Appends a message to the pending set. Never blocks on capacity and never fails.
     */
    public void accumulate(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        lock.lock();
        try {
            pending.add(new Entry(nextSequence++, message));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drains the buffer and splits its content into retained and dropped messages.
     *
     * @param capacity Maximum number of messages to retain
     * @return Retained messages by descending priority then arrival, and the dropped rest in the same order
     * @throws IllegalArgumentException if capacity is negative
     */
    public FlushResult flush(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        List<Entry> snapshot;
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return FlushResult.EMPTY;
            }
            snapshot = pending;
            pending = new ArrayList<>();
        } finally {
            lock.unlock();
        }

        snapshot.sort(SEND_ORDER);
        int cut = Math.min(capacity, snapshot.size());
        List<Message> retained = new ArrayList<>(cut);
        List<Message> dropped = new ArrayList<>(snapshot.size() - cut);
        for (int i = 0; i < snapshot.size(); i++) {
            (i < cut ? retained : dropped).add(snapshot.get(i).message());
        }
        return new FlushResult(retained, dropped);
    }

    /**
     * Discards everything pending.
     *
     * @return The number of discarded messages
     */
    public int clear() {
        lock.lock();
        try {
            int size = pending.size();
            pending = new ArrayList<>();
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
