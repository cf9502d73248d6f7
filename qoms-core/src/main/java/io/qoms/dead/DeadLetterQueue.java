package io.qoms.dead;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, time-retained store of {@link DeadLetterEntry dead letters}.
 *
 * <p>Adding beyond {@code maxSize} evicts the oldest entry. Entries older than
 * {@code retentionMs} (by {@link DeadLetterEntry#failedAt()}) are pruned lazily whenever
 * the queue is read. This class is thread-safe.
 */
public final class DeadLetterQueue {
    private static final Logger logger = Logger.getLogger(DeadLetterQueue.class.getName());

    private final Deque<DeadLetterEntry> entries = new ArrayDeque<>();
    private final int maxSize;
    private final long retentionMs;
    private final Clock clock;

    public DeadLetterQueue(int maxSize, long retentionMs, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, got: " + maxSize);
        }
        if (retentionMs <= 0) {
            throw new IllegalArgumentException("retentionMs must be > 0, got: " + retentionMs);
        }
        this.maxSize = maxSize;
        this.retentionMs = retentionMs;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends an entry, evicting the oldest ones while the queue is over capacity.
     *
     * @param entry the dead letter
     */
    public synchronized void add(DeadLetterEntry entry) {
        entries.addLast(Objects.requireNonNull(entry, "entry"));
        while (entries.size() > maxSize) {
            DeadLetterEntry evicted = entries.removeFirst();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Dead-letter queue full; evicted " + evicted.id());
            }
        }
    }

    /**
     * Returns the retained entries, oldest first, after pruning expired ones.
     *
     * @return an immutable copy of the entries
     */
    public synchronized List<DeadLetterEntry> entries() {
        prune(clock.millis());
        return List.copyOf(entries);
    }

    /**
     * Removes a single entry, for example after the caller resubmitted its operation.
     *
     * @param id the item id
     * @return {@code true} if an entry with this id was present
     */
    public synchronized boolean remove(String id) {
        for (Iterator<DeadLetterEntry> it = entries.iterator(); it.hasNext(); ) {
            if (it.next().id().equals(id)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every entry.
     *
     * @return the number of entries removed
     */
    public synchronized int clear() {
        int count = entries.size();
        entries.clear();
        return count;
    }

    /** Current number of entries, without pruning. */
    public synchronized int size() {
        return entries.size();
    }

    private void prune(long now) {
        // failedAt is non-decreasing along the deque, so expired entries sit at the head
        while (!entries.isEmpty() && now - entries.peekFirst().failedAt() > retentionMs) {
            entries.removeFirst();
        }
    }
}
