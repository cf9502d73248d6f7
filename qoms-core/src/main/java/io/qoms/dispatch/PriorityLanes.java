package io.qoms.dispatch;

import io.qoms.Priority;
import io.qoms.model.ItemStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Five FIFO lanes, one per {@link Priority}.
 *
 * <p>A lane holds its pending items and the slots of its dispatched ones: an item keeps
 * its slot while {@link ItemStatus#PROCESSING} so that a retried item resumes at its old
 * position, and leaves the lane on ACK, dead-lettering or clearing.
 *
 * <p>Aging promotes a pending item by one tier once it has waited {@code agePromotionMs}
 * since it was enqueued or last promoted. Lanes are aged from {@code HIGH} down to
 * {@code IDLE}, so a promoted item lands in a lane that was already visited and moves at
 * most one tier per pass.
 *
 * <p>Not thread-safe; the owning {@link Dispatcher} serializes access.
 */
public final class PriorityLanes {
    private static final Logger logger = Logger.getLogger(PriorityLanes.class.getName());

    private final Map<Priority, Deque<QueueItem<?>>> lanes = new EnumMap<>(Priority.class);
    private long promotions;

    public PriorityLanes() {
        for (Priority priority : Priority.values()) {
            lanes.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Appends an item to the tail of the lane of its current priority.
     *
     * @param item the item to add
     */
    public void add(QueueItem<?> item) {
        lanes.get(item.priority()).addLast(item);
    }

    public boolean remove(QueueItem<?> item) {
        return lanes.get(item.priority()).remove(item);
    }

    public boolean contains(QueueItem<?> item) {
        return lanes.get(item.priority()).contains(item);
    }

    /**
     * Runs an aging pass and then selects the next item.
     *
     * @param now            epoch millis
     * @param agePromotionMs wait after which a pending item moves up one tier
     * @return the next item to dispatch, or {@code null} if none is ready
     */
    public QueueItem<?> nextItem(long now, long agePromotionMs) {
        age(now, agePromotionMs);
        return select(now);
    }

    /**
     * Promotes every pending non-critical item that has waited longer than
     * {@code agePromotionMs} by one tier, appending it to the higher lane.
     *
     * @param now            epoch millis
     * @param agePromotionMs promotion threshold in milliseconds
     * @return the number of items promoted
     */
    public int age(long now, long agePromotionMs) {
        int promoted = 0;
        for (Priority priority : Priority.values()) {
            if (priority == Priority.CRITICAL) {
                continue;
            }
            Deque<QueueItem<?>> lane = lanes.get(priority);
            List<QueueItem<?>> due = new ArrayList<>();
            for (Iterator<QueueItem<?>> it = lane.iterator(); it.hasNext(); ) {
                QueueItem<?> item = it.next();
                if (item.status() != ItemStatus.PENDING) {
                    continue;
                }
                long since = item.lastPromotedAt() != 0 ? item.lastPromotedAt() : item.enqueuedAt();
                if (now - since > agePromotionMs) {
                    it.remove();
                    due.add(item);
                }
            }
            for (QueueItem<?> item : due) {
                item.promote(now);
                lanes.get(item.priority()).addLast(item);
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Aged " + item.id() + " from " + priority + " to " + item.priority()
                            + " after " + (now - item.enqueuedAt()) + "ms");
                }
            }
            promoted += due.size();
        }
        promotions += promoted;
        return promoted;
    }

    /** Lifetime number of aging promotions. */
    public long promotions() {
        return promotions;
    }

    /**
     * Returns the first ready item scanning lanes from {@code CRITICAL} to {@code IDLE}.
     * Items still inside their retry delay are skipped, so a healthy item may overtake a
     * retried one of the same tier.
     *
     * @param now epoch millis
     * @return the selected item, or {@code null}
     */
    public QueueItem<?> select(long now) {
        for (Deque<QueueItem<?>> lane : lanes.values()) {
            for (QueueItem<?> item : lane) {
                if (item.isReady(now)) {
                    return item;
                }
            }
        }
        return null;
    }

    /**
     * Whether any pending item is ready at {@code now}.
     *
     * @param now epoch millis
     * @return {@code true} if {@link #select(long)} would return an item
     */
    public boolean hasReady(long now) {
        return select(now) != null;
    }

    /**
     * Returns the earliest retry time among pending retry-delayed items.
     *
     * @return epoch millis, or {@code 0} if no pending item carries a retry delay
     */
    public long earliestRetryAt() {
        long earliest = 0L;
        for (Deque<QueueItem<?>> lane : lanes.values()) {
            for (QueueItem<?> item : lane) {
                if (item.status() == ItemStatus.PENDING && item.nextRetryAt() != 0
                        && (earliest == 0 || item.nextRetryAt() < earliest)) {
                    earliest = item.nextRetryAt();
                }
            }
        }
        return earliest;
    }

    /**
     * Removes every pending item from every lane. Slots of processing items stay.
     *
     * @return the removed items in priority, then FIFO, order
     */
    public List<QueueItem<?>> drainPending() {
        List<QueueItem<?>> drained = new ArrayList<>();
        for (Deque<QueueItem<?>> lane : lanes.values()) {
            for (Iterator<QueueItem<?>> it = lane.iterator(); it.hasNext(); ) {
                QueueItem<?> item = it.next();
                if (item.status() == ItemStatus.PENDING) {
                    it.remove();
                    drained.add(item);
                }
            }
        }
        return drained;
    }

    /** Number of pending items in one lane. */
    public int pendingCount(Priority priority) {
        int count = 0;
        for (QueueItem<?> item : lanes.get(priority)) {
            if (item.status() == ItemStatus.PENDING) {
                count++;
            }
        }
        return count;
    }

    /** Number of pending items across all lanes. */
    public int pendingCount() {
        int count = 0;
        for (Priority priority : Priority.values()) {
            count += pendingCount(priority);
        }
        return count;
    }

    /** Number of pending items that already failed at least once. */
    public int awaitingRetryCount() {
        int count = 0;
        for (Deque<QueueItem<?>> lane : lanes.values()) {
            for (QueueItem<?> item : lane) {
                if (item.isAwaitingRetry()) {
                    count++;
                }
            }
        }
        return count;
    }

    /** Whether every lane is empty, counting slots of processing items. */
    public boolean isEmpty() {
        for (Deque<QueueItem<?>> lane : lanes.values()) {
            if (!lane.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
