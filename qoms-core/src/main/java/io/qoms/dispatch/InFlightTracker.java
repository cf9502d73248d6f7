package io.qoms.dispatch;

import java.util.List;

/**
 * Bookkeeping of dispatched items and their lease deadlines.
 */
public interface InFlightTracker {

    /**
     * Records a dispatched item. Its lease deadline is {@link QueueItem#leaseExpiresAt()}.
     *
     * @param item the item being executed
     * @return {@code false} if an item with the same id is already in flight
     */
    boolean tryAcquire(QueueItem<?> item);

    /**
     * Forgets an item.
     *
     * @param itemId the item id
     * @return {@code true} if the item was in flight
     */
    boolean release(String itemId);

    boolean contains(String itemId);

    /**
     * Returns the items whose lease deadline lies before {@code now}.
     *
     * @param now epoch millis
     * @return expired items, possibly empty
     */
    List<QueueItem<?>> expired(long now);

    int size();
}
