package io.qoms.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker.
 *
 * <p>Entries stay until released; {@link #expired(long)} reports the ones whose lease has
 * run out so the dispatcher can reclaim them. This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, QueueItem<?>> inflight = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(QueueItem<?> item) {
        return inflight.putIfAbsent(item.id(), item) == null;
    }

    @Override
    public boolean release(String itemId) {
        return inflight.remove(itemId) != null;
    }

    @Override
    public boolean contains(String itemId) {
        return inflight.containsKey(itemId);
    }

    @Override
    public List<QueueItem<?>> expired(long now) {
        List<QueueItem<?>> expired = new ArrayList<>();
        for (QueueItem<?> item : inflight.values()) {
            if (item.leaseExpiresAt() != 0 && now > item.leaseExpiresAt()) {
                expired.add(item);
            }
        }
        return expired;
    }

    @Override
    public int size() {
        return inflight.size();
    }
}
