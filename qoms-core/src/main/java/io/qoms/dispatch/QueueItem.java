package io.qoms.dispatch;

import io.qoms.Operation;
import io.qoms.Priority;
import io.qoms.model.ItemStatus;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted operation together with its scheduling state and the caller's future.
 *
 * <p>Mutators are package-private: only the {@link Dispatcher} and the lanes it owns change
 * an item, always while holding the dispatcher lock. Timestamps are epoch millis; a value
 * of {@code 0} means "not set".
 *
 * @param <T> the operation's result type
 */
public final class QueueItem<T> {
    private final String id;
    private final Priority originalPriority;
    private final Operation<T> operation;
    private final long enqueuedAt;
    private final CompletableFuture<T> future = new CompletableFuture<>();

    private Priority priority;
    private ItemStatus status = ItemStatus.PENDING;
    private int retryCount;
    private String lastError;
    private long nextRetryAt;
    private long startedAt;
    private long leaseExpiresAt;
    private long lastPromotedAt;

    public QueueItem(String id, Priority priority, Operation<T> operation, long enqueuedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.priority = Objects.requireNonNull(priority, "priority");
        this.originalPriority = priority;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.enqueuedAt = enqueuedAt;
    }

    public String id() {
        return id;
    }

    /** Current tier; may be higher than {@link #originalPriority()} after aging. */
    public Priority priority() {
        return priority;
    }

    public Priority originalPriority() {
        return originalPriority;
    }

    public Operation<T> operation() {
        return operation;
    }

    public long enqueuedAt() {
        return enqueuedAt;
    }

    public ItemStatus status() {
        return status;
    }

    public int retryCount() {
        return retryCount;
    }

    public String lastError() {
        return lastError;
    }

    public long nextRetryAt() {
        return nextRetryAt;
    }

    public long startedAt() {
        return startedAt;
    }

    public long leaseExpiresAt() {
        return leaseExpiresAt;
    }

    public long lastPromotedAt() {
        return lastPromotedAt;
    }

    /**
     * Returns the future completed with the operation's result, or failed once the item
     * is dead-lettered or cleared.
     *
     * @return the caller's future
     */
    public CompletableFuture<T> future() {
        return future;
    }

    /**
     * Whether this item is pending and past any retry delay at {@code now}.
     *
     * @param now epoch millis
     * @return {@code true} if the item may be selected
     */
    public boolean isReady(long now) {
        return status == ItemStatus.PENDING && (nextRetryAt == 0 || nextRetryAt <= now);
    }

    /** Whether this item is pending and waiting out a retry delay. */
    public boolean isAwaitingRetry() {
        return status == ItemStatus.PENDING && retryCount > 0;
    }

    void promote(long now) {
        priority = priority.promoted();
        lastPromotedAt = now;
    }

    void markProcessing(long now, long leaseExpiresAt) {
        status = ItemStatus.PROCESSING;
        startedAt = now;
        this.leaseExpiresAt = leaseExpiresAt;
    }

    void markCompleted() {
        status = ItemStatus.COMPLETED;
    }

    void recordFailure(Throwable error) {
        retryCount++;
        String message = error.getMessage();
        lastError = message != null ? message : error.getClass().getName();
    }

    void scheduleRetry(long nextRetryAt) {
        status = ItemStatus.PENDING;
        this.nextRetryAt = nextRetryAt;
        startedAt = 0L;
        leaseExpiresAt = 0L;
    }

    void markDead() {
        status = ItemStatus.DLQ;
    }

    @Override
    public String toString() {
        return "QueueItem{id=" + id + ", priority=" + priority + ", status=" + status
                + ", retryCount=" + retryCount + '}';
    }
}
