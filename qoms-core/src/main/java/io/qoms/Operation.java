package io.qoms;

/**
 * A unit of work submitted to {@link Qoms}.
 *
 * <p>Operations are opaque to the scheduler: it only runs them and observes the result or
 * the thrown exception. An operation may be invoked more than once when it fails and is
 * retried, so it should be safe to repeat. Queued operations run on a scheduler-owned
 * worker thread and are interrupted when their lease expires; fast-path operations run on
 * the submitting thread.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * Runs the operation.
     *
     * @return the result handed to the caller's future
     * @throws Exception any failure; the item is NACKed and possibly retried
     */
    T execute() throws Exception;
}
