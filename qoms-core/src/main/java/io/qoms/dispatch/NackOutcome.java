package io.qoms.dispatch;

/**
 * Result of a negative acknowledgement.
 */
public enum NackOutcome {
    /** The item was rescheduled with a backoff delay. */
    RETRY,
    /** The item exhausted its retries and was moved to the dead-letter queue. */
    DEAD,
    /** The scheduler was closed while the attempt ran; the item was dropped instead of rescheduled. */
    CLOSED,
    /** The item was not in flight or pending; nothing changed. */
    NOT_FOUND
}
