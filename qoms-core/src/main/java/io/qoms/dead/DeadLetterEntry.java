package io.qoms.dead;

import io.qoms.Priority;

/**
 * Terminal record of an operation that exhausted its retries.
 *
 * <p>The operation itself is not retained; a caller that wants another attempt must
 * submit it again.
 *
 * @param id         the item id assigned at enqueue
 * @param priority   the tier the operation was submitted with (before any aging)
 * @param enqueuedAt epoch millis of submission
 * @param failedAt   epoch millis of the final failure
 * @param retryCount failed attempts
 * @param lastError  message of the final failure
 */
public record DeadLetterEntry(
        String id,
        Priority priority,
        long enqueuedAt,
        long failedAt,
        int retryCount,
        String lastError) {
}
