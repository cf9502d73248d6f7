/**
 * Dead-letter queue for operations that exhausted their retries.
 *
 * <p>{@link io.qoms.dead.DeadLetterQueue} is a bounded record for operator inspection, not
 * a resubmission mechanism: operation closures are not retained past failure.
 *
 * @see io.qoms.dead.DeadLetterQueue
 * @see io.qoms.dead.DeadLetterEntry
 */
package io.qoms.dead;
