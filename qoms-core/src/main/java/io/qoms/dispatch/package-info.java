/**
 * Priority lanes, the dispatch loop and the lease/ACK/NACK protocol.
 *
 * <p>{@link io.qoms.dispatch.Dispatcher} drains five {@linkplain io.qoms.dispatch.PriorityLanes
 * priority lanes} one operation at a time under resource admission. Failed attempts are
 * retried with {@linkplain io.qoms.dispatch.ExponentialBackoffRetryPolicy exponential backoff}
 * until {@code maxRetries}, then dead-lettered.
 *
 * @see io.qoms.dispatch.Dispatcher
 * @see io.qoms.dispatch.PriorityLanes
 * @see io.qoms.dispatch.RetryPolicy
 * @see io.qoms.dispatch.InFlightTracker
 */
package io.qoms.dispatch;
