package io.qoms;

/**
 * Completes the future of every pending operation when the queue is cleared or the
 * scheduler shuts down. Operations failed this way are not retried.
 */
public class QueueClearedException extends QomsException {

    public QueueClearedException(String message) {
        super(message);
    }
}
