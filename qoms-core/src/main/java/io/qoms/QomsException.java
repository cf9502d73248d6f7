package io.qoms;

/**
 * Base class of all failures reported by the scheduler through a caller's future.
 */
public class QomsException extends RuntimeException {

    public QomsException(String message) {
        super(message);
    }

    public QomsException(String message, Throwable cause) {
        super(message, cause);
    }
}
