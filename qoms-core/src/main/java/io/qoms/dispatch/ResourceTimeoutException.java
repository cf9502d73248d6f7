package io.qoms.dispatch;

import io.qoms.QomsException;

/**
 * Recorded as the failure of an attempt that waited longer than {@code maxWaitMs} for
 * admission. The item is retried like any other failure.
 */
public class ResourceTimeoutException extends QomsException {

    public ResourceTimeoutException(long waitedMs) {
        super("Resource timeout after " + waitedMs + "ms");
    }
}
