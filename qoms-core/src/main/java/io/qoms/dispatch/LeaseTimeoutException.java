package io.qoms.dispatch;

import io.qoms.QomsException;

/**
 * Recorded as the failure of an attempt that outlived its lease. The running operation is
 * interrupted and the item is retried like any other failure.
 */
public class LeaseTimeoutException extends QomsException {

    private final String itemId;

    public LeaseTimeoutException(String itemId, long leaseTimeoutMs) {
        super("Lease timeout - operation " + itemId + " exceeded " + leaseTimeoutMs + "ms");
        this.itemId = itemId;
    }

    public String itemId() {
        return itemId;
    }
}
