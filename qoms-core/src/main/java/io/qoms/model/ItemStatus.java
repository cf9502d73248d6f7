package io.qoms.model;

/**
 * Lifecycle state of a queue item.
 */
public enum ItemStatus {
    PENDING(0),
    PROCESSING(1),
    COMPLETED(2),
    DLQ(3);

    private final int code;

    ItemStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
