package io.qoms;

/**
 * Fails a caller's future once its operation has failed {@code maxRetries} times.
 * The same failure is recorded in the dead-letter queue under {@link #itemId()}.
 */
public class RetriesExhaustedException extends QomsException {

    private final String itemId;
    private final int retryCount;

    public RetriesExhaustedException(String itemId, int retryCount, Throwable lastError) {
        super("Operation failed after " + retryCount + " retries. Last error: "
                + (lastError == null ? "Unknown error" : lastError.getMessage()), lastError);
        this.itemId = itemId;
        this.retryCount = retryCount;
    }

    public String itemId() {
        return itemId;
    }

    public int retryCount() {
        return retryCount;
    }
}
