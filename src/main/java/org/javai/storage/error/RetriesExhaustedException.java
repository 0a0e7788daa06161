package org.javai.storage.error;

/**
 * Thrown when a retry policy stopped retrying an error that was itself retryable,
 * because attempts or the time budget ran out. The last error is the cause.
 */
public final class RetriesExhaustedException extends StorageException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetriesExhaustedException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.attempts = attempts;
    }

    /**
     * Total number of attempts made, the first one included.
     */
    public int attempts() {
        return attempts;
    }
}
