package org.javai.storage.error;

import java.io.IOException;

/**
 * Base type of every error a storage call can raise.
 *
 * <p>The hierarchy is closed. A {@link ServiceException} carries the service's structured
 * error envelope, a {@link TransportException} describes a failure below HTTP, and a
 * {@link RetriesExhaustedException} reports that the retry driver gave up on a retryable error.
 */
public abstract sealed class StorageException extends IOException
        permits ServiceException, TransportException, RetriesExhaustedException {

    private static final long serialVersionUID = 1L;

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
