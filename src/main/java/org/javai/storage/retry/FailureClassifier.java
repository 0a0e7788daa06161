package org.javai.storage.retry;

import org.javai.storage.Failure;

/**
 * Classifies errors raised by storage calls into failures a {@link RetryPolicy} can act on.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param throwable The error that occurred
     * @return A classified Failure
     */
    Failure classify(String operation, Throwable throwable);
}
