package org.javai.storage.retry;

import org.javai.storage.StorageSettings;
import org.javai.storage.ThrowingSupplier;
import org.javai.storage.error.StorageException;
import org.javai.storage.ops.log4j.Log4jRetryReporter;

import java.io.IOException;
import java.time.Duration;

/**
 * The retry behaviour storage calls use unless told otherwise.
 *
 * <p>Retries failures {@link RetryClassifier} deems retryable, starting at one second and
 * doubling up to a minute between attempts, for at most {@link StorageSettings#retryDeadline()}
 * in total. Retries are logged through {@link Log4jRetryReporter}.
 */
public final class DefaultRetry {

    public static final Duration INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration MAX_DELAY = Duration.ofSeconds(60);
    public static final double MULTIPLIER = 2.0;

    public static final RetryPolicy POLICY =
            RetryPolicy.untilDeadline("storage-default", INITIAL_DELAY, MAX_DELAY, MULTIPLIER);

    private static volatile Retrier retrier;

    private DefaultRetry() {
    }

    /**
     * The shared default retrier, built on first use.
     *
     * @throws IllegalStateException if the configured retry deadline is invalid; the next
     *         call tries again
     */
    public static Retrier retrier() {
        Retrier result = retrier;
        if (result == null) {
            synchronized (DefaultRetry.class) {
                result = retrier;
                if (result == null) {
                    result = create();
                    retrier = result;
                }
            }
        }
        return result;
    }

    /**
     * Runs {@code work} with {@link #retrier()}.
     */
    public static <T> T call(String operation, ThrowingSupplier<T, ? extends IOException> work)
            throws StorageException {
        return retrier().call(operation, work);
    }

    static Retrier create() {
        return Retrier.builder()
                .policy(POLICY)
                .classifier(new StorageFailureClassifier())
                .reporter(new Log4jRetryReporter())
                .budget(StorageSettings.retryDeadline())
                .build();
    }
}
