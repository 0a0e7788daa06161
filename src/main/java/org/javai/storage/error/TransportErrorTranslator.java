package org.javai.storage.error;

import org.javai.storage.ThrowingSupplier;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Objects;

/**
 * The single point where raw JDK I/O errors from the HTTP stack become {@link StorageException}s.
 *
 * <p>The shape of the result is decided here, once, so that later classification only
 * inspects typed errors. {@code StorageException}s pass through unchanged.
 */
public final class TransportErrorTranslator {

    private static final int MAX_CAUSE_DEPTH = 8;
    private static final String CONNECTION_RESET = "connection reset";

    private TransportErrorTranslator() {
    }

    /**
     * Runs one request and translates any {@link IOException} it throws.
     * Runtime exceptions propagate untouched.
     */
    public static <T> T call(ThrowingSupplier<T, ? extends IOException> work) throws StorageException {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return work.get();
        } catch (IOException e) {
            throw translate(e);
        }
    }

    public static StorageException translate(IOException e) {
        Objects.requireNonNull(e, "exception must not be null");

        if (e instanceof StorageException storageException) {
            return storageException;
        }

        SocketException reset = findConnectionReset(e);
        if (reset != null) {
            TransportException signal = TransportException.connectionReset(reset.getMessage(), reset);
            TransportException protocol = TransportException.protocol("Connection aborted", signal);
            return TransportException.connection("Connection aborted: " + reset.getMessage(), protocol);
        }

        // HttpConnectTimeoutException is an HttpTimeoutException, so it must be checked first
        if (e instanceof HttpConnectTimeoutException
                || e instanceof ConnectException
                || e instanceof NoRouteToHostException
                || e instanceof UnknownHostException) {
            return TransportException.connection(messageFor("Connection failed", e), e);
        }

        if (e instanceof HttpTimeoutException || e instanceof SocketTimeoutException) {
            return TransportException.timeout(messageFor("Timed out", e), e);
        }

        if (e instanceof SocketException) {
            // Aborted exchange without a reset signal, e.g. a broken pipe
            return TransportException.connection(messageFor("Connection aborted", e),
                    TransportException.protocol(messageFor("Connection aborted", e), e));
        }

        return TransportException.other(messageFor("Transport error", e), e);
    }

    private static SocketException findConnectionReset(Throwable t) {
        Throwable current = t;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SocketException socketException && isResetMessage(current.getMessage())) {
                return socketException;
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean isResetMessage(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).contains(CONNECTION_RESET);
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix + ": " + t.getClass().getName();
    }
}
