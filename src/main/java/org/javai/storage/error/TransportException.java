package org.javai.storage.error;

import java.util.Objects;
import java.util.Optional;

/**
 * A failure below the HTTP response level: no structured error body exists.
 *
 * <p>Transport errors nest. A reset seen by the HTTP stack surfaces as a
 * {@link TransportErrorKind#CONNECTION} error whose {@link #underlying()} error is a
 * {@link TransportErrorKind#PROTOCOL} error, which in turn wraps the
 * {@link TransportErrorKind#CONNECTION_RESET} signal.
 */
public final class TransportException extends StorageException {

    private static final long serialVersionUID = 1L;

    private final TransportErrorKind kind;

    private TransportException(TransportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static TransportException connection(String message, Throwable cause) {
        return new TransportException(TransportErrorKind.CONNECTION, message, cause);
    }

    public static TransportException protocol(String message, Throwable cause) {
        return new TransportException(TransportErrorKind.PROTOCOL, message, cause);
    }

    public static TransportException connectionReset(String message) {
        return new TransportException(TransportErrorKind.CONNECTION_RESET, message, null);
    }

    public static TransportException connectionReset(String message, Throwable cause) {
        return new TransportException(TransportErrorKind.CONNECTION_RESET, message, cause);
    }

    public static TransportException timeout(String message, Throwable cause) {
        return new TransportException(TransportErrorKind.TIMEOUT, message, cause);
    }

    public static TransportException other(String message, Throwable cause) {
        return new TransportException(TransportErrorKind.OTHER, message, cause);
    }

    public TransportErrorKind kind() {
        return kind;
    }

    /**
     * The next transport error down the chain, if the cause is one.
     */
    public Optional<TransportException> underlying() {
        return getCause() instanceof TransportException inner ? Optional.of(inner) : Optional.empty();
    }

    /**
     * Whether this error is of the given kind.
     */
    public boolean is(TransportErrorKind kind) {
        return this.kind == kind;
    }
}
