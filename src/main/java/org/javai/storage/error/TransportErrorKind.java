package org.javai.storage.error;

/**
 * Layer at which a transport failure was detected.
 */
public enum TransportErrorKind {
    /** The connection to the service could not be made or was aborted. */
    CONNECTION,

    /** The HTTP exchange broke off mid-flight. */
    PROTOCOL,

    /** The peer reset the connection. */
    CONNECTION_RESET,

    /** No response arrived within the allotted time. */
    TIMEOUT,

    /** Any other transport failure. */
    OTHER
}
