package org.javai.storage;

/**
 * Classifies failed storage calls by whether another attempt can help.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve on retry.
     * Examples: rate limit exceeded, backend error, connection reset by peer.
     */
    TRANSIENT,

    /**
     * Failure that will not resolve on retry.
     * Examples: object not found, precondition failed, access denied.
     */
    PERMANENT,

    /**
     * Programming error or misconfiguration in the caller.
     * Requires developer or operator intervention to fix.
     */
    DEFECT
}
