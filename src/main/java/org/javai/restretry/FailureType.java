package org.javai.restretry;

/**
 * Whether a failure is eligible for retry.
 */
public enum FailureType {
    /**
     * Transport-level problem that may resolve on retry.
     * Examples: connection refused, socket timeout, DNS lookup failure, 5xx response.
     */
    TRANSIENT,

    /**
     * Anything else. Never retried; propagated to the caller after being reported.
     * Examples: illegal argument, null pointer, unexpected application fault.
     */
    FATAL
}
