package com.demo.sendguard.observability;

/**
 * Fixed taxonomy for failures raised while sending a message.
 * Only the network-class kinds are retried.
 */
public enum ErrorKind {
    NETWORK,                 // NetworkException or a java.net failure in the cause chain
    MESSAGE_MATCH,           // Untyped error whose text reads like a network failure
    FETCH_TYPE_MISMATCH,     // ClassCastException raised by the platform's fetch layer
    CANCELLATION,            // Interrupt or cancellation, never retried
    PERMANENT;               // Anything else, including a missing error

    public boolean isTransient() {
        return this == NETWORK || this == MESSAGE_MATCH || this == FETCH_TYPE_MISMATCH;
    }
}
