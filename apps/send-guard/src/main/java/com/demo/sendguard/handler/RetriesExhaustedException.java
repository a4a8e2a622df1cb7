package com.demo.sendguard.handler;

/**
 * Thrown by a guarded handler configured with {@code ExhaustionPolicy.PROPAGATE} after every
 * retry failed and recovery (recall and error notice) has run. The cause is the last transient error.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int retryAttempts;

    public RetriesExhaustedException(int retryAttempts, Throwable lastFailure) {
        super("Send failed after " + retryAttempts + " retries: " + lastFailure, lastFailure);
        this.retryAttempts = retryAttempts;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }
}
