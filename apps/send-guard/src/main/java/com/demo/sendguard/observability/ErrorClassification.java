package com.demo.sendguard.observability;

/**
 * Classification result for a failed send attempt.
 */
public record ErrorClassification(
    ErrorKind kind,
    String errorType
) {
    public boolean isTransient() {
        return kind.isTransient();
    }

    public boolean isCancellation() {
        return kind == ErrorKind.CANCELLATION;
    }
}
