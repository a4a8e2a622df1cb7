package com.demo.sendguard.retry;

import com.demo.sendguard.observability.ErrorClassification;
import com.demo.sendguard.observability.ErrorKind;
import com.demo.sendguard.observability.NetworkErrorClassifier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Retry Decision Policy: classifier-based retry gating for message sends.
 *
 * Safety constraints:
 * - Cancellation is NEVER retried, also when the failure itself looks like a network error
 *   but the worker thread has been interrupted
 * - Only network-class kinds (NETWORK, MESSAGE_MATCH, FETCH_TYPE_MISMATCH) are retried
 * - Everything else is permanent and goes straight back to the caller
 */
@Component
public class RetryDecisionPolicy {

    private final NetworkErrorClassifier classifier;

    @Autowired
    public RetryDecisionPolicy(NetworkErrorClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Classify a failure from the current thread's point of view.
     *
     * LEARNING: A blocking client may translate an interrupt into an ordinary I/O error
     * ("connection reset" after the socket was closed under it). The interrupt flag is
     * the only reliable signal left, so it overrides the classifier.
     */
    public ErrorClassification evaluate(@Nullable Throwable throwable) {
        ErrorClassification outcome = classifier.classify(throwable);
        if (throwable != null && !outcome.isCancellation() && Thread.currentThread().isInterrupted()) {
            return new ErrorClassification(ErrorKind.CANCELLATION, outcome.errorType());
        }
        return outcome;
    }

    public boolean shouldRetry(@Nullable Throwable throwable) {
        return evaluate(throwable).isTransient();
    }
}
