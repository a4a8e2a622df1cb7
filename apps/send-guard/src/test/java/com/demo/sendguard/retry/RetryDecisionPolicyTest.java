package com.demo.sendguard.retry;

import com.demo.sendguard.observability.ErrorKind;
import com.demo.sendguard.observability.NetworkErrorClassifier;
import com.demo.sendguard.observability.NetworkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test matrix:
 * - network-class failures → retry
 * - permanent failures → NO retry
 * - cancellation, or any failure while the thread is interrupted → NO retry
 */
class RetryDecisionPolicyTest {

    private RetryDecisionPolicy policy;

    @BeforeEach
    void setup() {
        policy = new RetryDecisionPolicy(new NetworkErrorClassifier());
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void testSuccess_NoRetry() {
        assertFalse(policy.shouldRetry(null), "a missing error is never retried");
    }

    @Test
    void testNetworkException_Retryable() {
        assertTrue(policy.shouldRetry(new NetworkException("connection lost")));
    }

    @Test
    void testTimeoutMessage_Retryable() {
        assertTrue(policy.shouldRetry(new IllegalStateException("gateway timeout")));
    }

    @Test
    void testPlainValueError_NotRetryable() {
        assertFalse(policy.shouldRetry(new IllegalArgumentException("bad input")),
                "Errors unrelated to the network must go straight back to the caller");
    }

    @Test
    void testInterruptedException_NotRetryable() {
        assertFalse(policy.shouldRetry(new InterruptedException()));
        assertFalse(policy.shouldRetry(new CancellationException()));
    }

    @Test
    void testNetworkErrorWhileInterrupted_IsCancellation() {
        Thread.currentThread().interrupt();
        assertEquals(ErrorKind.CANCELLATION, policy.evaluate(new NetworkException("socket closed")).kind());
        assertFalse(policy.shouldRetry(new NetworkException("socket closed")),
                "An interrupted worker must never retry, whatever the failure looks like");
    }
}
