package com.demo.sendguard.registry;

import com.demo.sendguard.FakeChatPlatform;
import com.demo.sendguard.config.SendGuardConfig;
import com.demo.sendguard.observability.NetworkErrorClassifier;
import com.demo.sendguard.observability.NetworkException;
import com.demo.sendguard.retry.RecordingSleeper;
import com.demo.sendguard.retry.RetryDecisionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.channels.ClosedByInterruptException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageRecallerTest {

    private LastSentRegistry registry;
    private FakeChatPlatform platform;
    private RecordingSleeper sleeper;
    private RetryDecisionPolicy retryPolicy;
    private MessageRecaller recaller;
    private SendGuardConfig config;

    @BeforeEach
    void setup() {
        registry = new LastSentRegistry();
        platform = new FakeChatPlatform();
        sleeper = new RecordingSleeper();
        retryPolicy = new RetryDecisionPolicy(new NetworkErrorClassifier());
        recaller = new MessageRecaller(registry, platform, retryPolicy, sleeper);
        config = SendGuardConfig.builder()
                .recallRetryAttempts(2)
                .recallRetryDelayBaseMillis(500)
                .build();
    }

    @Test
    void testSuccessfulRecallClearsEntry() throws InterruptedException {
        registry.record("c1", "m1");

        assertTrue(recaller.recall("c1", "m1", config));

        assertEquals(List.of(new FakeChatPlatform.Recall("c1", "m1")), platform.recallAttempts());
        assertEquals(Optional.empty(), registry.lastSent("c1"));
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void testSkippedWhenEntryReplaced() throws InterruptedException {
        registry.record("c1", "m2");

        assertFalse(recaller.recall("c1", "m1", config));

        assertTrue(platform.recallAttempts().isEmpty(), "the newer message must never be recalled");
        assertEquals(Optional.of("m2"), registry.lastSent("c1"));
    }

    @Test
    void testSkippedWhenEntryCleared() throws InterruptedException {
        assertFalse(recaller.recall("c1", "m1", config));
        assertTrue(platform.recallAttempts().isEmpty());
    }

    @Test
    void testRetriesWithExponentialBackoff() throws InterruptedException {
        registry.record("c1", "m1");
        platform.failNextRecall(new NetworkException("reset"));
        platform.failNextRecall(new IllegalStateException("rate limited"));

        assertTrue(recaller.recall("c1", "m1", config));

        assertEquals(3, platform.recallAttempts().size());
        assertEquals(List.of(500L, 1000L), sleeper.delays());
        assertEquals(Optional.empty(), registry.lastSent("c1"));
    }

    @Test
    void testExhaustedRecallDoesNotThrow() throws InterruptedException {
        registry.record("c1", "m1");
        for (int i = 0; i < 3; i++) {
            platform.failNextRecall(new NetworkException("down"));
        }

        assertFalse(recaller.recall("c1", "m1", config));

        assertEquals(3, platform.recallAttempts().size(), "first try plus recallRetryAttempts retries");
        assertEquals(List.of(500L, 1000L), sleeper.delays(), "no sleep after the final attempt");
        assertEquals(Optional.of("m1"), registry.lastSent("c1"), "entry kept when recall failed");
    }

    @Test
    void testZeroRecallRetries() throws InterruptedException {
        registry.record("c1", "m1");
        platform.failNextRecall(new NetworkException("down"));

        assertFalse(recaller.recall("c1", "m1", config.toBuilder().recallRetryAttempts(0).build()));
        assertEquals(1, platform.recallAttempts().size());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void testCancellationDuringBackoffPropagates() {
        registry.record("c1", "m1");
        platform.failNextRecall(new NetworkException("down"));
        sleeper.interruptOnCall(0);

        assertThrows(InterruptedException.class, () -> recaller.recall("c1", "m1", config));
        assertEquals(1, platform.recallAttempts().size());
    }

    @Test
    void testWrappedInterruptIsNotRetried() {
        registry.record("c1", "m1");
        RuntimeException wrapped = new RuntimeException("recall aborted", new InterruptedException());
        platform.failNextRecall(wrapped);

        InterruptedException thrown = assertThrows(InterruptedException.class,
                () -> recaller.recall("c1", "m1", config));

        assertSame(wrapped, thrown.getCause());
        assertEquals(1, platform.recallAttempts().size(), "cancellation is never retried");
        assertTrue(sleeper.delays().isEmpty());
        assertEquals(Optional.of("m1"), registry.lastSent("c1"));
    }

    @Test
    void testClosedByInterruptIsNotRetried() {
        registry.record("c1", "m1");
        platform.failNextRecall(new ClosedByInterruptException());

        assertThrows(InterruptedException.class, () -> recaller.recall("c1", "m1", config));
        assertEquals(1, platform.recallAttempts().size());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void testFailureWhileInterruptedIsNotRetried() {
        registry.record("c1", "m1");
        FakeChatPlatform interruptingPlatform = new FakeChatPlatform() {
            @Override
            protected void onRecall(String channelId, String messageId) {
                Thread.currentThread().interrupt();
                throw new NetworkException("connection reset");
            }
        };
        MessageRecaller interruptedRecaller = new MessageRecaller(registry, interruptingPlatform, retryPolicy, sleeper);

        try {
            assertThrows(InterruptedException.class, () -> interruptedRecaller.recall("c1", "m1", config));
            assertTrue(sleeper.delays().isEmpty(), "no backoff after a cancelled recall");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testConcurrentSendWaitsForRecall() throws Exception {
        CountDownLatch recallStarted = new CountDownLatch(1);
        CountDownLatch releaseRecall = new CountDownLatch(1);
        FakeChatPlatform blockingPlatform = new FakeChatPlatform() {
            @Override
            protected void onRecall(String channelId, String messageId) throws Exception {
                recallStarted.countDown();
                assertTrue(releaseRecall.await(5, TimeUnit.SECONDS));
            }
        };
        MessageRecaller blockingRecaller = new MessageRecaller(registry, blockingPlatform, retryPolicy, sleeper);
        registry.record("c1", "m1");

        CompletableFuture<Boolean> recall = CompletableFuture.supplyAsync(() -> {
            try {
                return blockingRecaller.recall("c1", "m1", config);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(recallStarted.await(5, TimeUnit.SECONDS));

        CompletableFuture<String> newerSend = CompletableFuture.supplyAsync(() -> registry.record("c1", "m2"));
        Thread.sleep(100);
        assertFalse(newerSend.isDone(), "registry writes wait while a recall holds the lock");

        releaseRecall.countDown();
        assertTrue(recall.get(5, TimeUnit.SECONDS));
        assertEquals("m2", newerSend.get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of("m2"), registry.lastSent("c1"), "the newer message survives the recall");
    }
}
