package com.demo.sendguard.retry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void testDelayDoublesFromBase() {
        Backoff backoff = new Backoff(100, new RecordingSleeper());
        assertEquals(100, backoff.delayMillis(0), "first retry waits exactly the base");
        assertEquals(200, backoff.delayMillis(1));
        assertEquals(400, backoff.delayMillis(2));
        assertEquals(800, backoff.delayMillis(3));
    }

    @Test
    void testPauseSleepsScheduledDelay() throws InterruptedException {
        RecordingSleeper sleeper = new RecordingSleeper();
        Backoff backoff = new Backoff(500, sleeper);

        assertEquals(500, backoff.pause(0));
        assertEquals(1000, backoff.pause(1));
        assertEquals(List.of(500L, 1000L), sleeper.delays());
    }

    @Test
    void testPausePropagatesInterrupt() {
        RecordingSleeper sleeper = new RecordingSleeper();
        sleeper.interruptOnCall(0);
        Backoff backoff = new Backoff(10, sleeper);

        assertThrows(InterruptedException.class, () -> backoff.pause(0));
    }
}
