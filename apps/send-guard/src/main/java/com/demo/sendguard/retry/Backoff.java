package com.demo.sendguard.retry;

import io.github.resilience4j.core.IntervalFunction;

/**
 * Exponential backoff schedule: the pause before retry {@code i} (0-based) is {@code base * 2^i}.
 *
 * LEARNING: Resilience4j numbers attempts from 1, so retry index i maps to attempt i + 1.
 */
public final class Backoff {

    private static final double MULTIPLIER = 2.0;

    private final IntervalFunction intervals;
    private final Sleeper sleeper;

    public Backoff(long baseMillis, Sleeper sleeper) {
        this.intervals = IntervalFunction.ofExponentialBackoff(baseMillis, MULTIPLIER);
        this.sleeper = sleeper;
    }

    public long delayMillis(int retryIndex) {
        return intervals.apply(retryIndex + 1);
    }

    /**
     * Sleeps for the delay of the given retry index.
     *
     * @return the delay that was slept, in milliseconds
     * @throws InterruptedException if the invocation was cancelled while waiting
     */
    public long pause(int retryIndex) throws InterruptedException {
        long delay = delayMillis(retryIndex);
        sleeper.sleep(delay);
        return delay;
    }
}
