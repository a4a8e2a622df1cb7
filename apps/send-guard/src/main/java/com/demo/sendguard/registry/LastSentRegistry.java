package com.demo.sendguard.registry;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last-Sent Registry: channel id to the id of the most recent message a guarded handler
 * caused to be sent on that channel.
 *
 * One lock guards every read and write. The lock is reentrant, so a compound operation
 * run through {@link #exclusively(Exclusive)} can use the single-step accessors inside it.
 */
@Component
public class LastSentRegistry {

    /**
     * Work executed while holding the registry lock.
     */
    @FunctionalInterface
    public interface Exclusive<T> {
        T run() throws InterruptedException;
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> lastSent = new HashMap<>();

    public Optional<String> lastSent(String channelId) {
        lock.lock();
        try {
            return Optional.ofNullable(lastSent.get(channelId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records {@code messageId} as the channel's current entry, replacing any previous one.
     * The id is normalized to its string form.
     *
     * @return the normalized id that was stored
     */
    public String record(String channelId, Object messageId) {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(messageId, "messageId");
        String normalized = String.valueOf(messageId);
        lock.lock();
        try {
            lastSent.put(channelId, normalized);
            return normalized;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the channel's entry only if it still equals {@code messageId}.
     */
    public boolean clearIfCurrent(String channelId, String messageId) {
        lock.lock();
        try {
            return lastSent.remove(channelId, messageId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isCurrent(String channelId, String messageId) {
        lock.lock();
        try {
            return messageId != null && messageId.equals(lastSent.get(channelId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a check-then-act sequence with the lock held for its whole duration.
     * Other invocations block on every registry access until it returns.
     *
     * @throws InterruptedException if interrupted while waiting for the lock or inside {@code body}
     */
    public <T> T exclusively(Exclusive<T> body) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            return body.run();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return lastSent.size();
        } finally {
            lock.unlock();
        }
    }
}
