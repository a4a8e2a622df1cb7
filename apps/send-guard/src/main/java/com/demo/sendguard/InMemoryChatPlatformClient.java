package com.demo.sendguard;

import com.demo.sendguard.observability.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chat platform stand-in that keeps channel histories in memory.
 *
 * Outages can be injected per channel: the next {@code failures} sends to that channel fail
 * with {@link NetworkException}, which exercises the retry and recovery path end to end.
 */
@Component
public class InMemoryChatPlatformClient implements ChatPlatformClient {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryChatPlatformClient.class);

    private final AtomicLong nextMessageId = new AtomicLong(1);
    private final Map<String, List<ChannelMessage>> channels = new HashMap<>();
    private final Map<String, Integer> pendingFailures = new HashMap<>();

    public record ChannelMessage(String messageId, String text) {
    }

    @Override
    public synchronized SendResult sendMessage(String channelId, String text) {
        int remaining = pendingFailures.getOrDefault(channelId, 0);
        if (remaining > 0) {
            pendingFailures.put(channelId, remaining - 1);
            logger.warn("Simulated network outage, {} failure(s) left", remaining - 1);
            throw new NetworkException("Simulated network outage (" + (remaining - 1) + " failures left)");
        }
        String messageId = String.valueOf(nextMessageId.getAndIncrement());
        channels.computeIfAbsent(channelId, id -> new ArrayList<>()).add(new ChannelMessage(messageId, text));
        return new SendResult(messageId);
    }

    @Override
    public synchronized void recallMessage(String channelId, String messageId) {
        List<ChannelMessage> messages = channels.get(channelId);
        if (messages == null || !messages.removeIf(m -> m.messageId().equals(messageId))) {
            throw new IllegalStateException("Message not found in channel history");
        }
    }

    public synchronized void simulateOutage(String channelId, int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must be non-negative");
        }
        pendingFailures.put(channelId, failures);
    }

    public synchronized List<ChannelMessage> messages(String channelId) {
        return List.copyOf(channels.getOrDefault(channelId, List.of()));
    }
}
