package com.demo.sendguard;

/**
 * Incoming message event as delivered by the host dispatcher.
 */
public record MessageEvent(
    String channelId,
    String text
) {
}
