package com.demo.sendguard;

/**
 * Outbound port to the chat platform. Implementations block until the platform answered.
 *
 * Both calls may fail with any error, transient network failures included. Recall is
 * not assumed to be idempotent.
 */
public interface ChatPlatformClient {

    SendResult sendMessage(String channelId, String text) throws Exception;

    void recallMessage(String channelId, String messageId) throws Exception;
}
