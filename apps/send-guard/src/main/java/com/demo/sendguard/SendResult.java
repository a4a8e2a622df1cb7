package com.demo.sendguard;

import java.util.Optional;

public class SendResult {
    private final String messageId;

    public SendResult(String messageId) {
        this.messageId = messageId;
    }

    public Optional<String> getMessageId() {
        return Optional.ofNullable(messageId);
    }
}
