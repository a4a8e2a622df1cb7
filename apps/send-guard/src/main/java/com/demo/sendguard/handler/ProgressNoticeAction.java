package com.demo.sendguard.handler;

import com.demo.sendguard.ChatPlatformClient;
import com.demo.sendguard.MessageEvent;
import com.demo.sendguard.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default protected action of the service: acknowledges an event by posting a progress notice
 * to its channel.
 */
public class ProgressNoticeAction implements SendAction {
    private static final Logger logger = LoggerFactory.getLogger(ProgressNoticeAction.class);

    static final String PROGRESS_TEXT = "Operation in progress...";

    private final ChatPlatformClient platform;

    public ProgressNoticeAction(ChatPlatformClient platform) {
        this.platform = platform;
    }

    @Override
    public Object send(MessageEvent event) throws Exception {
        logger.debug("Posting progress notice");
        SendResult result = platform.sendMessage(event.channelId(), PROGRESS_TEXT);
        return result == null ? null : result.getMessageId().orElse(null);
    }
}
