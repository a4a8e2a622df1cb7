package com.demo.sendguard.handler;

import com.demo.sendguard.MessageEvent;
import org.springframework.lang.Nullable;

/**
 * The protected operation: sends something to the event's channel.
 *
 * Returns the id of the sent message in whatever form the platform produced it, or null
 * when nothing identifiable was sent. The id is stored in its {@code String.valueOf} form.
 */
@FunctionalInterface
public interface SendAction {

    @Nullable
    Object send(MessageEvent event) throws Exception;
}
