package com.demo.sendguard.handler;

import com.demo.sendguard.MessageEvent;

/**
 * Host-facing message handler, registered imperatively with an {@code EventDispatcher}.
 */
@FunctionalInterface
public interface MessageEventHandler {

    void onMessage(MessageEvent event) throws Exception;
}
