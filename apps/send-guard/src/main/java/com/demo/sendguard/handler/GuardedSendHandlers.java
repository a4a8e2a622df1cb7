package com.demo.sendguard.handler;

import com.demo.sendguard.ChatPlatformClient;
import com.demo.sendguard.config.ConfigValidator;
import com.demo.sendguard.config.SendGuardConfig;
import com.demo.sendguard.observability.NetworkErrorClassifier;
import com.demo.sendguard.registry.LastSentRegistry;
import com.demo.sendguard.retry.RetryDecisionPolicy;
import com.demo.sendguard.retry.Sleeper;

import java.util.Map;

/**
 * Builds guarded handlers outside a Spring context, e.g. from a plugin settings map.
 * Configuration is validated here, so an invalid setting prevents the handler from existing.
 */
public final class GuardedSendHandlers {

    private GuardedSendHandlers() {
    }

    public static MessageEventHandler create(SendAction action,
                                             Map<String, ?> overrides,
                                             LastSentRegistry registry,
                                             ChatPlatformClient platform) {
        return create(action, ConfigValidator.fromMap(overrides), registry, platform, Sleeper.THREAD);
    }

    public static MessageEventHandler create(SendAction action,
                                             SendGuardConfig config,
                                             LastSentRegistry registry,
                                             ChatPlatformClient platform,
                                             Sleeper sleeper) {
        RetryDecisionPolicy retryPolicy = new RetryDecisionPolicy(new NetworkErrorClassifier());
        return new GuardedSendHandler(action, config, registry, platform, retryPolicy, sleeper);
    }
}
