package com.demo.sendguard.config;

import com.demo.sendguard.ChatPlatformClient;
import com.demo.sendguard.EventDispatcher;
import com.demo.sendguard.handler.GuardedSendHandler;
import com.demo.sendguard.handler.MessageEventHandler;
import com.demo.sendguard.handler.ProgressNoticeAction;
import com.demo.sendguard.registry.LastSentRegistry;
import com.demo.sendguard.retry.RetryDecisionPolicy;
import com.demo.sendguard.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the guarded send handler from {@code send-guard.*} properties.
 * An invalid setting fails application startup.
 */
@Configuration
public class SendGuardConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SendGuardConfiguration.class);

    @Value("${send-guard.retry-attempts:3}")
    private int retryAttempts;

    @Value("${send-guard.retry-delay-base-ms:1000}")
    private long retryDelayBaseMillis;

    @Value("${send-guard.error-message:" + SendGuardConfig.DEFAULT_ERROR_MESSAGE + "}")
    private String errorMessageText;

    @Value("${send-guard.log-sensitive-info:false}")
    private boolean logSensitiveInfo;

    @Value("${send-guard.recall-retry-attempts:2}")
    private int recallRetryAttempts;

    @Value("${send-guard.recall-retry-delay-base-ms:500}")
    private long recallRetryDelayBaseMillis;

    @Value("${send-guard.exhaustion-policy:SWALLOW}")
    private String exhaustionPolicy;

    @Value("${send-guard.dispatcher.threads:4}")
    private int dispatcherThreads;

    @Bean
    public SendGuardConfig sendGuardConfig() {
        SendGuardConfig config = SendGuardConfig.builder()
                .retryAttempts(retryAttempts)
                .retryDelayBaseMillis(retryDelayBaseMillis)
                .errorMessageText(errorMessageText)
                .logSensitiveInfo(logSensitiveInfo)
                .recallRetryAttempts(recallRetryAttempts)
                .recallRetryDelayBaseMillis(recallRetryDelayBaseMillis)
                .exhaustionPolicy(ExhaustionPolicy.parse(exhaustionPolicy))
                .build();
        ConfigValidator.validate(config);
        logger.info("Send guard configured: retryAttempts={}, retryDelayBaseMs={}, recallRetryAttempts={}, "
                        + "recallRetryDelayBaseMs={}, logSensitiveInfo={}, exhaustionPolicy={}",
                config.retryAttempts(), config.retryDelayBaseMillis(), config.recallRetryAttempts(),
                config.recallRetryDelayBaseMillis(), config.logSensitiveInfo(), config.exhaustionPolicy());
        return config;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public MessageEventHandler guardedSendHandler(SendGuardConfig config,
                                                  LastSentRegistry registry,
                                                  ChatPlatformClient platform,
                                                  RetryDecisionPolicy retryPolicy,
                                                  Sleeper sleeper) {
        return new GuardedSendHandler(new ProgressNoticeAction(platform), config, registry, platform, retryPolicy, sleeper);
    }

    @Bean
    public EventDispatcher eventDispatcher(MessageEventHandler guardedSendHandler) {
        EventDispatcher dispatcher = new EventDispatcher(dispatcherThreads);
        dispatcher.register(guardedSendHandler);
        return dispatcher;
    }
}
