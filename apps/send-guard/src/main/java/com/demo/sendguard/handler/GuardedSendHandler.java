package com.demo.sendguard.handler;

import com.demo.sendguard.ChatPlatformClient;
import com.demo.sendguard.MessageEvent;
import com.demo.sendguard.SendResult;
import com.demo.sendguard.config.ConfigValidator;
import com.demo.sendguard.config.ExhaustionPolicy;
import com.demo.sendguard.config.SendGuardConfig;
import com.demo.sendguard.observability.ErrorClassification;
import com.demo.sendguard.observability.LogRedactor;
import com.demo.sendguard.registry.LastSentRegistry;
import com.demo.sendguard.registry.MessageRecaller;
import com.demo.sendguard.retry.Backoff;
import com.demo.sendguard.retry.RetryDecisionPolicy;
import com.demo.sendguard.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Guarded Invocation: runs a {@link SendAction} with network-error retries and recovery.
 *
 * State machine per event:
 * <pre>
 * INITIAL_ATTEMPT -> RETRYING(1..N) -> RECOVERING -> DONE
 *        \________________\______________ PROPAGATE (non-transient failure or cancellation)
 * </pre>
 *
 * LEARNING: The recall candidate is the channel's registry entry as it was BEFORE this
 * invocation started. A successful attempt overwrites the entry, so only an invocation that
 * never produced a message can end up recalling it. The recall itself re-checks the entry
 * under the registry lock in case another invocation sent something newer meanwhile.
 *
 * Only non-transient errors and cancellation leave {@link #onMessage} as exceptions, plus
 * {@link RetriesExhaustedException} when the exhaustion policy is PROPAGATE.
 */
public class GuardedSendHandler implements MessageEventHandler {
    private static final Logger logger = LoggerFactory.getLogger(GuardedSendHandler.class);

    private final SendAction action;
    private final SendGuardConfig config;
    private final LastSentRegistry registry;
    private final ChatPlatformClient platform;
    private final RetryDecisionPolicy retryPolicy;
    private final MessageRecaller recaller;
    private final Backoff backoff;
    private final LogRedactor redact;

    /**
     * @throws com.demo.sendguard.config.ConfigurationException if {@code config} is invalid
     */
    public GuardedSendHandler(SendAction action,
                              SendGuardConfig config,
                              LastSentRegistry registry,
                              ChatPlatformClient platform,
                              RetryDecisionPolicy retryPolicy,
                              Sleeper sleeper) {
        ConfigValidator.validate(config);
        this.action = action;
        this.config = config;
        this.registry = registry;
        this.platform = platform;
        this.retryPolicy = retryPolicy;
        this.recaller = new MessageRecaller(registry, platform, retryPolicy, sleeper);
        this.backoff = new Backoff(config.retryDelayBaseMillis(), sleeper);
        this.redact = new LogRedactor(config.logSensitiveInfo());
    }

    @Override
    public void onMessage(MessageEvent event) throws Exception {
        String channelId = event.channelId();
        Optional<String> priorMessageId = registry.lastSent(channelId);

        Exception lastFailure;
        try {
            attempt(event);
            logger.info("Send succeeded on channel {}", redact.id(channelId));
            return;
        } catch (Exception e) {
            rethrowUnlessTransient(channelId, e, "initial attempt");
            logger.warn("Network error on channel {}: {}", redact.id(channelId), e.toString());
            lastFailure = e;
        }

        int retries = config.retryAttempts();
        for (int retry = 0; retry < retries; retry++) {
            logger.info("Retry {}/{} on channel {} in {} ms",
                    retry + 1, retries, redact.id(channelId), backoff.delayMillis(retry));
            try {
                backoff.pause(retry);
            } catch (InterruptedException e) {
                logger.warn("Cancelled while waiting to retry on channel {}", redact.id(channelId));
                throw e;
            }

            try {
                attempt(event);
                logger.info("Retry {}/{} succeeded on channel {}", retry + 1, retries, redact.id(channelId));
                return;
            } catch (Exception e) {
                rethrowUnlessTransient(channelId, e, "retry " + (retry + 1));
                logger.warn("Retry {}/{} failed on channel {}: {}", retry + 1, retries, redact.id(channelId), e.toString());
                lastFailure = e;
            }
        }

        logger.error("All {} retries failed on channel {}, recovering", retries, redact.id(channelId));
        recover(channelId, priorMessageId);

        if (config.exhaustionPolicy() == ExhaustionPolicy.PROPAGATE) {
            throw new RetriesExhaustedException(retries, lastFailure);
        }
    }

    private void attempt(MessageEvent event) throws Exception {
        Object rawMessageId = action.send(event);
        if (rawMessageId != null) {
            String messageId = registry.record(event.channelId(), rawMessageId);
            logger.debug("Recorded message {} for channel {}", redact.id(messageId), redact.id(event.channelId()));
        }
    }

    private void rethrowUnlessTransient(String channelId, Exception e, String stage) throws Exception {
        ErrorClassification outcome = retryPolicy.evaluate(e);
        if (outcome.isCancellation()) {
            logger.warn("Cancelled during {} on channel {}", stage, redact.id(channelId));
            throw e;
        }
        if (!outcome.isTransient()) {
            logger.error("Non-network error during {} on channel {} ({}): {}",
                    stage, redact.id(channelId), outcome.kind(), e.toString());
            throw e;
        }
    }

    /**
     * RECOVERING: best-effort recall of the prior message, then one error notice.
     * Both failures are swallowed; cancellation still propagates.
     */
    private void recover(String channelId, Optional<String> priorMessageId) throws Exception {
        if (priorMessageId.isPresent()) {
            recaller.recall(channelId, priorMessageId.get(), config);
        }

        try {
            SendResult result = platform.sendMessage(channelId, config.errorMessageText());
            Optional<String> noticeId = result == null ? Optional.empty() : result.getMessageId();
            if (noticeId.isPresent()) {
                registry.record(channelId, noticeId.get());
                logger.info("Error notice {} sent on channel {}", redact.id(noticeId.get()), redact.id(channelId));
            } else {
                logger.warn("Error notice sent on channel {} but no message id was returned", redact.id(channelId));
            }
        } catch (Exception e) {
            if (retryPolicy.evaluate(e).isCancellation()) {
                logger.warn("Cancelled while sending error notice on channel {}", redact.id(channelId));
                throw e;
            }
            logger.error("Error notice could not be sent on channel {}: {}", redact.id(channelId), e.toString());
        }
    }
}
