package com.demo.sendguard.registry;

import com.demo.sendguard.ChatPlatformClient;
import com.demo.sendguard.config.SendGuardConfig;
import com.demo.sendguard.observability.LogRedactor;
import com.demo.sendguard.retry.Backoff;
import com.demo.sendguard.retry.RetryDecisionPolicy;
import com.demo.sendguard.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Recall Routine: best-effort deletion of the message a channel last received from a guarded handler.
 *
 * The whole check-then-recall sequence runs under the registry lock. A concurrent successful
 * send that replaced the entry therefore either happens before the check (recall is skipped)
 * or waits until the recall finished (the newer message is never touched).
 *
 * Failures are logged and never thrown. Only cancellation escapes, always as an
 * {@link InterruptedException} or {@link CancellationException}: a cancellation found deeper in
 * the cause chain, or seen while the thread is interrupted, is rethrown as InterruptedException.
 */
public class MessageRecaller {
    private static final Logger logger = LoggerFactory.getLogger(MessageRecaller.class);

    private final LastSentRegistry registry;
    private final ChatPlatformClient platform;
    private final RetryDecisionPolicy retryPolicy;
    private final Sleeper sleeper;

    public MessageRecaller(LastSentRegistry registry, ChatPlatformClient platform,
                           RetryDecisionPolicy retryPolicy, Sleeper sleeper) {
        this.registry = registry;
        this.platform = platform;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * @return true if the message was recalled and the channel's entry removed
     */
    public boolean recall(String channelId, String targetMessageId, SendGuardConfig config) throws InterruptedException {
        LogRedactor redact = new LogRedactor(config.logSensitiveInfo());
        Backoff backoff = new Backoff(config.recallRetryDelayBaseMillis(), sleeper);
        int maxRetries = config.recallRetryAttempts();

        return registry.exclusively(() -> {
            if (!registry.isCurrent(channelId, targetMessageId)) {
                logger.info("Recall skipped on channel {}: message {} was replaced or already cleared",
                        redact.id(channelId), redact.id(targetMessageId));
                return false;
            }

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    platform.recallMessage(channelId, targetMessageId);
                    registry.clearIfCurrent(channelId, targetMessageId);
                    logger.info("Recalled message {} on channel {}", redact.id(targetMessageId), redact.id(channelId));
                    return true;
                } catch (InterruptedException | CancellationException e) {
                    logger.warn("Recall on channel {} cancelled", redact.id(channelId));
                    throw e;
                } catch (Exception e) {
                    if (retryPolicy.evaluate(e).isCancellation()) {
                        logger.warn("Recall on channel {} cancelled: {}", redact.id(channelId), e.toString());
                        throw asInterruption(e);
                    }
                    if (attempt < maxRetries) {
                        long delay = backoff.delayMillis(attempt);
                        logger.warn("Recall of message {} on channel {} failed: {}. Retry {}/{} in {} ms",
                                redact.id(targetMessageId), redact.id(channelId), e.toString(),
                                attempt + 1, maxRetries, delay);
                        backoff.pause(attempt);
                    } else {
                        logger.error("Recall of message {} on channel {} failed, all {} attempts used: {}",
                                redact.id(targetMessageId), redact.id(channelId), maxRetries + 1, e.toString());
                    }
                }
            }
            return false;
        });
    }

    private static InterruptedException asInterruption(Exception cancellation) {
        InterruptedException interrupted = new InterruptedException(cancellation.toString());
        interrupted.initCause(cancellation);
        return interrupted;
    }
}
