package com.demo.sendguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/channels")
public class MessageController {
    private static final Logger logger = LoggerFactory.getLogger(MessageController.class);

    private final EventDispatcher dispatcher;
    private final InMemoryChatPlatformClient platform;

    @Value("${send-guard.dispatch.timeout-ms:30000}")
    private long dispatchTimeoutMs = 30000;

    @Autowired
    public MessageController(EventDispatcher dispatcher, InMemoryChatPlatformClient platform) {
        this.dispatcher = dispatcher;
        this.platform = platform;
    }

    @PostMapping("/{channelId}/messages")
    public DispatchResponse post(@PathVariable String channelId,
                                 @RequestBody(required = false) String text) throws InterruptedException {
        logger.info("Handling message post request");
        long startTime = System.currentTimeMillis();

        Future<?> outcome = dispatcher.dispatch(new MessageEvent(channelId, text == null ? "" : text));
        try {
            outcome.get(dispatchTimeoutMs, TimeUnit.MILLISECONDS);
            return new DispatchResponse(true, "HANDLED", System.currentTimeMillis() - startTime);
        } catch (ExecutionException e) {
            return new DispatchResponse(false, e.getCause().getClass().getSimpleName(),
                    System.currentTimeMillis() - startTime);
        } catch (TimeoutException e) {
            outcome.cancel(true);
            return new DispatchResponse(false, "TIMEOUT", System.currentTimeMillis() - startTime);
        }
    }

    @PostMapping("/{channelId}/outage")
    public void outage(@PathVariable String channelId, @RequestParam int failures) {
        platform.simulateOutage(channelId, failures);
    }

    @GetMapping("/{channelId}/messages")
    public List<InMemoryChatPlatformClient.ChannelMessage> messages(@PathVariable String channelId) {
        return platform.messages(channelId);
    }

    public static class DispatchResponse {
        private final boolean ok;
        private final String code;
        private final long latencyMs;

        public DispatchResponse(boolean ok, String code, long latencyMs) {
            this.ok = ok;
            this.code = code;
            this.latencyMs = latencyMs;
        }

        public boolean isOk() {
            return ok;
        }

        public String getCode() {
            return code;
        }

        public long getLatencyMs() {
            return latencyMs;
        }
    }
}
