package com.demo.sendguard;

import com.demo.sendguard.handler.MessageEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Host-side dispatch: every incoming event runs as its own task on a worker pool and is passed
 * to each registered handler in registration order.
 *
 * Cancelling the returned future with {@code cancel(true)} interrupts the worker, which a
 * guarded handler treats as cancellation (no retry, no recall).
 */
public class EventDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final ExecutorService executor;
    private final List<MessageEventHandler> handlers = new CopyOnWriteArrayList<>();

    public EventDispatcher(int workerThreads) {
        this.executor = Executors.newFixedThreadPool(workerThreads);
        logger.info("EventDispatcher initialized: workerThreads={}", workerThreads);
    }

    public void register(MessageEventHandler handler) {
        handlers.add(handler);
        logger.info("Registered handler {}", handler.getClass().getSimpleName());
    }

    public Future<?> dispatch(MessageEvent event) {
        return executor.submit(() -> {
            for (MessageEventHandler handler : handlers) {
                try {
                    handler.onMessage(event);
                } catch (Exception e) {
                    logger.error("Handler {} failed: {}", handler.getClass().getSimpleName(), e.toString());
                    throw e;
                }
            }
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down EventDispatcher");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
