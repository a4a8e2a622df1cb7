package com.demo.sendguard.observability;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Error Classifier: maps exceptions from a send action to an {@link ErrorKind}.
 *
 * Classification order:
 * 1. Cancellation (interrupts, cancelled futures) wins over everything else
 * 2. Typed network failures anywhere in the cause chain
 * 3. Text heuristic on the messages of the chain, for errors the platform
 *    surfaces untyped
 * 4. ClassCastException mentioning a fetch, raised by fetch-style platform layers
 *
 * Pure and side-effect free. Never throws.
 */
@Component
public class NetworkErrorClassifier {

    private static final List<String> NETWORK_MESSAGE_SNIPPETS = List.of(
            "network",
            "timeout",
            "connection reset",
            "connection refused",
            "host unreachable",
            "name or service not known");

    private static final List<String> FETCH_MESSAGE_SNIPPETS = List.of(
            "fetch",
            "network request");

    public ErrorClassification classify(@Nullable Throwable throwable) {
        if (throwable == null) {
            return new ErrorClassification(ErrorKind.PERMANENT, "null");
        }

        List<Throwable> chain = causeChain(throwable);
        String errorType = throwable.getClass().getSimpleName();

        for (Throwable t : chain) {
            if (isCancellation(t)) {
                return new ErrorClassification(ErrorKind.CANCELLATION, t.getClass().getSimpleName());
            }
        }

        for (Throwable t : chain) {
            if (isTypedNetworkFailure(t)) {
                return new ErrorClassification(ErrorKind.NETWORK, t.getClass().getSimpleName());
            }
        }

        for (Throwable t : chain) {
            if (containsAny(description(t), NETWORK_MESSAGE_SNIPPETS)) {
                return new ErrorClassification(ErrorKind.MESSAGE_MATCH, errorType);
            }
        }

        for (Throwable t : chain) {
            if (t instanceof ClassCastException && containsAny(description(t), FETCH_MESSAGE_SNIPPETS)) {
                return new ErrorClassification(ErrorKind.FETCH_TYPE_MISMATCH, errorType);
            }
        }

        return new ErrorClassification(ErrorKind.PERMANENT, errorType);
    }

    public boolean isTransient(@Nullable Throwable throwable) {
        return classify(throwable).isTransient();
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof InterruptedException
                || t instanceof CancellationException
                || t instanceof ClosedByInterruptException;
    }

    // ConnectException and NoRouteToHostException are SocketExceptions; SocketTimeoutException is not.
    private static boolean isTypedNetworkFailure(Throwable t) {
        return t instanceof NetworkException
                || t instanceof SocketException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof HttpTimeoutException;
    }

    private static String description(Throwable t) {
        String message = t.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> snippets) {
        for (String snippet : snippets) {
            if (text.contains(snippet)) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = throwable;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
