package com.demo.sendguard.observability;

/**
 * Raised by platform clients when a send or recall failed at the network level.
 * Always classified as {@link ErrorKind#NETWORK}, also when wrapped by another exception.
 */
public class NetworkException extends RuntimeException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
