package com.demo.sendguard.observability;

/**
 * Hides channel and message ids from log output unless sensitive logging is enabled.
 */
public final class LogRedactor {

    static final String REDACTED = "[redacted]";

    private final boolean logSensitiveInfo;

    public LogRedactor(boolean logSensitiveInfo) {
        this.logSensitiveInfo = logSensitiveInfo;
    }

    public String id(Object value) {
        return logSensitiveInfo ? String.valueOf(value) : REDACTED;
    }
}
