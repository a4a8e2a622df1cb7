package com.demo.sendguard.config;

import java.util.Locale;

/**
 * What a guarded handler reports to its caller once retries are exhausted and the
 * recall/notice recovery has run.
 */
public enum ExhaustionPolicy {
    /** Return normally; the failure is visible only in the logs and the channel notice. */
    SWALLOW,

    /** Throw {@code RetriesExhaustedException} carrying the last transient error. */
    PROPAGATE;

    public static ExhaustionPolicy parse(String value) {
        if (value == null) {
            throw new ConfigurationException("exhaustionPolicy", "exhaustionPolicy must be one of SWALLOW, PROPAGATE");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("exhaustionPolicy",
                    "exhaustionPolicy must be one of SWALLOW, PROPAGATE but was '" + value + "'");
        }
    }
}
