package com.demo.sendguard.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Construction-time validation of {@link SendGuardConfig}.
 *
 * Constraints are checked in declaration order and the first violation is reported,
 * so a message always names exactly one setting.
 */
public final class ConfigValidator {

    public static final String RETRY_ATTEMPTS = "retryAttempts";
    public static final String RETRY_DELAY_BASE_MILLIS = "retryDelayBaseMillis";
    public static final String ERROR_MESSAGE_TEXT = "errorMessageText";
    public static final String LOG_SENSITIVE_INFO = "logSensitiveInfo";
    public static final String RECALL_RETRY_ATTEMPTS = "recallRetryAttempts";
    public static final String RECALL_RETRY_DELAY_BASE_MILLIS = "recallRetryDelayBaseMillis";
    public static final String EXHAUSTION_POLICY = "exhaustionPolicy";

    private static final List<String> KNOWN_KEYS = List.of(
            RETRY_ATTEMPTS, RETRY_DELAY_BASE_MILLIS, ERROR_MESSAGE_TEXT, LOG_SENSITIVE_INFO,
            RECALL_RETRY_ATTEMPTS, RECALL_RETRY_DELAY_BASE_MILLIS, EXHAUSTION_POLICY);

    private ConfigValidator() {
    }

    public static void validate(SendGuardConfig config) {
        if (config == null) {
            throw new ConfigurationException("config", "config must not be null");
        }
        if (config.retryAttempts() < 0) {
            throw nonNegativeInteger(RETRY_ATTEMPTS, config.retryAttempts());
        }
        if (config.retryDelayBaseMillis() <= 0) {
            throw positiveNumber(RETRY_DELAY_BASE_MILLIS, config.retryDelayBaseMillis());
        }
        if (config.errorMessageText() == null) {
            throw new ConfigurationException(ERROR_MESSAGE_TEXT, ERROR_MESSAGE_TEXT + " must be a string");
        }
        if (config.recallRetryAttempts() < 0) {
            throw nonNegativeInteger(RECALL_RETRY_ATTEMPTS, config.recallRetryAttempts());
        }
        if (config.recallRetryDelayBaseMillis() <= 0) {
            throw positiveNumber(RECALL_RETRY_DELAY_BASE_MILLIS, config.recallRetryDelayBaseMillis());
        }
        if (config.exhaustionPolicy() == null) {
            throw new ConfigurationException(EXHAUSTION_POLICY, EXHAUSTION_POLICY + " must be one of SWALLOW, PROPAGATE");
        }
    }

    /**
     * Builds a validated config from loosely typed overrides, e.g. a plugin settings map.
     * Missing keys keep their defaults. Fractional millisecond delays are rounded up.
     *
     * @throws ConfigurationException on an unknown key or the first value of the wrong type or range
     */
    public static SendGuardConfig fromMap(Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        SendGuardConfig defaults = SendGuardConfig.defaults();
        merged.put(RETRY_ATTEMPTS, defaults.retryAttempts());
        merged.put(RETRY_DELAY_BASE_MILLIS, defaults.retryDelayBaseMillis());
        merged.put(ERROR_MESSAGE_TEXT, defaults.errorMessageText());
        merged.put(LOG_SENSITIVE_INFO, defaults.logSensitiveInfo());
        merged.put(RECALL_RETRY_ATTEMPTS, defaults.recallRetryAttempts());
        merged.put(RECALL_RETRY_DELAY_BASE_MILLIS, defaults.recallRetryDelayBaseMillis());
        merged.put(EXHAUSTION_POLICY, defaults.exhaustionPolicy());

        if (overrides != null) {
            for (Map.Entry<String, ?> entry : overrides.entrySet()) {
                if (!KNOWN_KEYS.contains(entry.getKey())) {
                    throw new ConfigurationException(entry.getKey(), "unknown setting '" + entry.getKey() + "'");
                }
                merged.put(entry.getKey(), entry.getValue());
            }
        }

        SendGuardConfig config = SendGuardConfig.builder()
                .retryAttempts(nonNegativeInteger(merged, RETRY_ATTEMPTS))
                .retryDelayBaseMillis(positiveMillis(merged, RETRY_DELAY_BASE_MILLIS))
                .errorMessageText(text(merged, ERROR_MESSAGE_TEXT))
                .logSensitiveInfo(bool(merged, LOG_SENSITIVE_INFO))
                .recallRetryAttempts(nonNegativeInteger(merged, RECALL_RETRY_ATTEMPTS))
                .recallRetryDelayBaseMillis(positiveMillis(merged, RECALL_RETRY_DELAY_BASE_MILLIS))
                .exhaustionPolicy(policy(merged, EXHAUSTION_POLICY))
                .build();
        validate(config);
        return config;
    }

    private static int nonNegativeInteger(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)) {
            throw nonNegativeInteger(key, value);
        }
        long number = ((Number) value).longValue();
        if (number < 0 || number > Integer.MAX_VALUE) {
            throw nonNegativeInteger(key, value);
        }
        return (int) number;
    }

    private static long positiveMillis(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (!(value instanceof Number)) {
            throw positiveNumber(key, value);
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number) || number <= 0) {
            throw positiveNumber(key, value);
        }
        return (long) Math.ceil(number);
    }

    private static String text(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (!(value instanceof String)) {
            throw new ConfigurationException(key, key + " must be a string but was " + describe(value));
        }
        return (String) value;
    }

    private static boolean bool(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (!(value instanceof Boolean)) {
            throw new ConfigurationException(key, key + " must be a boolean but was " + describe(value));
        }
        return (Boolean) value;
    }

    private static ExhaustionPolicy policy(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value instanceof ExhaustionPolicy) {
            return (ExhaustionPolicy) value;
        }
        if (value instanceof String) {
            return ExhaustionPolicy.parse((String) value);
        }
        throw new ConfigurationException(key, key + " must be one of SWALLOW, PROPAGATE but was " + describe(value));
    }

    private static ConfigurationException nonNegativeInteger(String key, Object value) {
        return new ConfigurationException(key, key + " must be a non-negative integer but was " + describe(value));
    }

    private static ConfigurationException positiveNumber(String key, Object value) {
        return new ConfigurationException(key, key + " must be a positive number of milliseconds but was " + describe(value));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
