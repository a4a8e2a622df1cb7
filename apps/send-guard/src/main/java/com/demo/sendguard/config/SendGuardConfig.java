package com.demo.sendguard.config;

/**
 * Policy knobs of a guarded send handler. Immutable; validated once by {@link ConfigValidator}.
 *
 * @param retryAttempts              additional attempts after the first one
 * @param retryDelayBaseMillis       backoff base for send retries
 * @param errorMessageText           notice posted to the channel once retries are exhausted
 * @param logSensitiveInfo           include channel and message ids in log output
 * @param recallRetryAttempts        additional recall attempts after the first one
 * @param recallRetryDelayBaseMillis backoff base for recall retries
 * @param exhaustionPolicy           caller-visible outcome after exhaustion
 */
public record SendGuardConfig(
    int retryAttempts,
    long retryDelayBaseMillis,
    String errorMessageText,
    boolean logSensitiveInfo,
    int recallRetryAttempts,
    long recallRetryDelayBaseMillis,
    ExhaustionPolicy exhaustionPolicy
) {
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY_BASE_MILLIS = 1000;
    public static final String DEFAULT_ERROR_MESSAGE = "Sorry, a network error occurred and the message was recalled.";
    public static final boolean DEFAULT_LOG_SENSITIVE_INFO = false;
    public static final int DEFAULT_RECALL_RETRY_ATTEMPTS = 2;
    public static final long DEFAULT_RECALL_RETRY_DELAY_BASE_MILLIS = 500;

    public static SendGuardConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .retryAttempts(retryAttempts)
                .retryDelayBaseMillis(retryDelayBaseMillis)
                .errorMessageText(errorMessageText)
                .logSensitiveInfo(logSensitiveInfo)
                .recallRetryAttempts(recallRetryAttempts)
                .recallRetryDelayBaseMillis(recallRetryDelayBaseMillis)
                .exhaustionPolicy(exhaustionPolicy);
    }

    public static final class Builder {
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private long retryDelayBaseMillis = DEFAULT_RETRY_DELAY_BASE_MILLIS;
        private String errorMessageText = DEFAULT_ERROR_MESSAGE;
        private boolean logSensitiveInfo = DEFAULT_LOG_SENSITIVE_INFO;
        private int recallRetryAttempts = DEFAULT_RECALL_RETRY_ATTEMPTS;
        private long recallRetryDelayBaseMillis = DEFAULT_RECALL_RETRY_DELAY_BASE_MILLIS;
        private ExhaustionPolicy exhaustionPolicy = ExhaustionPolicy.SWALLOW;

        private Builder() {
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelayBaseMillis(long retryDelayBaseMillis) {
            this.retryDelayBaseMillis = retryDelayBaseMillis;
            return this;
        }

        public Builder errorMessageText(String errorMessageText) {
            this.errorMessageText = errorMessageText;
            return this;
        }

        public Builder logSensitiveInfo(boolean logSensitiveInfo) {
            this.logSensitiveInfo = logSensitiveInfo;
            return this;
        }

        public Builder recallRetryAttempts(int recallRetryAttempts) {
            this.recallRetryAttempts = recallRetryAttempts;
            return this;
        }

        public Builder recallRetryDelayBaseMillis(long recallRetryDelayBaseMillis) {
            this.recallRetryDelayBaseMillis = recallRetryDelayBaseMillis;
            return this;
        }

        public Builder exhaustionPolicy(ExhaustionPolicy exhaustionPolicy) {
            this.exhaustionPolicy = exhaustionPolicy;
            return this;
        }

        /** Builds without validating; handler construction runs {@link ConfigValidator}. */
        public SendGuardConfig build() {
            return new SendGuardConfig(retryAttempts, retryDelayBaseMillis, errorMessageText, logSensitiveInfo,
                    recallRetryAttempts, recallRetryDelayBaseMillis, exhaustionPolicy);
        }
    }
}
