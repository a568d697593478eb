// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.LogSanitizer;
import io.ledgerwatch.core.error.ConfigurationException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable client configuration.
 *
 * <p>Built explicitly and handed to {@link LedgerWatch}; nothing is read from
 * process-wide state after construction.
 *
 * <table border="1">
 * <tr><th>Setting</th><th>Environment variable</th><th>Default</th></tr>
 * <tr><td>rpcUrl</td><td>{@value #ENV_RPC_URL}</td><td>{@value #DEFAULT_RPC_URL}</td></tr>
 * <tr><td>signingKey</td><td>{@value #ENV_SIGNING_KEY}</td><td>unset</td></tr>
 * <tr><td>pollingInterval</td><td>{@value #ENV_POLLING_INTERVAL_MS}</td><td>5s</td></tr>
 * <tr><td>maxAttempts</td><td>{@value #ENV_MAX_RETRIES}</td><td>3</td></tr>
 * <tr><td>retryDelay</td><td>{@value #ENV_RETRY_DELAY_MS}</td><td>2s</td></tr>
 * <tr><td>stopTimeout</td><td>{@value #ENV_STOP_TIMEOUT_MS}</td><td>5s</td></tr>
 * </table>
 *
 * @param rpcUrl          the node's JSON-RPC endpoint
 * @param signingKey      credential required to execute transactions, or null
 * @param pollingInterval pause between polling cycles
 * @param maxAttempts     RPC attempts per call, including the first
 * @param retryDelay      pause between RPC attempts and after a failed polling cycle
 * @param stopTimeout     how long unsubscribing the last subscription waits for the worker
 * @param connectTimeout  HTTP connect timeout
 * @param readTimeout     HTTP request timeout
 * @since 0.1.0
 */
public record LedgerWatchConfig(
        String rpcUrl,
        @Nullable String signingKey,
        Duration pollingInterval,
        int maxAttempts,
        Duration retryDelay,
        Duration stopTimeout,
        Duration connectTimeout,
        Duration readTimeout) {

    private static final Logger log = LoggerFactory.getLogger(LedgerWatchConfig.class);

    public static final String ENV_RPC_URL = "LEDGERWATCH_RPC_URL";
    public static final String ENV_SIGNING_KEY = "LEDGERWATCH_SIGNING_KEY";
    public static final String ENV_POLLING_INTERVAL_MS = "LEDGERWATCH_POLLING_INTERVAL_MS";
    public static final String ENV_MAX_RETRIES = "LEDGERWATCH_MAX_RETRIES";
    public static final String ENV_RETRY_DELAY_MS = "LEDGERWATCH_RETRY_DELAY_MS";
    public static final String ENV_STOP_TIMEOUT_MS = "LEDGERWATCH_STOP_TIMEOUT_MS";

    public static final String DEFAULT_RPC_URL = "https://fullnode.devnet.sui.io:443";
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    public LedgerWatchConfig {
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalArgumentException("rpcUrl must not be blank");
        }
        signingKey = signingKey == null || signingKey.isBlank() ? null : signingKey;
        requirePositive("pollingInterval", pollingInterval);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        requirePositive("retryDelay", retryDelay);
        requirePositive("stopTimeout", stopTimeout);
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("readTimeout", readTimeout);
    }

    public static LedgerWatchConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from the process environment.
     *
     * @return the configuration
     * @throws ConfigurationException if a numeric variable cannot be parsed
     */
    public static LedgerWatchConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from the given variables, falling back to defaults
     * for absent or blank entries.
     *
     * @param env the variables
     * @return the configuration
     * @throws ConfigurationException if a numeric variable cannot be parsed or is out of range
     */
    public static LedgerWatchConfig fromEnvironment(final Map<String, String> env) {
        final Builder builder = builder();
        final String url = env.get(ENV_RPC_URL);
        if (url != null && !url.isBlank()) {
            builder.rpcUrl(url.trim());
        }
        builder.signingKey(env.get(ENV_SIGNING_KEY));
        final Long pollingMs = parseLong(env, ENV_POLLING_INTERVAL_MS);
        if (pollingMs != null) {
            builder.pollingInterval(Duration.ofMillis(pollingMs));
        }
        final Long retries = parseLong(env, ENV_MAX_RETRIES);
        if (retries != null) {
            builder.maxAttempts((int) Math.max(Integer.MIN_VALUE, Math.min(retries, Integer.MAX_VALUE)));
        }
        final Long retryMs = parseLong(env, ENV_RETRY_DELAY_MS);
        if (retryMs != null) {
            builder.retryDelay(Duration.ofMillis(retryMs));
        }
        final Long stopMs = parseLong(env, ENV_STOP_TIMEOUT_MS);
        if (stopMs != null) {
            builder.stopTimeout(Duration.ofMillis(stopMs));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid LedgerWatch environment configuration: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasSigningKey() {
        return signingKey != null;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, retryDelay);
    }

    /**
     * Logs a warning for settings that will make some operations fail.
     */
    public void validate() {
        if (!hasSigningKey()) {
            log.warn("{} not set. Transaction execution will fail.", ENV_SIGNING_KEY);
        }
    }

    @Override
    public String toString() {
        return "LedgerWatchConfig{"
                + "rpcUrl=" + rpcUrl
                + ", signingKey=" + LogSanitizer.mask(signingKey)
                + ", pollingInterval=" + pollingInterval
                + ", maxAttempts=" + maxAttempts
                + ", retryDelay=" + retryDelay
                + ", stopTimeout=" + stopTimeout
                + ", connectTimeout=" + connectTimeout
                + ", readTimeout=" + readTimeout
                + "}";
    }

    private static void requirePositive(final String name, final Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    private static @Nullable Long parseLong(final Map<String, String> env, final String key) {
        final String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got: " + raw, e);
        }
    }

    /**
     * Builder for {@link LedgerWatchConfig}; every setting starts at its default.
     */
    public static final class Builder {
        private String rpcUrl = DEFAULT_RPC_URL;
        private @Nullable String signingKey;
        private Duration pollingInterval = DEFAULT_POLLING_INTERVAL;
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private Duration retryDelay = RetryPolicy.DEFAULT_DELAY;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;

        private Builder() {}

        public Builder rpcUrl(final String rpcUrl) {
            this.rpcUrl = rpcUrl;
            return this;
        }

        public Builder signingKey(final @Nullable String signingKey) {
            this.signingKey = signingKey;
            return this;
        }

        public Builder pollingInterval(final Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelay(final Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder stopTimeout(final Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public LedgerWatchConfig build() {
            return new LedgerWatchConfig(
                    rpcUrl, signingKey, pollingInterval, maxAttempts, retryDelay, stopTimeout,
                    connectTimeout, readTimeout);
        }
    }
}
