// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-delay retry budget for RPC calls.
 *
 * <p>A call is attempted at most {@code maxAttempts} times, sleeping
 * {@code delay} between consecutive attempts. There is no sleep after the final
 * attempt.
 *
 * <pre>{@code
 * // Default: 3 attempts, 2 seconds apart
 * RetryPolicy policy = RetryPolicy.defaults();
 *
 * // Fail fast
 * RetryPolicy once = RetryPolicy.noRetry();
 * }</pre>
 *
 * @param maxAttempts total attempts including the first (must be &gt;= 1)
 * @param delay       pause between attempts (must not be negative)
 * @see RpcRetry
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    /** Default number of attempts: 3. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** Default delay between attempts: 2s. */
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(2);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative, got: " + delay);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }
}
