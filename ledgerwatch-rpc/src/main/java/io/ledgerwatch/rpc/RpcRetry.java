// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal utility for retrying RPC calls with a fixed delay.
 *
 * <p>
 * <strong>Retry Conditions:</strong>
 * <ul>
 * <li>✅ {@link TransportException} - connection errors, timeouts, non-2xx
 * statuses, unreadable bodies</li>
 * <li>❌ {@link RpcException} - the node answered with an error object</li>
 * <li>❌ any other runtime exception - programming or decoding errors</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Interruption:</strong> If the calling thread is interrupted
 * while waiting between attempts, the interrupt flag is restored and a
 * {@link TransportException} is raised immediately.
 *
 * @see RetryPolicy
 */
final class RpcRetry {

    private static final Logger log = LoggerFactory.getLogger(RpcRetry.class);

    private RpcRetry() {
    }

    /**
     * Executes the supplier, retrying transport failures.
     *
     * @param <T>      the return type
     * @param method   the RPC method, for messages
     * @param supplier the operation to retry
     * @param policy   the retry budget
     * @return the result from the supplier
     * @throws TransportException once {@code policy.maxAttempts()} attempts have
     *                            failed, with the last failure as cause and earlier
     *                            ones suppressed
     * @throws RpcException       on the first remote error, without retrying
     */
    static <T> T run(final String method, final Supplier<T> supplier, final RetryPolicy policy) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(policy, "policy");
        final List<TransportException> failures = new ArrayList<>();
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return supplier.get();
            } catch (TransportException e) {
                failures.add(e);
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                log.warn("RPC call {} failed (attempt {}/{}), retrying in {} ms: {}",
                        method, attempt, policy.maxAttempts(), policy.delay().toMillis(), e.getMessage());
            }

            try {
                Thread.sleep(policy.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw withHistory(
                        new TransportException("Interrupted while retrying RPC call " + method, attempt,
                                failures.get(failures.size() - 1)),
                        failures);
            }
        }
        final TransportException last = failures.get(failures.size() - 1);
        throw withHistory(TransportException.exhausted(method, failures.size(), last), failures);
    }

    private static TransportException withHistory(
            final TransportException result,
            final List<TransportException> failures) {
        for (int i = 0; i < failures.size() - 1; i++) {
            result.addSuppressed(failures.get(i));
        }
        return result;
    }
}
