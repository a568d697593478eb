// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.error;

/**
 * Thrown when the node cannot be reached or its answer cannot be read.
 *
 * <p>
 * A single failed attempt (connection refused, timeout, non-2xx HTTP status,
 * malformed response body) is reported with an attempt count of 1. When the
 * retry budget is exhausted, the final exception carries the total number of
 * attempts, the last failure as its cause, and every earlier failure in
 * {@link #getSuppressed()}, in attempt order.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     client.latestCheckpoint();
 * } catch (TransportException e) {
 *     log.warn("Node unreachable after {} attempts", e.attemptCount(), e);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TransportException extends LedgerWatchException {

    /** Explicit UID for serialization stability across class evolution. */
    private static final long serialVersionUID = 1L;

    private final int attemptCount;

    public TransportException(final String message, final Throwable cause) {
        this(message, 1, cause);
    }

    public TransportException(final String message) {
        super(message);
        this.attemptCount = 1;
    }

    public TransportException(final String message, final int attemptCount, final Throwable cause) {
        super(message, cause);
        this.attemptCount = attemptCount;
    }

    /**
     * Creates the exception raised once every attempt of a call has failed.
     *
     * @param method       the RPC method that was attempted
     * @param attemptCount the number of attempts made
     * @param last         the final failure
     * @return a new exception whose cause is {@code last}
     */
    public static TransportException exhausted(final String method, final int attemptCount, final Throwable last) {
        return new TransportException(
                String.format("RPC call %s failed after %d attempts: %s", method, attemptCount, last.getMessage()),
                attemptCount,
                last);
    }

    /**
     * Returns the number of attempts made before giving up.
     *
     * @return the number of attempts
     */
    public int attemptCount() {
        return attemptCount;
    }
}
