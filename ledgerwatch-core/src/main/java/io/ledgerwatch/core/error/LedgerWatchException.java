// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.error;

/**
 * Base runtime exception for all LedgerWatch failures.
 *
 * <p>
 * This sealed class is the root of the exception hierarchy, so callers of the
 * gateway operations can catch every library failure with a single clause
 * while still switching on the concrete type.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * LedgerWatchException
 * ├── {@link TransportException} - network failures, unparseable responses, retry budget exhausted
 * ├── {@link RpcException} - well-formed error responses from the node
 * └── {@link ConfigurationException} - missing signing credential, invalid settings
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.getObject(objectId);
 * } catch (RpcException e) {
 *     // The node rejected the request
 * } catch (TransportException e) {
 *     // The node could not be reached after e.attemptCount() attempts
 * } catch (LedgerWatchException e) {
 *     // Any other LedgerWatch error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class LedgerWatchException extends RuntimeException
        permits TransportException,
        RpcException,
        ConfigurationException {

    public LedgerWatchException(final String message) {
        super(message);
    }

    public LedgerWatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
