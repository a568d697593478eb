// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import java.util.List;

/**
 * Low-level abstraction for sending one JSON-RPC request to a ledger node.
 *
 * <p>
 * A provider performs exactly one attempt per call. Retrying is layered on top
 * by {@link RpcTransport}, so implementations must report failures precisely:
 * <ul>
 * <li>{@link TransportException} for network-level failures and responses that
 * cannot be read; these are retried</li>
 * <li>{@link RpcException} for well-formed error responses; these are not</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. The
 * polling worker and gateway callers share one provider.
 *
 * @see HttpLedgerProvider
 * @see RpcTransport
 */
public interface LedgerProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name
     * @param params the positional parameters
     * @return the JSON-RPC response, never carrying an error
     * @throws TransportException if the node could not be reached or the answer could not be read
     * @throws RpcException       if the node returned an error object
     */
    JsonRpcResponse send(String method, List<?> params);

    /**
     * Closes this provider and releases any associated resources.
     * The default implementation does nothing.
     */
    @Override
    default void close() {
        // Default no-op for providers that don't need cleanup
    }
}
