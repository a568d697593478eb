// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Retrying JSON-RPC transport: a {@link LedgerProvider} plus a {@link RetryPolicy}.
 *
 * <p>Transport failures are retried within the policy's budget; remote errors
 * propagate on the first occurrence. The decoding helpers follow three null
 * strategies:
 * <ul>
 *   <li>{@link #call} - throws {@link RpcException} if the result is null</li>
 *   <li>{@link #callNullable} - returns null if the result is null</li>
 *   <li>{@link #callWithDefault} - returns a default value if the result is null</li>
 * </ul>
 *
 * <p>The transport holds no mutable state besides its configuration and is
 * safe for concurrent use.
 *
 * @since 0.1.0
 */
public final class RpcTransport {

    private final LedgerProvider provider;
    private final RetryPolicy retryPolicy;
    private final Runnable ensureOpen;

    public RpcTransport(final LedgerProvider provider, final RetryPolicy retryPolicy) {
        this(provider, retryPolicy, () -> { });
    }

    /**
     * Creates a transport with an open-state check run before every call.
     *
     * @param provider    the single-attempt provider
     * @param retryPolicy the retry budget
     * @param ensureOpen  a runnable that throws if the owning client is closed
     */
    public RpcTransport(final LedgerProvider provider, final RetryPolicy retryPolicy, final Runnable ensureOpen) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.ensureOpen = Objects.requireNonNull(ensureOpen, "ensureOpen");
    }

    /**
     * Sends a request, retrying transport failures.
     *
     * @param method the RPC method name
     * @param params the positional parameters
     * @return the successful response
     * @throws TransportException if every attempt failed
     * @throws RpcException       if the node returned an error object
     */
    public JsonRpcResponse send(final String method, final List<?> params) {
        ensureOpen.run();
        return RpcRetry.run(method, () -> provider.send(method, params), retryPolicy);
    }

    /**
     * Invokes an RPC method and decodes the result, throwing if null.
     *
     * @param method  the RPC method name
     * @param params  the method parameters
     * @param decoder decodes the raw JSON result
     * @param <T>     the return type
     * @return the decoded result
     * @throws RpcException if the result is null
     */
    public <T> T call(final String method, final List<?> params, final Function<Object, T> decoder) {
        final Object result = send(method, params).result();
        if (result == null) {
            throw RpcException.fromNullResult(method);
        }
        return decoder.apply(result);
    }

    public <T> @Nullable T callNullable(final String method, final List<?> params, final Function<Object, T> decoder) {
        final Object result = send(method, params).result();
        if (result == null) {
            return null;
        }
        return decoder.apply(result);
    }

    public <T> T callWithDefault(
            final String method,
            final List<?> params,
            final Function<Object, T> decoder,
            final T defaultValue) {
        final Object result = send(method, params).result();
        if (result == null) {
            return defaultValue;
        }
        return decoder.apply(result);
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }
}
