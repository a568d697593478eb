// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when the node answers a JSON-RPC request with an error object.
 *
 * <p>
 * Remote errors are never retried: the node received and understood the
 * request, so repeating it would produce the same answer.
 *
 * <p>
 * <strong>Common Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32000 to -32099</strong>: Server/implementation-specific
 * errors</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends LedgerWatchException {

    /** Code used when a method that must return a value returned {@code null}. */
    public static final int NULL_RESULT_CODE = -32603;

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId) {
        super(augmentMessage(message, requestId));
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data) {
        this(code, message, data, null);
    }

    /**
     * Creates an exception for an RPC method that returned {@code null} where a
     * value was required.
     *
     * @param method the RPC method name
     * @return a new exception
     */
    public static RpcException fromNullResult(final String method) {
        return new RpcException(NULL_RESULT_CODE, "RPC method " + method + " returned null result", null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
