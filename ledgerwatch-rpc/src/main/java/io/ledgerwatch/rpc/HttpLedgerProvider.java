// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.ledgerwatch.core.DebugLogger;
import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import io.ledgerwatch.rpc.internal.RpcUtils;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link LedgerProvider} over HTTP POST using the JDK {@link HttpClient}.
 *
 * <p>Every call makes one attempt. Connection failures, timeouts, non-2xx
 * statuses and unreadable bodies raise {@link TransportException}; error objects
 * raise {@link RpcException}.
 */
public final class HttpLedgerProvider implements LedgerProvider {

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpLedgerProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request =
                new JsonRpcRequest(JsonRpcRequest.VERSION, String.valueOf(requestId), method, safeParams);

        final String payload = serialize(request);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, httpRequest, requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc("[RPC-ERROR] %s status=%d (%dus)", method, response.statusCode(), durationMicros);
            throw new TransportException(
                    "HTTP error for method " + method + ": " + response.statusCode());
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, response.body());
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(
                    "[RPC-ERROR] %s code=%d message=%s (%dus)", method, err.code(), err.message(), durationMicros);
            final String message = err.message() == null ? "RPC error for method " + method : err.message();
            throw new RpcException(err.code(), message, RpcUtils.extractErrorData(err.data()), requestId);
        }

        DebugLogger.logRpc("[RPC] %s params=%s (%dus)", method, payload, durationMicros);
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request) {
        try {
            return RpcUtils.MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Unable to serialize JSON-RPC request for " + request.method(), e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<String> execute(final String method, final HttpRequest request, final long requestId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during JSON-RPC call " + method + " (id " + requestId + ")", e);
        } catch (IOException e) {
            throw new TransportException(
                    "Network error during JSON-RPC call " + method + " (id " + requestId + "): " + e.getMessage(), e);
        }
    }

    private JsonRpcResponse parseResponse(final String method, final String body) {
        final JsonRpcResponse parsed;
        try {
            parsed = RpcUtils.MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new TransportException("Unable to parse JSON-RPC response for method " + method, e);
        }
        if (parsed == null) {
            throw new TransportException("Empty JSON-RPC response for method " + method);
        }
        return parsed;
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpLedgerProvider build() {
            return new HttpLedgerProvider(new RpcConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
