// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP settings for {@link HttpLedgerProvider}.
 *
 * @param url            the JSON-RPC endpoint
 * @param connectTimeout the connection timeout
 * @param readTimeout    the per-request timeout
 * @param headers        extra request headers
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
