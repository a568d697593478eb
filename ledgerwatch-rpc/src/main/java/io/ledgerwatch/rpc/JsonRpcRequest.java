// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JsonRpcRequest(String jsonrpc, String id, String method, List<?> params) {

    /** Protocol version tag sent with every request. */
    public static final String VERSION = "2.0";
}
