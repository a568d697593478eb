// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of executing a transaction.
 *
 * @param digest    the transaction digest
 * @param status    {@code "success"} or a failure status reported by the node
 * @param timestamp when the result was produced
 * @param effects   the execution effects, e.g. status and gas used
 */
public record TransactionResult(String digest, String status, Instant timestamp, Map<String, Object> effects) {

    public static final String STATUS_SUCCESS = "success";

    public TransactionResult {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        effects = effects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effects));
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
