// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An on-chain object as returned by object queries.
 *
 * <p>The node wraps each object as {@code {"data": {...}}} or, for objects that
 * do not exist or were deleted, {@code {"error": {...}}}. Common fields are
 * lifted out of {@code data}; the whole response entry stays available through
 * {@link #raw()}.
 *
 * @param objectId the object id, or null when the lookup failed
 * @param version  the object version, or null
 * @param digest   the object digest, or null
 * @param type     the object's type tag, when requested
 * @param owner    the owner descriptor (string or object), when requested
 * @param content  the parsed contents, when requested
 * @param raw      the response entry as received
 */
public record LedgerObject(
        @Nullable String objectId,
        @Nullable String version,
        @Nullable String digest,
        @Nullable String type,
        @Nullable Object owner,
        @Nullable Map<String, Object> content,
        Map<String, Object> raw) {

    public LedgerObject {
        Objects.requireNonNull(raw, "raw");
        raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    /**
     * Parses a response entry.
     *
     * @param entry the {@code {"data": ...}} or {@code {"error": ...}} map
     * @return the parsed object
     */
    @SuppressWarnings("unchecked")
    public static LedgerObject fromRpc(final Map<String, Object> entry) {
        final Object data = entry.get("data");
        if (!(data instanceof Map<?, ?> dataMap)) {
            return new LedgerObject(null, null, null, null, null, null, entry);
        }
        final Object content = dataMap.get("content");
        return new LedgerObject(
                string(dataMap.get("objectId")),
                string(dataMap.get("version")),
                string(dataMap.get("digest")),
                string(dataMap.get("type")),
                dataMap.get("owner"),
                content instanceof Map<?, ?> ? (Map<String, Object>) content : null,
                entry);
    }

    /**
     * Returns whether the node returned object data rather than an error.
     *
     * @return true if the object exists
     */
    public boolean exists() {
        return raw.get("data") instanceof Map<?, ?>;
    }

    /**
     * Returns the error descriptor for failed lookups.
     *
     * @return the error object, or null
     */
    public @Nullable Object error() {
        return raw.get("error");
    }

    private static @Nullable String string(final @Nullable Object value) {
        return value == null ? null : value.toString();
    }
}
