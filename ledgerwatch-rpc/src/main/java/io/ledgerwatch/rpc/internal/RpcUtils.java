// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerwatch.core.error.RpcException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Internal helpers shared by the RPC layer: the shared {@link ObjectMapper},
 * JSON-RPC error data extraction and scalar decoding.
 *
 * <p><strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance.
     * <p>
     * ObjectMapper is expensive to create and thread-safe after configuration,
     * so a single instance is used across all RPC classes.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Flattens the {@code data} member of a JSON-RPC error object to a string.
     *
     * <p>Strings are returned as-is; maps and lists are searched depth-first for
     * the first string; anything else falls back to {@code toString()}.
     *
     * @param dataValue the error data object
     * @return extracted error data string, or null if dataValue is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            if (item instanceof String s) {
                return s;
            }
            if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
                final String nested = extractErrorData(item);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return fallback.toString();
    }

    /**
     * Decodes a sequence number that the node may send as a JSON number or a
     * decimal string (large u64 values are usually strings).
     *
     * @param method the RPC method, for error messages
     * @param value  the raw result value
     * @return the decoded value
     * @throws RpcException if the value is not a non-negative integer
     */
    public static long decodeSequenceNumber(final String method, final Object value) {
        if (value instanceof Number n) {
            final long decoded = n.longValue();
            if (decoded < 0) {
                throw new RpcException(-32603, "Negative sequence number from " + method + ": " + value, null);
            }
            return decoded;
        }
        final String text = String.valueOf(value).trim();
        try {
            final long decoded = Long.parseLong(text);
            if (decoded < 0) {
                throw new RpcException(-32603, "Negative sequence number from " + method + ": " + text, null);
            }
            return decoded;
        } catch (NumberFormatException e) {
            throw new RpcException(-32603, "Invalid sequence number from " + method + ": " + text, null);
        }
    }

    /**
     * Converts a decoded JSON value to a string-keyed map.
     *
     * @param value the value
     * @return the map, or null if value is null
     * @throws IllegalArgumentException if the value is not an object
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Converts a decoded JSON array of objects to a list of maps, skipping
     * elements that are not objects.
     *
     * @param value the value
     * @return the list, empty if value is null
     */
    public static List<Map<String, Object>> asListOfMaps(final Object value) {
        final List<Map<String, Object>> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?>) {
                    out.add(asMap(item));
                }
            }
        }
        return out;
    }

    /**
     * Safely converts object to string, returning null for null inputs.
     */
    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }
}
