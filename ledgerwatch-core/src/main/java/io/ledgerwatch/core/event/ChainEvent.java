// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * A raw event as returned by the node.
 *
 * <p>
 * No schema is assumed beyond an optional {@code type} string; the remaining
 * content is the JSON tree decoded by Jackson ({@code Map}, {@code List},
 * {@code String}, {@code Number}, {@code Boolean} or {@code null} values).
 * The tree is copied on construction and every nested map and list is
 * unmodifiable, so callbacks sharing an event cannot change what others see.
 *
 * @param fields the decoded event object, in response order
 * @since 0.1.0
 */
public record ChainEvent(Map<String, Object> fields) {

    public ChainEvent {
        Objects.requireNonNull(fields, "fields");
        final Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> copy.put(key, freeze(value)));
        fields = Collections.unmodifiableMap(copy);
    }

    private static @Nullable Object freeze(final @Nullable Object value) {
        if (value instanceof Map<?, ?> map) {
            final Map<Object, @Nullable Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            final List<@Nullable Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Wraps a decoded event object.
     *
     * @param fields the event fields
     * @return a new event
     */
    public static ChainEvent of(final Map<String, Object> fields) {
        return new ChainEvent(fields);
    }

    /**
     * Returns the event's {@code type} field, or the empty string when it is
     * absent or not a string.
     *
     * @return the event type, never null
     */
    public String type() {
        final Object type = fields.get("type");
        return type instanceof String s ? s : "";
    }

    /**
     * Returns a top-level field.
     *
     * @param key the field name
     * @return the value, or null if absent or JSON null
     */
    public @Nullable Object get(final String key) {
        return fields.get(key);
    }

    /**
     * Returns whether a top-level field is present, even with a null value.
     *
     * @param key the field name
     * @return true if present
     */
    public boolean has(final String key) {
        return fields.containsKey(key);
    }

    /**
     * Resolves a dotted path such as {@code "data.amount"} against the event tree.
     *
     * @param path the dotted path
     * @return the resolved value wrapped in a {@link PathValue}, or empty when a
     *         segment is missing or an intermediate value is not an object
     * @see EventMatcher#resolve(Map, String)
     */
    public Optional<PathValue> resolve(final String path) {
        return EventMatcher.resolve(fields, path);
    }

    /**
     * Holder for a resolved leaf value, which may itself be JSON null.
     *
     * @param value the leaf value
     */
    public record PathValue(@Nullable Object value) {
    }
}
