// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.event;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Decides whether an event satisfies a subscription.
 *
 * <p>
 * An event matches when both hold:
 * <ol>
 * <li>the category predicate accepts the event's {@code type} (see
 * {@link EventCategory#accepts(String)}), and</li>
 * <li>every filter entry resolves to an equal value in the event.</li>
 * </ol>
 *
 * <p>
 * Filter keys without a dot are looked up directly on the event. Dotted keys
 * such as {@code "data.nested.value"} descend one segment at a time; a missing
 * segment or an intermediate value that is not an object fails the match.
 * Two numbers are equal when their values are, whatever their boxed type:
 * {@code Integer 100}, {@code Long 100} and {@code Double 100.0} all match.
 * Every other leaf is compared with {@link Objects#equals}, so {@code "100"}
 * never matches the number {@code 100}.
 *
 * <p>All methods are pure and thread-safe.
 *
 * @since 0.1.0
 */
public final class EventMatcher {

    private EventMatcher() {
    }

    /**
     * Tests an event against a category and filter.
     *
     * @param event    the event
     * @param category the subscription category
     * @param filter   expected values keyed by (dotted) path; null or empty imposes no constraint
     * @return true if the event matches
     */
    public static boolean matches(
            final ChainEvent event,
            final EventCategory category,
            final @Nullable Map<String, ?> filter) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(category, "category");
        if (!category.accepts(event.type())) {
            return false;
        }
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            if (!entryMatches(event.fields(), entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean entryMatches(
            final Map<String, Object> fields,
            final String key,
            final @Nullable Object expected) {
        final Optional<ChainEvent.PathValue> actual = resolve(fields, key);
        return actual.isPresent() && valuesEqual(actual.get().value(), expected);
    }

    private static boolean valuesEqual(final @Nullable Object actual, final @Nullable Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            final BigDecimal left = toDecimal(a);
            final BigDecimal right = toDecimal(b);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
        }
        return Objects.equals(actual, expected);
    }

    // null for NaN and infinities
    private static @Nullable BigDecimal toDecimal(final Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            final double value = number.doubleValue();
            return Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * Resolves a key against an event tree.
     *
     * <p>A key without a dot is a direct lookup, so a top-level key that itself
     * contains no dots is never split.
     *
     * @param fields the event tree
     * @param path   a plain or dotted key
     * @return the leaf value, or empty if the path does not exist
     */
    public static Optional<ChainEvent.PathValue> resolve(final Map<String, ?> fields, final String path) {
        if (path.indexOf('.') < 0) {
            return fields.containsKey(path)
                    ? Optional.of(new ChainEvent.PathValue(fields.get(path)))
                    : Optional.empty();
        }
        Object current = fields;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.of(new ChainEvent.PathValue(current));
    }
}
