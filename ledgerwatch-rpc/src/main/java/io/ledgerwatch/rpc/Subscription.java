// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import io.ledgerwatch.core.event.EventMatcher;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One caller's interest in ledger events.
 *
 * <p>Owned by {@link SubscriptionRegistry}. Two subscriptions with identical
 * category, filter and callback are still distinct and both fire.
 *
 * @param id       unique identifier assigned at registration
 * @param category the category predicate
 * @param filter   expected values keyed by (dotted) path, in insertion order
 * @param callback invoked once per matching event; its failures are logged, never propagated
 */
public record Subscription(
        String id,
        EventCategory category,
        Map<String, Object> filter,
        Consumer<ChainEvent> callback) {

    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(callback, "callback");
        filter = filter == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
    }

    /**
     * Tests an event against this subscription's category and filter.
     *
     * @param event the event
     * @return true if the callback should receive the event
     */
    public boolean matches(final ChainEvent event) {
        return EventMatcher.matches(event, category, filter);
    }
}
