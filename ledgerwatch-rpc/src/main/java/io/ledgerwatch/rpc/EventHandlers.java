// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers handlers by event name on a {@link LedgerWatch} client.
 *
 * <p>A name that matches an {@link EventCategory} (by constant or wire name,
 * case-insensitively) subscribes to that category. Any other name subscribes
 * to {@link EventCategory#CUSTOM} with an extra {@code "type"} filter equal to
 * the name, so only events of exactly that type reach the handler.
 *
 * <pre>{@code
 * EventHandlers handlers = new EventHandlers(client);
 * handlers.on("nft_transfer", event -> reply(EventFormatter.format(event)));
 * handlers.on("0x2::auction::BidPlaced", this::onBid);
 * }</pre>
 *
 * <p>Registering the same name again replaces the previous handler.
 */
public final class EventHandlers {

    private static final Logger log = LoggerFactory.getLogger(EventHandlers.class);

    private final LedgerWatch client;
    private final Map<String, String> subscriptionIds = new LinkedHashMap<>();

    public EventHandlers(final LedgerWatch client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public String on(final String eventName, final Consumer<ChainEvent> handler) {
        return on(eventName, handler, null);
    }

    /**
     * Registers a handler for an event name.
     *
     * @param eventName a category name or a raw event type
     * @param handler   invoked for every matching event
     * @param filter    additional expected values keyed by (dotted) path, or null
     * @return the subscription id
     */
    public synchronized String on(
            final String eventName,
            final Consumer<ChainEvent> handler,
            final @Nullable Map<String, ?> filter) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(handler, "handler");

        final Optional<EventCategory> known = EventCategory.fromName(eventName);
        final EventCategory category = known.orElse(EventCategory.CUSTOM);
        final Map<String, Object> effective = new LinkedHashMap<>();
        if (filter != null) {
            effective.putAll(filter);
        }
        if (known.isEmpty()) {
            effective.put("type", eventName);
        }

        final Consumer<ChainEvent> logged = event -> {
            log.debug("Handling '{}' event of type '{}'", eventName, event.type());
            handler.accept(event);
        };
        final String id = client.subscribe(category, logged, effective.isEmpty() ? null : effective);
        // subscribe before removing the old handler so polling keeps running
        final String previous = subscriptionIds.put(eventName, id);
        if (previous != null) {
            client.unsubscribe(previous);
            log.info("Replaced handler for '{}'", eventName);
        }
        return id;
    }

    /**
     * Removes the handler registered under a name.
     *
     * @param eventName the name passed to {@link #on}
     * @return false if no handler was registered under that name
     */
    public synchronized boolean remove(final String eventName) {
        final String id = subscriptionIds.remove(eventName);
        return id != null && client.unsubscribe(id);
    }

    public synchronized List<String> names() {
        return List.copyOf(subscriptionIds.keySet());
    }

    public synchronized Optional<String> subscriptionId(final String eventName) {
        return Optional.ofNullable(subscriptionIds.get(eventName));
    }
}
