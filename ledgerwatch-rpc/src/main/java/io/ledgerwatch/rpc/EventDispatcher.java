// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.DebugLogger;
import io.ledgerwatch.core.event.ChainEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offers events to subscriptions and invokes the callbacks of those that match.
 *
 * <p>Each callback runs inside its own try/catch: a failing subscriber is
 * logged with its subscription id and never prevents the remaining
 * subscriptions or events from being processed.
 */
final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    /**
     * Dispatches a checkpoint's events, in order, against one subscription snapshot.
     *
     * @param checkpoint    the checkpoint the events belong to, for logging
     * @param events        the events in node order
     * @param subscriptions the subscriptions to test, in registration order
     * @return the number of callbacks that completed normally
     */
    int dispatch(final long checkpoint, final List<ChainEvent> events, final List<Subscription> subscriptions) {
        int delivered = 0;
        for (ChainEvent event : events) {
            delivered += dispatch(checkpoint, event, subscriptions);
        }
        return delivered;
    }

    int dispatch(final long checkpoint, final ChainEvent event, final List<Subscription> subscriptions) {
        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            if (!subscription.matches(event)) {
                continue;
            }
            DebugLogger.logDispatch("[DISPATCH] checkpoint=%d subscription=%s type=%s",
                    checkpoint, subscription.id(), event.type());
            try {
                subscription.callback().accept(event);
                delivered++;
            } catch (Exception e) {
                log.error("Exception in event callback for subscription {} (checkpoint {}, event type '{}')",
                        subscription.id(), checkpoint, event.type(), e);
            }
        }
        return delivered;
    }
}
