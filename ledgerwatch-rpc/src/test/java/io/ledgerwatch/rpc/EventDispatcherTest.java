// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class EventDispatcherTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(EventDispatcher.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final EventDispatcher dispatcher = new EventDispatcher();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        List<String> received = new ArrayList<>();
        Subscription failing = new Subscription("nft_transfer-1", EventCategory.NFT_TRANSFER, null, event -> {
            throw new IllegalStateException("handler bug");
        });
        Subscription healthy = new Subscription("nft_transfer-2", EventCategory.NFT_TRANSFER, null,
                event -> received.add(event.type()));

        int delivered = dispatcher.dispatch(7L,
                List.of(ChainEvent.of(Map.of("type", "nft_transfer")), ChainEvent.of(Map.of("type", "nft_mint"))),
                List.of(failing, healthy));

        assertEquals(List.of("nft_transfer", "nft_mint"), received);
        assertEquals(2, delivered);
        List<ILoggingEvent> errors = appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
        assertEquals(2, errors.size());
        assertTrue(errors.get(0).getFormattedMessage().contains("nft_transfer-1"));
        assertTrue(errors.get(0).getFormattedMessage().contains("checkpoint 7"));
    }

    @Test
    void callbackCannotChangeWhatLaterSubscriptionsMatch() {
        // Given a callback that tries to rewrite the nested data of the shared event
        Map<String, Object> data = new HashMap<>();
        data.put("collection", "punks");
        ChainEvent event = ChainEvent.of(Map.of("type", "nft_transfer", "data", data));
        @SuppressWarnings("unchecked")
        Subscription tampering = new Subscription("nft_transfer-1", EventCategory.NFT_TRANSFER, null,
                e -> ((Map<String, Object>) e.get("data")).put("collection", "apes"));
        List<ChainEvent> received = new ArrayList<>();
        Subscription filtered = new Subscription("nft_transfer-2", EventCategory.NFT_TRANSFER,
                Map.of("data.collection", "punks"), received::add);

        // When
        int delivered = dispatcher.dispatch(3L, List.of(event), List.of(tampering, filtered));

        // Then the write fails in the first callback and the second still matches
        assertEquals(List.of(event), received);
        assertEquals(1, delivered);
        assertEquals(1, appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).count());
    }

    @Test
    void deliversInEventThenSubscriptionOrder() {
        List<String> order = new ArrayList<>();
        Subscription a = new Subscription("a", EventCategory.MOVE_EVENT, null, e -> order.add("a:" + e.get("n")));
        Subscription b = new Subscription("b", EventCategory.MOVE_EVENT, null, e -> order.add("b:" + e.get("n")));

        dispatcher.dispatch(1L,
                List.of(ChainEvent.of(Map.of("n", 1)), ChainEvent.of(Map.of("n", 2))),
                List.of(a, b));

        assertEquals(List.of("a:1", "b:1", "a:2", "b:2"), order);
    }

    @Test
    void skipsSubscriptionsThatDoNotMatch() {
        List<ChainEvent> received = new ArrayList<>();
        Subscription coins = new Subscription("c", EventCategory.TOKEN_TRANSFER,
                Map.of("data.amount", 100), received::add);

        int delivered = dispatcher.dispatch(1L, List.of(
                ChainEvent.of(Map.of("type", "coin", "data", Map.of("amount", 100))),
                ChainEvent.of(Map.of("type", "coin", "data", Map.of("amount", 200))),
                ChainEvent.of(Map.of("type", "epoch", "data", Map.of("amount", 100)))),
                List.of(coins));

        assertEquals(1, delivered);
        assertEquals(1, received.size());
    }
}
