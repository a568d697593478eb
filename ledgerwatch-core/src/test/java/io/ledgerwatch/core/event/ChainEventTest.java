// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChainEventTest {

    @Test
    void fieldsAreCopiedAndImmutable() {
        Map<String, Object> source = new HashMap<>();
        source.put("type", "transfer");
        ChainEvent event = ChainEvent.of(source);

        source.put("type", "changed");

        assertEquals("transfer", event.type());
        assertThrows(UnsupportedOperationException.class, () -> event.fields().put("x", 1));
    }

    @Test
    void nestedMapsAndListsAreCopiedAndImmutable() {
        Map<String, Object> data = new HashMap<>();
        data.put("amount", 5);
        data.put("memo", null);
        List<Object> tags = new ArrayList<>(List.of("rare"));
        data.put("tags", tags);
        ChainEvent event = ChainEvent.of(Map.of("type", "transfer", "data", data));

        data.put("amount", 6);
        tags.add("common");

        Map<?, ?> nested = (Map<?, ?>) event.get("data");
        assertEquals(5, nested.get("amount"));
        assertTrue(nested.containsKey("memo"));
        assertEquals(List.of("rare"), nested.get("tags"));
        assertThrows(UnsupportedOperationException.class, nested::clear);
        assertThrows(UnsupportedOperationException.class, () -> ((List<?>) nested.get("tags")).clear());
    }

    @Test
    void accessorsReadTopLevelFields() {
        ChainEvent event = ChainEvent.of(Map.of("type", "transfer", "sender", "0xabc"));

        assertEquals("0xabc", event.get("sender"));
        assertTrue(event.has("sender"));
        assertFalse(event.has("recipient"));
    }
}
