// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import io.ledgerwatch.core.event.EventMatcher;
import io.ledgerwatch.rpc.internal.RpcUtils;
import io.ledgerwatch.rpc.model.LedgerObject;
import io.ledgerwatch.rpc.model.ObjectDataOptions;
import io.ledgerwatch.rpc.model.ObjectPage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultLedgerReaderTest {

    @Mock
    private LedgerProvider provider;

    private DefaultLedgerReader reader;

    @BeforeEach
    void setUp() {
        reader = new DefaultLedgerReader(new RpcTransport(provider, new RetryPolicy(1, Duration.ZERO)));
    }

    private static JsonRpcResponse result(final Object value) {
        return new JsonRpcResponse("2.0", value, null, "1");
    }

    private static Map<String, Object> objectEntry(final String id) {
        return Map.of("data", Map.of("objectId", id, "version", "3", "type", "0x2::nft::Nft"));
    }

    @Test
    void latestCheckpointDecodesStringSequenceNumber() {
        // Given
        when(provider.send(eq(LedgerMethods.GET_LATEST_CHECKPOINT_SEQUENCE_NUMBER), anyList()))
                .thenReturn(result("1048576"));

        // When / Then
        assertEquals(1_048_576L, reader.latestCheckpoint());
    }

    @Test
    void latestCheckpointRejectsGarbage() {
        when(provider.send(eq(LedgerMethods.GET_LATEST_CHECKPOINT_SEQUENCE_NUMBER), anyList()))
                .thenReturn(result("soon"));

        assertThrows(RpcException.class, reader::latestCheckpoint);
    }

    @Test
    void checkpointEventsAcceptsListOrDataEnvelope() {
        // Given
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(5L))))
                .thenReturn(result(List.of(Map.of("type", "transfer"), "junk")));
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(6L))))
                .thenReturn(result(Map.of("data", List.of(Map.of("type", "epoch")))));

        // When
        List<ChainEvent> plain = reader.checkpointEvents(5L);
        List<ChainEvent> wrapped = reader.checkpointEvents(6L);

        // Then
        assertEquals(1, plain.size());
        assertEquals("transfer", plain.get(0).type());
        assertEquals("epoch", wrapped.get(0).type());
    }

    @Test
    void checkpointEventsTreatsNullAsEmptyAndRejectsScalars() {
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(1L)))).thenReturn(result(null));
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(2L)))).thenReturn(result("x"));

        assertTrue(reader.checkpointEvents(1L).isEmpty());
        assertThrows(RpcException.class, () -> reader.checkpointEvents(2L));
    }

    @Test
    void decodedNumbersMatchFiltersByValue() throws Exception {
        // Given events decoded from node JSON, small and large amounts
        Object body = RpcUtils.MAPPER.readValue(
                "[{\"type\":\"transfer\",\"data\":{\"amount\":100}},"
                        + "{\"type\":\"transfer\",\"data\":{\"amount\":3000000000}}]",
                List.class);
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(7L)))).thenReturn(result(body));

        // When
        List<ChainEvent> events = reader.checkpointEvents(7L);

        // Then the same filter type works regardless of magnitude
        assertTrue(EventMatcher.matches(events.get(0), EventCategory.MOVE_EVENT, Map.of("data.amount", 100L)));
        assertTrue(EventMatcher.matches(events.get(0), EventCategory.MOVE_EVENT, Map.of("data.amount", 100)));
        assertTrue(EventMatcher.matches(events.get(1), EventCategory.MOVE_EVENT, Map.of("data.amount", 3_000_000_000L)));
        assertFalse(EventMatcher.matches(events.get(1), EventCategory.MOVE_EVENT, Map.of("data.amount", "3000000000")));
    }

    @Test
    void decodedEventsAreImmutableAllTheWayDown() throws Exception {
        Object body = RpcUtils.MAPPER.readValue(
                "[{\"type\":\"nft_transfer\",\"data\":{\"tags\":[\"a\"],\"owner\":{\"id\":\"0x1\"}}}]",
                List.class);
        when(provider.send(eq(LedgerMethods.GET_CHECKPOINT_EVENTS), eq(List.of(8L)))).thenReturn(result(body));

        ChainEvent event = reader.checkpointEvents(8L).get(0);
        Map<?, ?> data = (Map<?, ?>) event.get("data");

        assertThrows(UnsupportedOperationException.class, data::clear);
        assertThrows(UnsupportedOperationException.class, () -> ((List<?>) data.get("tags")).clear());
        assertThrows(UnsupportedOperationException.class, () -> ((Map<?, ?>) data.get("owner")).clear());
    }

    @Test
    @SuppressWarnings("unchecked")
    void getTransactionBlockRequestsEffectsEventsAndObjectChanges() {
        // Given
        ArgumentCaptor<List<?>> params = ArgumentCaptor.forClass(List.class);
        when(provider.send(eq(LedgerMethods.GET_TRANSACTION_BLOCK), params.capture()))
                .thenReturn(result(Map.of("digest", "D1")));

        // When
        Map<String, Object> block = reader.getTransactionBlock("D1");

        // Then
        assertEquals("D1", block.get("digest"));
        assertEquals("D1", params.getValue().get(0));
        Map<String, Object> options = (Map<String, Object>) params.getValue().get(1);
        assertEquals(Boolean.TRUE, options.get("showEffects"));
        assertEquals(Boolean.TRUE, options.get("showEvents"));
        assertEquals(Boolean.TRUE, options.get("showObjectChanges"));
    }

    @Test
    void getObjectSendsDefaultOptions() {
        // Given
        when(provider.send(eq(LedgerMethods.GET_OBJECT), eq(List.of("0x1", ObjectDataOptions.defaults().toRpcParam()))))
                .thenReturn(result(objectEntry("0x1")));

        // When
        LedgerObject object = reader.getObject("0x1");

        // Then
        assertTrue(object.exists());
        assertEquals("0x1", object.objectId());
        assertEquals("3", object.version());
        assertEquals(Map.of("showOwner", true, "showDisplay", true, "showContent", true),
                ObjectDataOptions.defaults().toRpcParam());
        assertEquals(7, ObjectDataOptions.full().toRpcParam().size());
        assertTrue(ObjectDataOptions.minimal().toRpcParam().isEmpty());
    }

    @Test
    void missingObjectExposesError() {
        when(provider.send(eq(LedgerMethods.GET_OBJECT), anyList()))
                .thenReturn(result(Map.of("error", Map.of("code", "notExists"))));

        LedgerObject object = reader.getObject("0x9", ObjectDataOptions.minimal());

        assertFalse(object.exists());
        assertNull(object.objectId());
        assertEquals(Map.of("code", "notExists"), object.error());
    }

    @Test
    void ownedObjectsPageSendsStructTypeFilterAndNullCursor() {
        // Given
        when(provider.send(eq(LedgerMethods.GET_OWNED_OBJECTS), eq(Arrays.asList(
                "0xowner", Map.of("StructType", "0x2::coin::Coin"), null, LedgerMethods.OWNED_OBJECTS_PAGE_SIZE))))
                .thenReturn(result(Map.of("data", List.of(objectEntry("0xa")), "hasNextPage", false)));

        // When
        ObjectPage page = reader.getOwnedObjectsPage("0xowner", "0x2::coin::Coin", null);

        // Then
        assertEquals(1, page.data().size());
        assertFalse(page.hasNextPage());
        assertNull(page.nextCursor());
    }

    @Test
    void ownedObjectsFollowsPagination() {
        // Given
        when(provider.send(eq(LedgerMethods.GET_OWNED_OBJECTS), eq(Arrays.asList(
                "0xowner", Map.of(), null, LedgerMethods.OWNED_OBJECTS_PAGE_SIZE))))
                .thenReturn(result(Map.of(
                        "data", List.of(objectEntry("0xa"), objectEntry("0xb")),
                        "nextCursor", "c1",
                        "hasNextPage", true)));
        when(provider.send(eq(LedgerMethods.GET_OWNED_OBJECTS), eq(Arrays.asList(
                "0xowner", Map.of(), "c1", LedgerMethods.OWNED_OBJECTS_PAGE_SIZE))))
                .thenReturn(result(Map.of("data", List.of(objectEntry("0xc")), "hasNextPage", false)));

        // When
        List<LedgerObject> objects = reader.getOwnedObjects("0xowner");

        // Then
        assertEquals(List.of("0xa", "0xb", "0xc"), objects.stream().map(LedgerObject::objectId).toList());
        verify(provider, times(2)).send(eq(LedgerMethods.GET_OWNED_OBJECTS), anyList());
    }

    @Test
    void ownedObjectsStopsOnRepeatedCursor() {
        Map<String, Object> page = new HashMap<>();
        page.put("data", new ArrayList<>(List.of(objectEntry("0xa"))));
        page.put("nextCursor", "same");
        page.put("hasNextPage", true);
        when(provider.send(eq(LedgerMethods.GET_OWNED_OBJECTS), anyList())).thenReturn(result(page));

        List<LedgerObject> objects = reader.getOwnedObjects("0xowner", null);

        assertEquals(2, objects.size());
        verify(provider, times(2)).send(eq(LedgerMethods.GET_OWNED_OBJECTS), anyList());
    }
}
