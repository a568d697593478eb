// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.rpc.internal.RpcUtils;
import io.ledgerwatch.rpc.model.LedgerObject;
import io.ledgerwatch.rpc.model.ObjectDataOptions;
import io.ledgerwatch.rpc.model.ObjectPage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LedgerReader} over a retrying {@link RpcTransport}.
 *
 * @since 0.1.0
 */
public final class DefaultLedgerReader implements LedgerReader {

    private static final Logger log = LoggerFactory.getLogger(DefaultLedgerReader.class);

    private static final Map<String, Object> TRANSACTION_BLOCK_OPTIONS = Map.of(
            "showEffects", Boolean.TRUE,
            "showEvents", Boolean.TRUE,
            "showObjectChanges", Boolean.TRUE);

    private final RpcTransport rpc;

    public DefaultLedgerReader(final RpcTransport rpc) {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    @Override
    public long latestCheckpoint() {
        final String method = LedgerMethods.GET_LATEST_CHECKPOINT_SEQUENCE_NUMBER;
        return rpc.call(method, List.of(), value -> RpcUtils.decodeSequenceNumber(method, value));
    }

    @Override
    public List<ChainEvent> checkpointEvents(final long checkpoint) {
        return rpc.callWithDefault(
                LedgerMethods.GET_CHECKPOINT_EVENTS,
                List.of(checkpoint),
                value -> decodeEvents(checkpoint, value),
                List.of());
    }

    @Override
    public Map<String, Object> getTransactionBlock(final String digest) {
        Objects.requireNonNull(digest, "digest");
        return rpc.call(
                LedgerMethods.GET_TRANSACTION_BLOCK,
                List.of(digest, TRANSACTION_BLOCK_OPTIONS),
                RpcUtils::asMap);
    }

    @Override
    public LedgerObject getObject(final String objectId, final ObjectDataOptions options) {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(options, "options");
        return rpc.call(
                LedgerMethods.GET_OBJECT,
                List.of(objectId, options.toRpcParam()),
                value -> LedgerObject.fromRpc(RpcUtils.asMap(value)));
    }

    @Override
    public List<LedgerObject> getOwnedObjects(final String address, final @Nullable String structType) {
        final List<LedgerObject> objects = new ArrayList<>();
        final Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        while (true) {
            final ObjectPage page = getOwnedObjectsPage(address, structType, cursor);
            objects.addAll(page.data());
            if (!page.hasNextPage() || page.nextCursor() == null) {
                return objects;
            }
            if (!seenCursors.add(page.nextCursor())) {
                log.warn("Owned objects of {} returned repeated cursor {}; stopping pagination",
                        address, page.nextCursor());
                return objects;
            }
            cursor = page.nextCursor();
        }
    }

    @Override
    public ObjectPage getOwnedObjectsPage(
            final String address,
            final @Nullable String structType,
            final @Nullable String cursor) {
        Objects.requireNonNull(address, "address");
        final Map<String, Object> filter = new LinkedHashMap<>();
        if (structType != null && !structType.isBlank()) {
            filter.put("StructType", structType);
        }
        // Arrays.asList: the cursor parameter is a JSON null on the first page
        final List<Object> params = Arrays.asList(address, filter, cursor, LedgerMethods.OWNED_OBJECTS_PAGE_SIZE);
        return rpc.call(LedgerMethods.GET_OWNED_OBJECTS, params, DefaultLedgerReader::decodePage);
    }

    private static ObjectPage decodePage(final Object value) {
        final Map<String, Object> result = RpcUtils.asMap(value);
        final List<LedgerObject> objects = new ArrayList<>();
        for (Map<String, Object> entry : RpcUtils.asListOfMaps(result.get("data"))) {
            objects.add(LedgerObject.fromRpc(entry));
        }
        return new ObjectPage(
                objects,
                RpcUtils.stringValue(result.get("nextCursor")),
                Boolean.TRUE.equals(result.get("hasNextPage")));
    }

    private static List<ChainEvent> decodeEvents(final long checkpoint, final Object value) {
        Object entries = value;
        if (value instanceof Map<?, ?> map && map.containsKey("data")) {
            entries = map.get("data");
        }
        if (!(entries instanceof List<?> list)) {
            throw new RpcException(-32603,
                    "Unexpected result for " + LedgerMethods.GET_CHECKPOINT_EVENTS + " at checkpoint " + checkpoint,
                    RpcUtils.stringValue(value));
        }
        final List<ChainEvent> events = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?>) {
                events.add(ChainEvent.of(RpcUtils.asMap(item)));
            } else {
                log.debug("Skipping non-object event entry at checkpoint {}: {}", checkpoint, item);
            }
        }
        return List.copyOf(events);
    }
}
