// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import io.ledgerwatch.rpc.model.LedgerObject;
import io.ledgerwatch.rpc.model.ObjectDataOptions;
import io.ledgerwatch.rpc.model.ObjectPage;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Synchronous read operations against a ledger node.
 *
 * <p>Every method blocks the caller for the duration of the RPC call, including
 * retries. Failures surface as {@link TransportException} or {@link RpcException}.
 *
 * @see DefaultLedgerReader
 */
public interface LedgerReader extends CheckpointSource {

    /**
     * Fetches a transaction block with its effects, events and object changes.
     *
     * @param digest the transaction digest
     * @return the transaction block as returned by the node
     */
    Map<String, Object> getTransactionBlock(String digest);

    /**
     * Fetches an object with content, display and owner details.
     *
     * @param objectId the object id
     * @return the object
     */
    default LedgerObject getObject(final String objectId) {
        return getObject(objectId, ObjectDataOptions.defaults());
    }

    LedgerObject getObject(String objectId, ObjectDataOptions options);

    /**
     * Fetches every object owned by an address, following pagination.
     *
     * @param address    the owner address
     * @param structType optional struct type tag filter, or null for all objects
     * @return the owned objects
     */
    List<LedgerObject> getOwnedObjects(String address, @Nullable String structType);

    default List<LedgerObject> getOwnedObjects(final String address) {
        return getOwnedObjects(address, null);
    }

    /**
     * Fetches one page of owned objects.
     *
     * @param address    the owner address
     * @param structType optional struct type tag filter
     * @param cursor     the cursor from the previous page, or null for the first
     * @return the page
     */
    ObjectPage getOwnedObjectsPage(String address, @Nullable String structType, @Nullable String cursor);
}
