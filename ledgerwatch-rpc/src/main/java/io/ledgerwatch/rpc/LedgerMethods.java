// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

/**
 * JSON-RPC method names used by LedgerWatch.
 */
public final class LedgerMethods {

    public static final String GET_LATEST_CHECKPOINT_SEQUENCE_NUMBER = "sui_getLatestCheckpointSequenceNumber";
    public static final String GET_CHECKPOINT_EVENTS = "sui_getCheckpointEvents";
    public static final String GET_TRANSACTION_BLOCK = "sui_getTransactionBlock";
    public static final String GET_OBJECT = "sui_getObject";
    public static final String GET_OWNED_OBJECTS = "sui_getOwnedObjects";

    /** Page size used for owned-object queries. */
    public static final int OWNED_OBJECTS_PAGE_SIZE = 100;

    private LedgerMethods() {
    }
}
