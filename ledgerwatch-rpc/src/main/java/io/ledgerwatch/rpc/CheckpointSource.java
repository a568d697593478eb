// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.event.ChainEvent;
import java.util.List;

/**
 * What the polling worker needs from the node.
 *
 * @see LedgerReader
 */
public interface CheckpointSource {

    /**
     * Returns the sequence number of the newest checkpoint.
     *
     * @return the latest checkpoint
     */
    long latestCheckpoint();

    /**
     * Returns the events of one checkpoint, in node order.
     *
     * @param checkpoint the checkpoint sequence number
     * @return the events, empty if the checkpoint has none
     */
    List<ChainEvent> checkpointEvents(long checkpoint);
}
