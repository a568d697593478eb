// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc.model;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One page of an owned-objects query.
 *
 * @param data        the objects on this page
 * @param nextCursor  the cursor for the following page, or null
 * @param hasNextPage whether another page exists
 */
public record ObjectPage(List<LedgerObject> data, @Nullable String nextCursor, boolean hasNextPage) {

    public ObjectPage {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
