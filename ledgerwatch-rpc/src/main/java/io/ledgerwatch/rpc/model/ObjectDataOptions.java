// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detail flags sent with object queries.
 *
 * @param showType                include the object's type
 * @param showOwner               include ownership information
 * @param showPreviousTransaction include the digest of the last transaction that touched the object
 * @param showDisplay             include display metadata
 * @param showContent             include the parsed contents
 * @param showBcs                 include the BCS-encoded bytes
 * @param showStorageRebate       include the storage rebate
 */
public record ObjectDataOptions(
        boolean showType,
        boolean showOwner,
        boolean showPreviousTransaction,
        boolean showDisplay,
        boolean showContent,
        boolean showBcs,
        boolean showStorageRebate) {

    /**
     * Content, display and owner: what object lookups request by default.
     */
    public static ObjectDataOptions defaults() {
        return new ObjectDataOptions(false, true, false, true, true, false, false);
    }

    public static ObjectDataOptions full() {
        return new ObjectDataOptions(true, true, true, true, true, true, true);
    }

    public static ObjectDataOptions minimal() {
        return new ObjectDataOptions(false, false, false, false, false, false, false);
    }

    /**
     * Returns the flags as the JSON object the node expects, listing only the
     * enabled flags.
     *
     * @return the request parameter
     */
    public Map<String, Object> toRpcParam() {
        final Map<String, Object> param = new LinkedHashMap<>();
        putIfSet(param, "showType", showType);
        putIfSet(param, "showOwner", showOwner);
        putIfSet(param, "showPreviousTransaction", showPreviousTransaction);
        putIfSet(param, "showDisplay", showDisplay);
        putIfSet(param, "showContent", showContent);
        putIfSet(param, "showBcs", showBcs);
        putIfSet(param, "showStorageRebate", showStorageRebate);
        return param;
    }

    private static void putIfSet(final Map<String, Object> param, final String key, final boolean value) {
        if (value) {
            param.put(key, Boolean.TRUE);
        }
    }
}
