// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core;

/**
 * Global toggle for verbose debug logging across LedgerWatch modules.
 */
public final class LedgerWatchDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean dispatchLogging = false;

    private LedgerWatchDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || dispatchLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        dispatchLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setDispatchLogging(final boolean enabled) {
        dispatchLogging = enabled;
    }

    public static boolean isDispatchLoggingEnabled() {
        return dispatchLogging;
    }
}
