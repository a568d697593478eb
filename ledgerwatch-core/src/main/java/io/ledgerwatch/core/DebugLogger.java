// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger, gated by {@link LedgerWatchDebug}.
 *
 * <p>Messages use {@link String#formatted} placeholders and are passed through
 * {@link LogSanitizer} before reaching SLF4J.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.ledgerwatch.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!LedgerWatchDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logDispatch(final String message, final Object... args) {
        if (!LedgerWatchDebug.isDispatchLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
