// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.error;

/**
 * Thrown when an operation requires configuration that is absent or invalid,
 * for example executing a transaction without a signing credential.
 *
 * <p>Never retried.
 */
public final class ConfigurationException extends LedgerWatchException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
