// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts signing credentials to prevent credential leakage</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    private static final Pattern SECRET_FIELD = Pattern.compile(
            "\"(privateKey|signingKey|signature|txBytes)\"\\s*:\\s*\"[^\"]*\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.indexOf('"') >= 0) {
            sanitized = SECRET_FIELD.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    /**
     * Masks a credential for display.
     *
     * @param secret the secret, may be null
     * @return {@code "<unset>"} or a fixed mask
     */
    public static String mask(final String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<unset>";
        }
        return REDACTED;
    }
}
