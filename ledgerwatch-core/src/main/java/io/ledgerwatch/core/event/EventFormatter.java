// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.event;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Renders events as human-readable text, for log lines or for the prompt an
 * event handler passes to a downstream responder.
 *
 * <pre>
 * Event: 0x2::coin::CoinTransfer
 * Sender: 0xabc
 * Time: 2024-05-01T10:15:30Z
 *
 * amount: 100
 * data:
 * {
 *   "recipient" : "0xdef"
 * }
 * </pre>
 */
public final class EventFormatter {

    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final Set<String> HEADER_FIELDS = Set.of("type", "sender", "timestamp", "timestampMs");

    private static final String UNKNOWN = "Unknown";
    private static final String ELLIPSIS = "...";

    private EventFormatter() {
    }

    public static String format(final ChainEvent event) {
        final StringBuilder out = new StringBuilder();
        out.append("Event: ").append(event.type().isEmpty() ? UNKNOWN : event.type()).append('\n');
        final Object sender = event.get("sender");
        out.append("Sender: ").append(sender == null ? UNKNOWN : sender).append('\n');
        out.append("Time: ").append(formatTime(event)).append("\n\n");

        for (Map.Entry<String, Object> entry : event.fields().entrySet()) {
            if (HEADER_FIELDS.contains(entry.getKey())) {
                continue;
            }
            final Object value = entry.getValue();
            if (value instanceof Map<?, ?> || value instanceof List<?>) {
                out.append(entry.getKey()).append(":\n").append(toJson(value)).append('\n');
            } else {
                out.append(entry.getKey()).append(": ").append(value).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Truncates text to at most {@code maxLength} characters, ending with "..." when cut.
     *
     * @param text      the text
     * @param maxLength the maximum length, at least 4
     * @return the original or truncated text
     */
    public static String truncate(final String text, final int maxLength) {
        if (maxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("maxLength must be > " + ELLIPSIS.length() + ", got: " + maxLength);
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String formatTime(final ChainEvent event) {
        final Long millis = asLong(event.get("timestampMs"));
        final Long seconds = asLong(event.get("timestamp"));
        try {
            if (millis != null) {
                return Instant.ofEpochMilli(millis).toString();
            }
            if (seconds != null) {
                return Instant.ofEpochSecond(seconds).toString();
            }
        } catch (DateTimeException e) {
            // outside the range Instant supports
            return UNKNOWN;
        }
        return UNKNOWN;
    }

    private static Long asLong(final Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String toJson(final Object value) {
        try {
            return PRETTY.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
