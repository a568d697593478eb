// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.event;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Coarse classification of ledger events used to scope a subscription.
 *
 * <p>
 * Every category except {@link #MOVE_EVENT} and {@link #CUSTOM} carries a list
 * of keywords. An event belongs to the category when its {@code type} string
 * contains at least one keyword and none of its excluded keywords, compared
 * case-insensitively. A transfer whose type names an NFT is an asset transfer,
 * never a fungible one.
 *
 * <table border="1">
 * <tr><th>Category</th><th>Keywords</th><th>Excluded</th></tr>
 * <tr><td>{@link #NFT_TRANSFER}</td><td>nft, transfer</td><td></td></tr>
 * <tr><td>{@link #TOKEN_TRANSFER}</td><td>coin, transfer</td><td>nft</td></tr>
 * <tr><td>{@link #OBJECT_CHANGE}</td><td>object</td><td></td></tr>
 * <tr><td>{@link #MOVE_EVENT}</td><td>accepts every event</td><td></td></tr>
 * <tr><td>{@link #EPOCH_CHANGE}</td><td>epoch</td><td></td></tr>
 * <tr><td>{@link #CHECKPOINT}</td><td>checkpoint</td><td></td></tr>
 * <tr><td>{@link #CUSTOM}</td><td>none; the filter decides</td><td></td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public enum EventCategory {

    /** Asset (non-fungible) transfers. */
    NFT_TRANSFER("nft_transfer", List.of("nft", "transfer")),

    /** Fungible coin transfers. */
    TOKEN_TRANSFER("token_transfer", List.of("coin", "transfer"), List.of("nft")),

    /** Object creation, mutation or deletion. */
    OBJECT_CHANGE("object_change", List.of("object")),

    /** Events emitted by on-chain contracts. Matches every event. */
    MOVE_EVENT("move_event", List.of()),

    /** Epoch boundaries. */
    EPOCH_CHANGE("epoch_change", List.of("epoch")),

    /** Checkpoint boundaries. */
    CHECKPOINT("checkpoint", List.of("checkpoint")),

    /** Unclassified events; matching relies entirely on the filter map. */
    CUSTOM("custom", List.of());

    private static final Map<String, EventCategory> BY_NAME = new HashMap<>();

    static {
        for (EventCategory category : values()) {
            BY_NAME.put(category.name().toLowerCase(Locale.ROOT), category);
            BY_NAME.put(category.wireName, category);
        }
    }

    private final String wireName;
    private final List<String> keywords;
    private final List<String> excluded;

    EventCategory(final String wireName, final List<String> keywords) {
        this(wireName, keywords, List.of());
    }

    EventCategory(final String wireName, final List<String> keywords, final List<String> excluded) {
        this.wireName = wireName;
        this.keywords = keywords;
        this.excluded = excluded;
    }

    /**
     * Returns the lower-case name used in subscription ids and logs.
     *
     * @return the wire name, e.g. {@code "nft_transfer"}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns whether the given event type satisfies this category's predicate.
     *
     * @param eventType the event's {@code type} string, never null
     * @return true if the type belongs to this category
     */
    public boolean accepts(final String eventType) {
        if (this == MOVE_EVENT || this == CUSTOM) {
            return true;
        }
        final String normalized = eventType.toLowerCase(Locale.ROOT);
        return containsAny(normalized, keywords) && !containsAny(normalized, excluded);
    }

    /**
     * Looks up a category by name, ignoring case.
     *
     * <p>Both the constant name ({@code "NFT_TRANSFER"}) and the wire name
     * ({@code "nft_transfer"}) are accepted.
     *
     * @param name the category name
     * @return the category, or empty if the name is unknown
     */
    public static Optional<EventCategory> fromName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    private static boolean containsAny(final String text, final List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
