// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.rpc.model.TransactionResult;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signer stand-in that returns a synthetic successful result without signing
 * or submitting anything.
 *
 * <p>The digest has the form {@code mock_tx_<epochSeconds>}; effects report a
 * success status and fixed gas figures.
 */
public final class PlaceholderTransactionSigner implements TransactionSigner {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderTransactionSigner.class);

    private final Clock clock;

    public PlaceholderTransactionSigner() {
        this(Clock.systemUTC());
    }

    PlaceholderTransactionSigner(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TransactionResult signAndExecute(final Map<String, Object> transaction, final String signingKey) {
        log.info("Executing transaction (placeholder implementation, nothing is signed or submitted)");
        final Instant now = clock.instant();

        final Map<String, Object> gasUsed = new LinkedHashMap<>();
        gasUsed.put("computationCost", "1000");
        gasUsed.put("storageCost", "500");
        gasUsed.put("storageRebate", "200");

        final Map<String, Object> effects = new LinkedHashMap<>();
        effects.put("status", TransactionResult.STATUS_SUCCESS);
        effects.put("gasUsed", gasUsed);

        return new TransactionResult("mock_tx_" + now.getEpochSecond(), TransactionResult.STATUS_SUCCESS, now, effects);
    }
}
