// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.ConfigurationException;
import io.ledgerwatch.rpc.model.TransactionResult;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes transactions through a {@link TransactionSigner}, guarded by the
 * presence of a signing credential.
 */
public final class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    private final @Nullable String signingKey;
    private final TransactionSigner signer;

    public TransactionExecutor(final @Nullable String signingKey, final TransactionSigner signer) {
        this.signingKey = signingKey == null || signingKey.isBlank() ? null : signingKey;
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    /**
     * Executes a transaction.
     *
     * @param transaction the transaction description
     * @return the execution result
     * @throws ConfigurationException if no signing credential is configured; the
     *                                signer is not invoked
     */
    public TransactionResult execute(final Map<String, Object> transaction) {
        Objects.requireNonNull(transaction, "transaction");
        if (signingKey == null) {
            throw new ConfigurationException("Signing key not set. Cannot execute transactions.");
        }
        final TransactionResult result = signer.signAndExecute(transaction, signingKey);
        log.info("Executed transaction {} with status {}", result.digest(), result.status());
        return result;
    }

    public boolean canExecute() {
        return signingKey != null;
    }
}
