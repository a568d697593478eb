// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.rpc.model.TransactionResult;
import java.util.Map;

/**
 * Signs and submits transactions on behalf of {@link TransactionExecutor}.
 *
 * <p>
 * Implementations are responsible for:
 * <ul>
 * <li>Building the transaction bytes from the caller's transaction data</li>
 * <li>Signing them with the configured credential</li>
 * <li>Submitting the signed transaction and reporting its effects</li>
 * </ul>
 *
 * <p>The bundled {@link PlaceholderTransactionSigner} performs none of these and
 * must be replaced by a real signer before transactions reach a live network.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransactionSigner {

    /**
     * Signs and submits a transaction.
     *
     * @param transaction the caller's transaction description
     * @param signingKey  the signing credential, never null or blank
     * @return the execution result
     */
    TransactionResult signAndExecute(Map<String, Object> transaction, String signingKey);
}
