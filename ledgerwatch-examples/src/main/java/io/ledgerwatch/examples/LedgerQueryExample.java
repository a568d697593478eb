package io.ledgerwatch.examples;

import io.ledgerwatch.core.LedgerWatchDebug;
import io.ledgerwatch.core.error.ConfigurationException;
import io.ledgerwatch.core.error.RpcException;
import io.ledgerwatch.core.error.TransportException;
import io.ledgerwatch.rpc.LedgerWatch;
import io.ledgerwatch.rpc.model.LedgerObject;
import io.ledgerwatch.rpc.model.TransactionResult;
import java.util.List;
import java.util.Map;

/**
 * Reads chain state through the gateway and shows how each failure type surfaces.
 * <p>
 * Configuration comes from the {@code LEDGERWATCH_*} environment variables.
 * Pass an owner address as the first argument to list its objects.
 * <p>
 * Usage:
 * LEDGERWATCH_RPC_URL=https://fullnode.devnet.sui.io:443 \
 * mvn -pl ledgerwatch-examples exec:java \
 * -Dexec.mainClass=io.ledgerwatch.examples.LedgerQueryExample -Dexec.args=0x...
 */
public final class LedgerQueryExample {

    private LedgerQueryExample() {
        // Prevent instantiation
    }

    public static void main(final String[] args) {
        // Logs every request and response under io.ledgerwatch.debug
        LedgerWatchDebug.setEnabled(true);
        System.out.println("=== Ledger Query Example ===");

        try (LedgerWatch client = LedgerWatch.fromEnvironment()) {
            System.out.println("[1] Latest checkpoint: " + client.latestCheckpoint());

            if (args.length > 0) {
                final List<LedgerObject> owned = client.getOwnedObjects(args[0]);
                System.out.println("[2] " + args[0] + " owns " + owned.size() + " objects");
                owned.stream().limit(5).forEach(o -> System.out.println("    " + o.objectId() + " " + o.type()));
            }

            System.out.println("[3] Executing a transaction...");
            try {
                final TransactionResult result = client.executeTransaction(Map.of("kind", "transfer"));
                System.out.println("    digest=" + result.digest() + " status=" + result.status());
            } catch (ConfigurationException e) {
                System.out.println("    Not configured: " + e.getMessage());
            }
        } catch (RpcException e) {
            System.out.println("Node rejected the request: code=" + e.code() + " " + e.getMessage());
        } catch (TransportException e) {
            System.out.println("Node unreachable after " + e.attemptCount() + " attempts: " + e.getMessage());
        }
    }
}
