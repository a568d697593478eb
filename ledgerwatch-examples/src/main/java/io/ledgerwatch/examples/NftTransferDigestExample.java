package io.ledgerwatch.examples;

import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventFormatter;
import io.ledgerwatch.rpc.EventHandlers;
import io.ledgerwatch.rpc.LedgerWatch;
import io.ledgerwatch.rpc.LedgerWatchConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Watches NFT transfers and turns each one into a short support note.
 * <p>
 * Shows the callback adapter pattern: the handler formats the event with
 * {@link EventFormatter} and hands the text to a response generator. Here the
 * generator is a plain function; a real service would call out to its own
 * backend and must not block the polling thread for long.
 * <p>
 * Usage:
 * mvn -pl ledgerwatch-examples exec:java \
 * -Dexec.mainClass=io.ledgerwatch.examples.NftTransferDigestExample \
 * -Dledgerwatch.examples.rpc=https://fullnode.devnet.sui.io:443 \
 * -Dledgerwatch.examples.seconds=60
 */
public final class NftTransferDigestExample {

    private static final int MAX_NOTE_LENGTH = 500;

    private NftTransferDigestExample() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws InterruptedException {
        final String rpcUrl = System.getProperty("ledgerwatch.examples.rpc", LedgerWatchConfig.DEFAULT_RPC_URL);
        final long seconds = Long.getLong("ledgerwatch.examples.seconds", 60L);

        final Function<String, String> responseGenerator =
                context -> "A transfer was recorded for your collection.\n" + context;

        final LedgerWatchConfig config = LedgerWatchConfig.builder()
                .rpcUrl(rpcUrl)
                .pollingInterval(Duration.ofSeconds(2))
                .build();

        System.out.println("=== NFT Transfer Digest Example ===");
        final CountDownLatch done = new CountDownLatch(1);
        try (LedgerWatch client = LedgerWatch.builder()
                .config(config)
                .pollingErrorListener(e -> System.out.println("Polling failed: " + e.getMessage()))
                .build()) {
            final EventHandlers handlers = new EventHandlers(client);
            handlers.on("nft_transfer", event -> reply(responseGenerator, event));
            handlers.on("nft_mint", event -> reply(responseGenerator, event), Map.of());

            System.out.println("Watching " + rpcUrl + " for " + seconds + "s, handlers: " + handlers.names());
            done.await(seconds, TimeUnit.SECONDS);
        }
        System.out.println("Done.");
    }

    private static void reply(final Function<String, String> generator, final ChainEvent event) {
        final String note = generator.apply(EventFormatter.format(event));
        System.out.println(EventFormatter.truncate(note, MAX_NOTE_LENGTH));
        System.out.println("---");
    }
}
