// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.ConfigurationException;
import io.ledgerwatch.core.error.LedgerWatchException;
import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import io.ledgerwatch.rpc.model.LedgerObject;
import io.ledgerwatch.rpc.model.ObjectDataOptions;
import io.ledgerwatch.rpc.model.ObjectPage;
import io.ledgerwatch.rpc.model.TransactionResult;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for watching a ledger node and querying it.
 *
 * <h2>Creating Clients</h2>
 *
 * <pre>{@code
 * // Defaults: devnet endpoint, 5s polling, 3 attempts 2s apart
 * LedgerWatch client = LedgerWatch.connect("https://fullnode.devnet.sui.io:443");
 *
 * // From LEDGERWATCH_* environment variables
 * LedgerWatch client = LedgerWatch.fromEnvironment();
 *
 * // Full control
 * LedgerWatch client = LedgerWatch.builder()
 *     .config(LedgerWatchConfig.builder()
 *         .rpcUrl(url)
 *         .pollingInterval(Duration.ofSeconds(1))
 *         .build())
 *     .pollingErrorListener(e -> metrics.increment("poll.errors"))
 *     .build();
 * }</pre>
 *
 * <h2>Subscribing</h2>
 *
 * <pre>{@code
 * String id = client.subscribe(
 *     EventCategory.NFT_TRANSFER,
 *     event -> handle(event),
 *     Map.of("data.collection", "0x2::devnet_nft::DevNetNFT"));
 * ...
 * client.unsubscribe(id);
 * }</pre>
 *
 * <p>The first subscription starts the background polling thread; removing the
 * last one stops it and waits for it to exit, bounded by
 * {@link LedgerWatchConfig#stopTimeout()}. Callbacks run on the polling thread
 * and should hand slow work off to their own executor.
 *
 * <p><strong>Error reporting:</strong> gateway methods throw
 * {@link LedgerWatchException} subtypes. Polling failures never reach
 * subscribers; they are logged and passed to the optional polling error listener.
 *
 * <p><strong>Thread Safety:</strong> all methods are thread-safe.
 *
 * @since 0.1.0
 */
public final class LedgerWatch implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LedgerWatch.class);

    private final LedgerWatchConfig config;
    private final LedgerProvider provider;
    private final LedgerReader reader;
    private final TransactionExecutor executor;
    private final SubscriptionRegistry registry;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LedgerWatch(final Builder builder) {
        this.config = builder.config;
        this.provider = builder.provider != null ? builder.provider : HttpLedgerProvider.builder(config.rpcUrl())
                .connectTimeout(config.connectTimeout())
                .readTimeout(config.readTimeout())
                .build();
        final RpcTransport transport = new RpcTransport(provider, config.retryPolicy(), this::ensureOpen);
        this.reader = new DefaultLedgerReader(transport);
        this.executor = new TransactionExecutor(config.signingKey(), builder.signer);
        final CheckpointCursor cursor = builder.startAfterCheckpoint == null
                ? new CheckpointCursor()
                : new CheckpointCursor(builder.startAfterCheckpoint);
        this.registry = new SubscriptionRegistry(
                PollingLoop.factory(reader, cursor, config.pollingInterval(), config.retryDelay(),
                        builder.pollingErrorListener),
                config.stopTimeout());
        config.validate();
        log.info("Initialized LedgerWatch client for {}", config.rpcUrl());
    }

    public static LedgerWatch connect(final String rpcUrl) {
        return builder().config(LedgerWatchConfig.builder().rpcUrl(rpcUrl).build()).build();
    }

    /**
     * Creates a client from {@code LEDGERWATCH_*} environment variables.
     *
     * @return a new client
     * @throws ConfigurationException if a variable is invalid
     */
    public static LedgerWatch fromEnvironment() {
        return builder().config(LedgerWatchConfig.fromEnvironment()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Subscriptions ====================

    /**
     * Subscribes to events of a category. Starts polling if it is not running.
     *
     * @param category the event category
     * @param callback invoked on the polling thread for each matching event
     * @return the subscription id
     */
    public String subscribe(final EventCategory category, final Consumer<ChainEvent> callback) {
        return subscribe(category, callback, null);
    }

    /**
     * Subscribes to events of a category that also satisfy a filter.
     *
     * @param category the event category
     * @param callback invoked on the polling thread for each matching event
     * @param filter   expected values keyed by (dotted) path, or null
     * @return the subscription id
     */
    public String subscribe(
            final EventCategory category,
            final Consumer<ChainEvent> callback,
            final @Nullable Map<String, ?> filter) {
        ensureOpen();
        return registry.register(category, callback, filter);
    }

    /**
     * Removes a subscription. When it was the last one, stops polling and waits
     * for the polling thread to exit.
     *
     * @param subscriptionId the id returned by {@link #subscribe}
     * @return false if the id is unknown
     */
    public boolean unsubscribe(final String subscriptionId) {
        return registry.unregister(subscriptionId);
    }

    public int subscriptionCount() {
        return registry.size();
    }

    public boolean isPolling() {
        return registry.isPolling();
    }

    // ==================== Gateway ====================

    /**
     * Executes a transaction.
     *
     * @param transaction the transaction description
     * @return the result
     * @throws ConfigurationException if no signing key is configured
     */
    public TransactionResult executeTransaction(final Map<String, Object> transaction) {
        ensureOpen();
        return executor.execute(transaction);
    }

    public LedgerObject getObject(final String objectId) {
        return reader.getObject(objectId);
    }

    public LedgerObject getObject(final String objectId, final ObjectDataOptions options) {
        return reader.getObject(objectId, options);
    }

    public List<LedgerObject> getOwnedObjects(final String address) {
        return reader.getOwnedObjects(address);
    }

    public List<LedgerObject> getOwnedObjects(final String address, final @Nullable String structType) {
        return reader.getOwnedObjects(address, structType);
    }

    public ObjectPage getOwnedObjectsPage(
            final String address,
            final @Nullable String structType,
            final @Nullable String cursor) {
        return reader.getOwnedObjectsPage(address, structType, cursor);
    }

    public Map<String, Object> getTransactionBlock(final String digest) {
        return reader.getTransactionBlock(digest);
    }

    public long latestCheckpoint() {
        return reader.latestCheckpoint();
    }

    public List<ChainEvent> checkpointEvents(final long checkpoint) {
        return reader.checkpointEvents(checkpoint);
    }

    public LedgerReader reader() {
        return reader;
    }

    public LedgerWatchConfig config() {
        return config;
    }

    SubscriptionRegistry registry() {
        return registry;
    }

    /**
     * Removes all subscriptions, stops polling and closes the provider.
     * Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            registry.close();
            provider.close();
            log.info("Closed LedgerWatch client for {}", config.rpcUrl());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("This LedgerWatch client has been closed");
        }
    }

    /**
     * Builder for {@link LedgerWatch}.
     */
    public static final class Builder {
        private LedgerWatchConfig config = LedgerWatchConfig.defaults();
        private @Nullable LedgerProvider provider;
        private TransactionSigner signer = new PlaceholderTransactionSigner();
        private @Nullable Consumer<LedgerWatchException> pollingErrorListener;
        private @Nullable Long startAfterCheckpoint;

        private Builder() {}

        public Builder config(final LedgerWatchConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Uses the given provider instead of an HTTP provider built from the
         * configured URL.
         */
        public Builder provider(final LedgerProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        public Builder signer(final TransactionSigner signer) {
            this.signer = Objects.requireNonNull(signer, "signer");
            return this;
        }

        /**
         * Receives every polling-cycle failure after it has been logged.
         */
        public Builder pollingErrorListener(final Consumer<LedgerWatchException> listener) {
            this.pollingErrorListener = listener;
            return this;
        }

        /**
         * Resumes polling after the given checkpoint instead of the chain head.
         *
         * @param checkpoint the last checkpoint already processed
         */
        public Builder startAfterCheckpoint(final long checkpoint) {
            if (checkpoint < 0) {
                throw new IllegalArgumentException("checkpoint must be >= 0, got: " + checkpoint);
            }
            this.startAfterCheckpoint = checkpoint;
            return this;
        }

        public LedgerWatch build() {
            return new LedgerWatch(this);
        }
    }
}
