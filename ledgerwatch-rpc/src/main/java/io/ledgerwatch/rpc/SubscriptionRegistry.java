// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe registry of live subscriptions that also owns the polling worker.
 *
 * <p><strong>Worker lifecycle:</strong> the worker runs if and only if the
 * registry is non-empty.
 * <ul>
 *   <li>{@link #register} starts a worker when none is active. If the previous
 *       worker's thread is still running, the new worker waits for it to exit
 *       before polling.</li>
 *   <li>{@link #unregister} of the last subscription signals the worker to stop
 *       and then waits for it outside the lock, bounded by the stop timeout. A
 *       worker that does not exit in time is left to finish on its own and a
 *       warning is logged.</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> mutations and worker start/stop signals
 * happen under one lock; joins never do, so callbacks may register and
 * unregister freely. The worker itself never takes the lock: it reads an
 * immutable snapshot that is republished on every change.
 *
 * <p>Subscription ids have the form {@code <category>-<n>}, where {@code n}
 * comes from a per-registry counter.
 *
 * @since 0.1.0
 */
public final class SubscriptionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Object lock = new Object();
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final PollingWorker.Factory workerFactory;
    private final Duration stopTimeout;

    private volatile List<Subscription> snapshot = List.of();

    // guarded by lock
    private @Nullable PollingWorker worker;
    // guarded by lock; the last stopped worker, until a successor has taken it over
    private @Nullable PollingWorker retiring;

    public SubscriptionRegistry(final PollingWorker.Factory workerFactory, final Duration stopTimeout) {
        this.workerFactory = Objects.requireNonNull(workerFactory, "workerFactory");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    /**
     * Registers a subscription and starts polling if it is not running.
     *
     * @param category the event category
     * @param callback invoked for every matching event
     * @param filter   expected values keyed by (dotted) path; may be null
     * @return the new subscription's id
     */
    public String register(
            final EventCategory category,
            final Consumer<ChainEvent> callback,
            final @Nullable Map<String, ?> filter) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(callback, "callback");
        final String id = category.wireName() + "-" + sequence.incrementAndGet();
        final Subscription subscription = new Subscription(
                id, category, filter == null ? null : new LinkedHashMap<String, Object>(filter), callback);

        synchronized (lock) {
            subscriptions.put(id, subscription);
            publishSnapshot();
            if (worker == null || !worker.isAlive()) {
                final PollingWorker predecessor = retiring != null && retiring.isAlive() ? retiring : null;
                final PollingWorker started = workerFactory.create(this::snapshot, predecessor);
                started.start();
                worker = started;
                retiring = null;
            }
        }
        log.info("Subscribed to {} events with ID {}", category.wireName(), id);
        return id;
    }

    /**
     * Removes a subscription. Stops polling when it was the last one.
     *
     * @param id the subscription id
     * @return false if the id is unknown
     */
    public boolean unregister(final String id) {
        final @Nullable PollingWorker stopped;
        synchronized (lock) {
            if (subscriptions.remove(id) == null) {
                log.warn("Subscription ID {} not found", id);
                return false;
            }
            publishSnapshot();
            log.info("Unsubscribed from events with ID {}", id);
            stopped = subscriptions.isEmpty() ? signalStop() : null;
        }
        awaitStopped(stopped);
        return true;
    }

    /**
     * Returns the live subscriptions in registration order.
     *
     * @return an immutable snapshot
     */
    public List<Subscription> snapshot() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    public boolean isEmpty() {
        return snapshot.isEmpty();
    }

    /**
     * Returns whether a worker is currently alive.
     *
     * @return true while polling
     */
    public boolean isPolling() {
        synchronized (lock) {
            return worker != null && worker.isAlive();
        }
    }

    /**
     * Removes every subscription and stops polling.
     */
    @Override
    public void close() {
        final @Nullable PollingWorker stopped;
        synchronized (lock) {
            if (!subscriptions.isEmpty()) {
                log.info("Removing {} remaining subscriptions", subscriptions.size());
                subscriptions.clear();
                publishSnapshot();
            }
            stopped = signalStop();
        }
        awaitStopped(stopped);
    }

    private void publishSnapshot() {
        snapshot = List.copyOf(subscriptions.values());
    }

    // caller holds lock
    private @Nullable PollingWorker signalStop() {
        final PollingWorker stopping = worker;
        worker = null;
        if (stopping != null) {
            stopping.requestStop();
            retiring = stopping;
        }
        return stopping;
    }

    private void awaitStopped(final @Nullable PollingWorker stopping) {
        if (stopping == null || stopping.isCurrentThread()) {
            // On the worker thread the loop exits once the callback returns.
            return;
        }
        boolean terminated;
        try {
            terminated = stopping.awaitTermination(stopTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminated = false;
        }
        if (!terminated) {
            log.warn("Polling worker did not stop within {} ms; a new worker will wait for it to exit",
                    stopTimeout.toMillis());
        }
    }
}
