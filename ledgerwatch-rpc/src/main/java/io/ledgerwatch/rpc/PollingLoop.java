// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import io.ledgerwatch.core.error.LedgerWatchException;
import io.ledgerwatch.core.event.ChainEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The background worker that follows the chain checkpoint by checkpoint.
 *
 * <p>
 * <strong>Cycle:</strong>
 * <ol>
 * <li>If the cursor is unset, adopt the latest checkpoint as the starting point
 * (no historical backfill).</li>
 * <li>Read the latest checkpoint.</li>
 * <li>For every checkpoint in {@code (cursor, latest]}, in order: fetch its
 * events, take one subscription snapshot, dispatch every event against it,
 * then advance the cursor.</li>
 * <li>Wait for the polling interval, or return early when stopped.</li>
 * </ol>
 *
 * <p>
 * <strong>Failures:</strong> an error anywhere in a cycle is logged, reported to
 * the optional error listener, and followed by a wait of the retry delay. The
 * cursor stays at the last fully processed checkpoint, so the next cycle
 * retries the same step. A cycle error never terminates the worker.
 *
 * <p>
 * <strong>Handoff:</strong> a loop created with a predecessor waits for that
 * worker's thread to exit before its first cycle, so two loops never drive the
 * shared cursor at the same time.
 *
 * <p>
 * <strong>Stopping:</strong> the stop signal is checked at the top of every
 * cycle and between checkpoints, and it interrupts the wait between cycles.
 * In-flight RPC calls and callbacks are never preempted.
 */
final class PollingLoop implements PollingWorker {

    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    /** Counter for unique worker thread names. */
    private static final AtomicInteger THREAD_ID = new AtomicInteger(0);

    enum State { NEW, RUNNING, STOPPING, STOPPED }

    private final CheckpointSource source;
    private final CheckpointCursor cursor;
    private final EventDispatcher dispatcher;
    private final Supplier<List<Subscription>> subscriptions;
    private final Duration pollingInterval;
    private final Duration retryDelay;
    private final @Nullable Consumer<LedgerWatchException> errorListener;
    private final @Nullable PollingWorker predecessor;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final Thread thread;

    PollingLoop(
            final CheckpointSource source,
            final CheckpointCursor cursor,
            final Supplier<List<Subscription>> subscriptions,
            final Duration pollingInterval,
            final Duration retryDelay,
            final @Nullable Consumer<LedgerWatchException> errorListener) {
        this(source, cursor, subscriptions, pollingInterval, retryDelay, errorListener, null);
    }

    PollingLoop(
            final CheckpointSource source,
            final CheckpointCursor cursor,
            final Supplier<List<Subscription>> subscriptions,
            final Duration pollingInterval,
            final Duration retryDelay,
            final @Nullable Consumer<LedgerWatchException> errorListener,
            final @Nullable PollingWorker predecessor) {
        this.source = Objects.requireNonNull(source, "source");
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.pollingInterval = Objects.requireNonNull(pollingInterval, "pollingInterval");
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        this.errorListener = errorListener;
        this.predecessor = predecessor;
        this.dispatcher = new EventDispatcher();
        // Mask off sign bit to keep thread ids non-negative after overflow
        this.thread = new Thread(this::run, "ledgerwatch-poller-" + (THREAD_ID.getAndIncrement() & 0x7FFFFFFF));
        this.thread.setDaemon(true);
    }

    /**
     * Returns a factory whose workers share the given source and cursor.
     */
    static PollingWorker.Factory factory(
            final CheckpointSource source,
            final CheckpointCursor cursor,
            final Duration pollingInterval,
            final Duration retryDelay,
            final @Nullable Consumer<LedgerWatchException> errorListener) {
        return (subscriptions, predecessor) -> new PollingLoop(
                source, cursor, subscriptions, pollingInterval, retryDelay, errorListener, predecessor);
    }

    @Override
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Polling worker already started (state " + state.get() + ")");
        }
        thread.start();
    }

    @Override
    public void requestStop() {
        state.compareAndSet(State.NEW, State.STOPPED);
        state.compareAndSet(State.RUNNING, State.STOPPING);
        stopSignal.countDown();
    }

    @Override
    public boolean awaitTermination(final Duration timeout) throws InterruptedException {
        if (state.get() == State.NEW) {
            return true;
        }
        thread.join(Math.max(1L, timeout.toMillis()));
        return !thread.isAlive();
    }

    @Override
    public boolean isAlive() {
        return thread.isAlive();
    }

    @Override
    public boolean isCurrentThread() {
        return Thread.currentThread() == thread;
    }

    State state() {
        return state.get();
    }

    String threadName() {
        return thread.getName();
    }

    private void run() {
        log.info("Starting event polling thread {}", thread.getName());
        try {
            awaitPredecessor();
            while (!isStopRequested()) {
                Duration pause = pollingInterval;
                try {
                    pollOnce();
                } catch (LedgerWatchException e) {
                    log.warn("Error in event polling (cursor {}), retrying in {} ms: {}",
                            cursor, retryDelay.toMillis(), e.getMessage());
                    notifyListener(e);
                    pause = retryDelay;
                } catch (RuntimeException e) {
                    log.error("Unexpected error in event polling (cursor {}), retrying in {} ms",
                            cursor, retryDelay.toMillis(), e);
                    pause = retryDelay;
                }
                if (awaitStop(pause)) {
                    break;
                }
            }
        } finally {
            state.set(State.STOPPED);
            log.info("Event polling thread {} stopped ({})", thread.getName(), cursor);
        }
    }

    /**
     * Runs one polling cycle without waiting.
     *
     * @return the number of checkpoints fully processed
     * @throws LedgerWatchException if a node call fails; the cursor keeps the last processed checkpoint
     */
    int pollOnce() {
        if (!cursor.isSet()) {
            final long head = source.latestCheckpoint();
            cursor.initialize(head);
            log.info("Starting event polling from checkpoint {}", head);
        }

        final long latest = source.latestCheckpoint();
        int processed = 0;
        final PrimitiveIterator.OfLong pending = cursor.pending(latest).iterator();
        while (pending.hasNext() && !isStopRequested()) {
            final long checkpoint = pending.nextLong();
            final List<ChainEvent> events = source.checkpointEvents(checkpoint);
            dispatcher.dispatch(checkpoint, events, subscriptions.get());
            cursor.advanceTo(checkpoint);
            processed++;
        }
        if (processed > 0) {
            log.debug("Processed {} checkpoints, cursor now {}", processed, cursor);
        }
        return processed;
    }

    private void awaitPredecessor() {
        if (predecessor == null) {
            return;
        }
        try {
            while (!isStopRequested() && !predecessor.awaitTermination(pollingInterval)) {
                log.debug("Polling thread {} waiting for the previous worker to exit", thread.getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Polling thread {} interrupted while waiting for the previous worker, stopping",
                    thread.getName());
            stopSignal.countDown();
        }
    }

    private boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Waits for the given duration or until stop is requested.
     *
     * @return true if stop was requested
     */
    private boolean awaitStop(final Duration pause) {
        try {
            return stopSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Polling thread {} interrupted, stopping", thread.getName());
            return true;
        }
    }

    private void notifyListener(final LedgerWatchException e) {
        if (errorListener == null) {
            return;
        }
        try {
            errorListener.accept(e);
        } catch (Exception listenerFailure) {
            log.error("Exception in polling error listener", listenerFailure);
        }
    }
}
