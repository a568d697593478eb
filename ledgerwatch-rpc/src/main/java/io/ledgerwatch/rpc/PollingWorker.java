// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * A single run of the background polling thread.
 *
 * <p>Lifecycle: NEW, then RUNNING after {@link #start()}, STOPPING after
 * {@link #requestStop()}, STOPPED once the thread has exited. A worker is never
 * restarted; {@link SubscriptionRegistry} creates a fresh one through its
 * {@link Factory} whenever polling has to resume.
 */
public interface PollingWorker {

    void start();

    /**
     * Signals the worker to stop. Returns immediately.
     */
    void requestStop();

    /**
     * Waits for the worker thread to exit.
     *
     * @param timeout the maximum time to wait
     * @return true if the thread has exited (or never started)
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    boolean isAlive();

    /**
     * Returns whether the calling thread is this worker's thread, as happens when
     * a callback unsubscribes.
     *
     * @return true when called from the worker thread
     */
    boolean isCurrentThread();

    /**
     * Creates workers that read the live subscription set through the given supplier.
     *
     * <p>A non-null {@code predecessor} is a stopped worker whose thread may still
     * be running. The new worker must not touch shared state until it has exited.
     */
    @FunctionalInterface
    interface Factory {
        PollingWorker create(Supplier<List<Subscription>> subscriptions, @Nullable PollingWorker predecessor);
    }
}
