// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.ledgerwatch.core.error.LedgerWatchException;
import io.ledgerwatch.core.error.TransportException;
import io.ledgerwatch.core.event.ChainEvent;
import io.ledgerwatch.core.event.EventCategory;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PollingLoopTest {

    private static final Duration FAST = Duration.ofMillis(10);

    @Mock
    private CheckpointSource source;

    private final List<ChainEvent> received = new CopyOnWriteArrayList<>();

    private List<Subscription> subscriptions() {
        return List.of(new Subscription("move_event-1", EventCategory.MOVE_EVENT, null, received::add));
    }

    private PollingLoop loop(final CheckpointCursor cursor) {
        return new PollingLoop(source, cursor, this::subscriptions, FAST, FAST, null);
    }

    private static ChainEvent event(final long checkpoint) {
        return ChainEvent.of(Map.of("type", "transfer", "checkpoint", checkpoint));
    }

    @Test
    void firstCycleStartsAtChainHeadWithoutReplay() {
        // Given
        CheckpointCursor cursor = new CheckpointCursor();
        when(source.latestCheckpoint()).thenReturn(50L);

        // When
        int processed = loop(cursor).pollOnce();

        // Then
        assertEquals(0, processed);
        assertEquals(OptionalLong.of(50L), cursor.current());
        verify(source, never()).checkpointEvents(anyLong());
    }

    @Test
    void processesCheckpointsInOrderAndAdvancesCursor() {
        // Given
        CheckpointCursor cursor = new CheckpointCursor(10);
        when(source.latestCheckpoint()).thenReturn(13L);
        when(source.checkpointEvents(11L)).thenReturn(List.of(event(11)));
        when(source.checkpointEvents(12L)).thenReturn(List.of());
        when(source.checkpointEvents(13L)).thenReturn(List.of(event(13), event(13)));

        // When
        int processed = loop(cursor).pollOnce();

        // Then
        assertEquals(3, processed);
        assertEquals(OptionalLong.of(13L), cursor.current());
        assertEquals(3, received.size());
        InOrder order = inOrder(source);
        order.verify(source).checkpointEvents(11L);
        order.verify(source).checkpointEvents(12L);
        order.verify(source).checkpointEvents(13L);
    }

    @Test
    void failedFetchLeavesCursorAtLastSuccessAndRetriesSameCheckpoint() {
        // Given
        CheckpointCursor cursor = new CheckpointCursor(20);
        PollingLoop loop = loop(cursor);
        when(source.latestCheckpoint()).thenReturn(23L);
        when(source.checkpointEvents(21L)).thenReturn(List.of(event(21)));
        when(source.checkpointEvents(22L))
                .thenThrow(new TransportException("timeout"))
                .thenReturn(List.of(event(22)));
        when(source.checkpointEvents(23L)).thenReturn(List.of(event(23)));

        // When
        assertThrows(TransportException.class, loop::pollOnce);

        // Then
        assertEquals(OptionalLong.of(21L), cursor.current());
        assertEquals(1, received.size());

        // When the node recovers
        int processed = loop.pollOnce();

        // Then
        assertEquals(2, processed);
        assertEquals(OptionalLong.of(23L), cursor.current());
        assertEquals(3, received.size());
        verify(source).checkpointEvents(21L);
    }

    @Test
    void noNewCheckpointsIsANoOp() {
        CheckpointCursor cursor = new CheckpointCursor(5);
        when(source.latestCheckpoint()).thenReturn(5L);

        assertEquals(0, loop(cursor).pollOnce());
        assertEquals(OptionalLong.of(5L), cursor.current());
    }

    @Test
    void failedInitializationLeavesCursorUnset() {
        CheckpointCursor cursor = new CheckpointCursor();
        when(source.latestCheckpoint()).thenThrow(new TransportException("down"));

        assertThrows(TransportException.class, () -> loop(cursor).pollOnce());
        assertFalse(cursor.isSet());
    }

    @Test
    void threadStartsAndStopsWithinBoundedTime() throws Exception {
        // Given
        CheckpointCursor cursor = new CheckpointCursor(0);
        when(source.latestCheckpoint()).thenReturn(1L);
        when(source.checkpointEvents(1L)).thenReturn(List.of(event(1)));
        PollingLoop loop = loop(cursor);

        // When
        loop.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (received.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        loop.requestStop();

        // Then
        assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(loop.isAlive());
        assertEquals(PollingLoop.State.STOPPED, loop.state());
        assertEquals(1, received.size());
        assertTrue(loop.threadName().startsWith("ledgerwatch-poller-"));
        assertThrows(IllegalStateException.class, loop::start);
    }

    @Test
    void cycleErrorsReachListenerAndLoopKeepsRunning() throws Exception {
        // Given
        CountDownLatch failures = new CountDownLatch(2);
        List<LedgerWatchException> seen = new CopyOnWriteArrayList<>();
        when(source.latestCheckpoint()).thenThrow(new TransportException("node down"));
        PollingLoop loop = new PollingLoop(source, new CheckpointCursor(), this::subscriptions, FAST, FAST, e -> {
            seen.add(e);
            failures.countDown();
        });

        // When
        loop.start();
        boolean retried = failures.await(5, TimeUnit.SECONDS);
        loop.requestStop();

        // Then
        assertTrue(retried);
        assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
        assertTrue(seen.get(0) instanceof TransportException);
        verify(source, atLeastOnce()).latestCheckpoint();
    }

    @Test
    void stopBeforeStartNeverRuns() throws Exception {
        PollingLoop loop = loop(new CheckpointCursor());

        loop.requestStop();

        assertTrue(loop.awaitTermination(Duration.ofMillis(10)));
        assertEquals(PollingLoop.State.STOPPED, loop.state());
    }

    @Test
    void waitsForPredecessorToExitBeforePolling() throws Exception {
        // Given a predecessor whose thread has not exited yet
        CountDownLatch predecessorExited = new CountDownLatch(1);
        PollingWorker predecessor = new PollingWorker() {
            @Override
            public void start() {
            }

            @Override
            public void requestStop() {
            }

            @Override
            public boolean awaitTermination(final Duration timeout) throws InterruptedException {
                return predecessorExited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            @Override
            public boolean isAlive() {
                return predecessorExited.getCount() > 0;
            }

            @Override
            public boolean isCurrentThread() {
                return false;
            }
        };
        when(source.latestCheckpoint()).thenReturn(5L);
        PollingLoop loop = new PollingLoop(
                source, new CheckpointCursor(), this::subscriptions, FAST, FAST, null, predecessor);

        // When
        loop.start();
        Thread.sleep(100);

        // Then nothing is polled until the predecessor is gone
        verify(source, never()).latestCheckpoint();
        predecessorExited.countDown();
        verify(source, timeout(5000).atLeastOnce()).latestCheckpoint();
        loop.requestStop();
        assertTrue(loop.awaitTermination(Duration.ofSeconds(5)));
    }
}
