// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.rpc;

import java.util.OptionalLong;
import java.util.stream.LongStream;

/**
 * The last fully processed checkpoint sequence number.
 *
 * <p>The cursor starts unset and is initialized lazily to the chain head, so
 * the first events observed are those strictly after that checkpoint. From then
 * on it moves forward one checkpoint at a time and never decreases.
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. The cursor is owned by the
 * polling worker; only one worker runs at a time.
 */
public final class CheckpointCursor {

    private static final long UNSET = -1L;

    private long last = UNSET;

    public CheckpointCursor() {
    }

    /**
     * Creates a cursor that resumes after the given checkpoint.
     *
     * @param lastProcessed the last processed checkpoint (must be &gt;= 0)
     */
    public CheckpointCursor(final long lastProcessed) {
        initialize(lastProcessed);
    }

    /**
     * Returns the last processed checkpoint.
     *
     * @return the checkpoint, or empty while unset
     */
    public OptionalLong current() {
        return last == UNSET ? OptionalLong.empty() : OptionalLong.of(last);
    }

    public boolean isSet() {
        return last != UNSET;
    }

    /**
     * Adopts a starting checkpoint.
     *
     * @param head the checkpoint to treat as already processed
     * @throws IllegalStateException    if the cursor is already set
     * @throws IllegalArgumentException if head is negative
     */
    public void initialize(final long head) {
        if (head < 0) {
            throw new IllegalArgumentException("checkpoint must be >= 0, got: " + head);
        }
        if (isSet()) {
            throw new IllegalStateException("Cursor already initialized at checkpoint " + last);
        }
        last = head;
    }

    /**
     * Records that the next checkpoint has been fully processed.
     *
     * @param checkpoint the checkpoint just processed; must be exactly one past the current value
     * @throws IllegalStateException    if the cursor is unset
     * @throws IllegalArgumentException if the checkpoint would skip or rewind
     */
    public void advanceTo(final long checkpoint) {
        if (!isSet()) {
            throw new IllegalStateException("Cursor is not initialized");
        }
        if (checkpoint != last + 1) {
            throw new IllegalArgumentException(
                    "Cursor must advance one checkpoint at a time: at " + last + ", got " + checkpoint);
        }
        last = checkpoint;
    }

    /**
     * Returns the first checkpoint not yet processed.
     *
     * @return {@code current + 1}
     * @throws IllegalStateException if the cursor is unset
     */
    public long next() {
        if (!isSet()) {
            throw new IllegalStateException("Cursor is not initialized");
        }
        return last + 1;
    }

    /**
     * Returns the checkpoints still to process, in order.
     *
     * @param latest the latest checkpoint on the chain
     * @return {@code (current, latest]}, empty when the cursor is caught up
     * @throws IllegalStateException if the cursor is unset
     */
    public LongStream pending(final long latest) {
        return LongStream.rangeClosed(next(), latest);
    }

    @Override
    public String toString() {
        return isSet() ? "CheckpointCursor{" + last + "}" : "CheckpointCursor{unset}";
    }
}
