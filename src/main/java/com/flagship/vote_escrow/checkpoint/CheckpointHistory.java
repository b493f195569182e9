package com.flagship.vote_escrow.checkpoint;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Immutable, append-only sequence of checkpoints addressed by a 1-based epoch.
 *
 * Epoch 0 is the empty history. {@link #append(Checkpoint)} returns a new history
 * that shares the backing array with this one whenever the next slot is still
 * free, so appends are amortised O(1) while every published history stays
 * unchanged for its readers. {@link #replaceLast(Checkpoint)} always copies.
 *
 * @param <P> checkpoint type
 */
public final class CheckpointHistory<P extends Checkpoint> {

    private static final int INITIAL_CAPACITY = 8;

    private final Object[] points;
    private final int size;
    // highest slot count handed out on the shared backing array
    private final AtomicInteger claimed;

    private CheckpointHistory(Object[] points, int size, AtomicInteger claimed) {
        this.points = points;
        this.size = size;
        this.claimed = claimed;
    }

    public static <P extends Checkpoint> CheckpointHistory<P> empty() {
        return new CheckpointHistory<>(new Object[INITIAL_CAPACITY], 0, new AtomicInteger(0));
    }

    /**
     * Number of checkpoints, which is also the epoch of the most recent one.
     */
    public int epoch() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the checkpoint at the given epoch (1-based).
     */
    @SuppressWarnings("unchecked")
    public P get(int epoch) {
        if (epoch < 1 || epoch > size) {
            throw new IndexOutOfBoundsException("Epoch " + epoch + " outside [1, " + size + "]");
        }
        return (P) points[epoch - 1];
    }

    public P last() {
        if (size == 0) {
            throw new NoSuchElementException("History is empty");
        }
        return get(size);
    }

    public CheckpointHistory<P> append(P point) {
        if (size < points.length && claimed.compareAndSet(size, size + 1)) {
            points[size] = point;
            return new CheckpointHistory<>(points, size + 1, claimed);
        }
        Object[] copy = Arrays.copyOf(points, Math.max(INITIAL_CAPACITY, points.length * 2));
        copy[size] = point;
        return new CheckpointHistory<>(copy, size + 1, new AtomicInteger(size + 1));
    }

    public CheckpointHistory<P> replaceLast(P point) {
        if (size == 0) {
            throw new NoSuchElementException("History is empty");
        }
        Object[] copy = Arrays.copyOf(points, points.length);
        copy[size - 1] = point;
        return new CheckpointHistory<>(copy, size, new AtomicInteger(size));
    }

    /**
     * Appends the point, or overwrites the latest one when it carries the same timestamp.
     */
    public CheckpointHistory<P> record(P point) {
        if (size > 0 && last().getTimestamp() == point.getTimestamp()) {
            return replaceLast(point);
        }
        return append(point);
    }

    public void forEach(Consumer<? super P> action) {
        for (int epoch = 1; epoch <= size; epoch++) {
            action.accept(get(epoch));
        }
    }
}
