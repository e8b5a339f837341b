package org.atsp.core.random;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Lazy uniform permutation of {@code [0, n)} backed by a sparse Fisher-Yates remap table.
 *
 * <p>Produces the same distribution as an in-place Fisher-Yates shuffle of {@code 0..n-1}
 * without allocating the array: only positions that were swapped are stored, so after
 * {@code k} values the table holds at most {@code k} entries.</p>
 *
 * <p>The iterator is consuming and single-use. It is NOT thread-safe.</p>
 */
public final class SparseFisherYates implements IntIterator {
    private final SplittableRandom random;
    // remap[i] = value currently sitting at virtual slot i; absent means i itself
    private final Int2IntOpenHashMap remap = new Int2IntOpenHashMap();
    private int cursor;

    /**
     * Creates a permutation over {@code [0, n)}.
     *
     * @param n permutation size, must be non-negative.
     * @param random randomness source (consumed as values are drawn).
     * @throws IllegalArgumentException if {@code n} is negative.
     */
    public SparseFisherYates(int n, SplittableRandom random) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        this.random = Objects.requireNonNull(random, "random");
        this.cursor = n - 1;
        this.remap.defaultReturnValue(-1);
    }

    /**
     * Convenience factory mirroring the constructor.
     */
    public static SparseFisherYates of(int n, SplittableRandom random) {
        return new SparseFisherYates(n, random);
    }

    @Override
    public boolean hasNext() {
        return cursor >= 0;
    }

    @Override
    public int nextInt() {
        if (cursor < 0) {
            throw new NoSuchElementException("permutation exhausted");
        }
        int i = cursor--;
        int r = random.nextInt(i + 1);
        int value = valueAt(r);
        if (r != i) {
            remap.put(r, valueAt(i));
        }
        // slot i is behind the cursor now and never read again
        remap.remove(i);
        return value;
    }

    /**
     * Number of values still to be produced.
     */
    public int remaining() {
        return cursor + 1;
    }

    /**
     * Number of remap entries currently held.
     */
    int tableSize() {
        return remap.size();
    }

    private int valueAt(int slot) {
        int mapped = remap.get(slot);
        return mapped < 0 ? slot : mapped;
    }
}
