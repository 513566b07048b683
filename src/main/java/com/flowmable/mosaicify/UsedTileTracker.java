package com.flowmable.mosaicify;

import java.util.BitSet;

/**
 * Tile indices placed since the last reset, for duplicate avoidance.
 * <p>
 * Not thread-safe; only the traversal thread mutates it, and only between scans.
 */
public final class UsedTileTracker {

    private final int librarySize;
    private final BitSet used;
    private int resets;

    public UsedTileTracker(int librarySize) {
        if (librarySize <= 0) {
            throw new IllegalArgumentException("librarySize must be positive");
        }
        this.librarySize = librarySize;
        this.used = new BitSet(librarySize);
    }

    /**
     * Clear the set if every tile has been used.
     *
     * @return true if a reset happened
     */
    public boolean resetIfExhausted() {
        if (used.cardinality() == librarySize) {
            used.clear();
            resets++;
            return true;
        }
        return false;
    }

    public boolean isUsed(int index) {
        return used.get(index);
    }

    public void markUsed(int index) {
        if (index < 0 || index >= librarySize) {
            throw new IndexOutOfBoundsException("tile index " + index + " outside library of " + librarySize);
        }
        used.set(index);
    }

    public int size() {
        return used.cardinality();
    }

    public int librarySize() {
        return librarySize;
    }

    /** Number of resets so far. */
    public int resetCount() {
        return resets;
    }
}
