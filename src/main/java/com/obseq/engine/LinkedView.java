package com.obseq.engine;

import com.obseq.api.Traversal;

/**
 * Sentinel-bounded view over a client {@link Traversal}.
 *
 * The raw traversal reports "no element" as {@link Traversal#NONE} at both
 * ends. Inside the engine the two ends must be distinguishable and comparable,
 * so this view substitutes two fixed sentinels: {@link #LEFT} before the first
 * element and {@link #RIGHT} after the last one.
 *
 * The rightmost/leftmost tests ask the raw traversal, so they always reflect
 * the client's current structure.
 */
public final class LinkedView {
    /** Sentinel before the first real element. */
    public static final int LEFT = -2;
    /** Sentinel after the last real element. */
    public static final int RIGHT = -3;

    private final Traversal traversal;

    public LinkedView(Traversal traversal) {
        if (traversal == null)
            throw new IllegalArgumentException("Traversal must not be null");
        this.traversal = traversal;
    }

    public Traversal traversal() {
        return traversal;
    }

    /**
     * Element after {@code e}; {@link #RIGHT} after the last one.
     *
     * @throws IllegalStateException if {@code e} is the right sentinel.
     */
    public int next(int e) {
        if (e == RIGHT)
            throw new IllegalStateException("Cannot step past the right sentinel");
        int n = traversal.next(e == LEFT ? Traversal.NONE : e);
        return n == Traversal.NONE ? RIGHT : n;
    }

    /**
     * Element before {@code e}; {@link #LEFT} before the first one.
     *
     * @throws IllegalStateException if {@code e} is the left sentinel.
     */
    public int prev(int e) {
        if (e == LEFT)
            throw new IllegalStateException("Cannot step past the left sentinel");
        int p = traversal.prev(e == RIGHT ? Traversal.NONE : e);
        return p == Traversal.NONE ? LEFT : p;
    }

    /** True if nothing real follows {@code e}. */
    public boolean isRightmost(int e) {
        if (e == RIGHT)
            return true;
        return traversal.next(e == LEFT ? Traversal.NONE : e) == Traversal.NONE;
    }

    /** True if nothing real precedes {@code e}. */
    public boolean isLeftmost(int e) {
        if (e == LEFT)
            return true;
        return traversal.prev(e == RIGHT ? Traversal.NONE : e) == Traversal.NONE;
    }

    public boolean isEmpty() {
        return traversal.next(Traversal.NONE) == Traversal.NONE;
    }

    public static boolean isSentinel(int e) {
        return e == LEFT || e == RIGHT;
    }
}
