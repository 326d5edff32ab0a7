package com.obseq.engine;

import com.obseq.api.WindowSide;

import java.util.Arrays;

/**
 * One validated DP table, stored as flat arrays.
 *
 * The window records its members in order: slot i holds the element whose
 * positional index (leftIndex for the head window, rightIndex for the tail
 * window) is i. Per-element fields live in arrays indexed by element handle,
 * so every lookup is a single array access and no per-element objects are
 * allocated.
 *
 * Data layout:
 * - members: slot -> element handle, valid for slots [0, size).
 * - index: handle -> slot, UNSET when the element is outside the window.
 * - cut: handle -> element ending (head) or starting (tail) the adjacent group
 * of the element's best partition, or the sentinel on the far side.
 * - cost: handle -> best total cost of the covered prefix / suffix.
 *
 * Elements only ever join at the frontier and leave from the frontier, so
 * contraction never needs to traverse the client sequence.
 *
 * @param <T> Total cost type.
 */
final class Window<T> {
    static final int UNSET = -1;

    private final WindowSide side;
    private final int sentinel;

    private int[] members = new int[16];
    private int size;

    private int[] index = new int[0];
    private int[] cut = new int[0];
    private Object[] cost = new Object[0];

    Window(WindowSide side) {
        this.side = side;
        this.sentinel = side == WindowSide.HEAD ? LinkedView.LEFT : LinkedView.RIGHT;
    }

    WindowSide side() {
        return side;
    }

    int size() {
        return size;
    }

    /** The innermost validated element, or the window's sentinel when empty. */
    int frontier() {
        return size == 0 ? sentinel : members[size - 1];
    }

    int member(int slot) {
        if (slot < 0 || slot >= size)
            throw new IllegalStateException(side + " window has no slot " + slot + " (size " + size + ")");
        return members[slot];
    }

    boolean contains(int e) {
        if (e < 0 || e >= index.length)
            return false;
        int i = index[e];
        return i != UNSET && i < size && members[i] == e;
    }

    /** Positional index of {@code e}, or UNSET. */
    int indexOf(int e) {
        return contains(e) ? index[e] : UNSET;
    }

    @SuppressWarnings("unchecked")
    T cost(int e) {
        requireMember(e);
        return (T) cost[e];
    }

    int cut(int e) {
        requireMember(e);
        return cut[e];
    }

    void push(int e, T bestCost, int bestCut) {
        if (e < 0)
            throw new IllegalArgumentException("Element handles must be non-negative: " + e);
        if (contains(e))
            throw new IllegalStateException("Element " + e + " is already in the " + side + " window");
        ensureHandle(e);
        if (size == members.length)
            members = Arrays.copyOf(members, size * 2);
        members[size] = e;
        index[e] = size;
        cut[e] = bestCut;
        cost[e] = bestCost;
        size++;
    }

    /** Removes the frontier element, clearing its fields. */
    int pop() {
        if (size == 0)
            throw new IllegalStateException(side + " window is already empty");
        int e = members[--size];
        index[e] = UNSET;
        cut[e] = UNSET;
        cost[e] = null;
        return e;
    }

    private void requireMember(int e) {
        if (!contains(e))
            throw new IllegalStateException("Element " + e + " is outside the " + side + " window");
    }

    private void ensureHandle(int e) {
        if (e < index.length)
            return;
        int n = Math.max(e + 1, Math.max(16, index.length * 2));
        int old = index.length;
        index = Arrays.copyOf(index, n);
        cut = Arrays.copyOf(cut, n);
        cost = Arrays.copyOf(cost, n);
        Arrays.fill(index, old, n, UNSET);
        Arrays.fill(cut, old, n, UNSET);
    }
}
