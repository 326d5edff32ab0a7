package com.obseq.engine;

import com.obseq.api.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The engine that finds and maintains the optimal partition of a client
 * sequence.
 *
 * The sequence is never copied. The engine keeps two partial DP tables over it
 * and grows them only as far as needed to certify one optimal cut:
 *
 * - Head window: for every element from the sequence start through head, the
 * best total cost of partitioning the prefix ending there, and where that
 * prefix's last group starts.
 * - Tail window: the mirror, for every element from tail through the sequence
 * end, covering the suffix starting there.
 *
 * Algorithm Details:
 *
 * 1. Close the gap: grow head and tail alternately until they overlap. From
 * then on every element has at least one valid entry.
 *
 * 2. Search the overlap: a boundary covered by both windows has an exact cost,
 * the prefix cost left of it joined with the suffix cost right of it. Any
 * partition that cuts at none of these boundaries must keep the whole
 * unresolved region around the overlap in a single group. If the algebra
 * certifies that such a group can only get more expensive, and the best
 * boundary already beats it, the search stops. Otherwise the windows keep
 * growing outward until one reaches a sequence end, where the boundary cost is
 * the global optimum.
 *
 * 3. Cache: the winning boundary is kept as the best cut. Intervals are
 * answered by following the cached cut chains outward from it, one group per
 * hop.
 *
 * Damage:
 * When the client edits its sequence it declares which region changed. Table
 * entries outside that region depend only on unchanged elements and are kept;
 * the windows are trimmed back to it, and the next solve re-grows only what is
 * missing.
 *
 * Threading:
 * Single-threaded and non-reentrant. Concurrent {@link #interval(int)} calls
 * are only safe between a completed solve and the next mutation.
 *
 * @param <G> Group cost type of the algebra.
 * @param <T> Total cost type of the algebra.
 */
public final class PartitionEngine<G, T> {
    private static final Logger log = LogManager.getLogger(PartitionEngine.class);

    /** Index value reported for elements outside a window. */
    public static final int UNSET = Window.UNSET;

    private final LinkedView view;
    private final Window<T> prefix = new Window<>(WindowSide.HEAD);
    private final Window<T> suffix = new Window<>(WindowSide.TAIL);

    private CostAlgebra<G, T> algebra;
    private final boolean expansionPruning;
    private SolveListener listener;

    private boolean solved;
    // Set by the first successful solve under the current algebra.
    private boolean certified;
    private Cut bestCut;
    private long epoch;

    // Per-solve search state
    private T bestCost;
    private int bestElement;
    private CutSide bestSide;
    private int candidates;
    private int expansions;

    private PartitionEngine(Traversal traversal, CostAlgebra<G, T> algebra, SolveListener listener,
            boolean expansionPruning) {
        this.view = new LinkedView(traversal);
        this.algebra = algebra;
        this.listener = listener;
        this.expansionPruning = expansionPruning;
    }

    public static <G, T> Builder<G, T> builder(Traversal traversal, CostAlgebra<G, T> algebra) {
        return new Builder<>(traversal, algebra);
    }

    public void setListener(SolveListener listener) {
        this.listener = listener;
    }

    /**
     * Replaces the cost model. Every cached entry was computed under the old
     * model, so both windows collapse and a new {@link #solve()} is required
     * before {@link #interval(int)} can be answered again.
     */
    public void setCostAlgebra(CostAlgebra<G, T> algebra) {
        if (algebra == null)
            throw new IllegalArgumentException("Cost algebra must not be null");
        while (prefix.size() > 0)
            contractHead();
        while (suffix.size() > 0)
            contractTail();
        this.algebra = algebra;
        this.solved = false;
        this.certified = false;
        this.bestCut = null;
        log.debug("Cost algebra replaced, windows collapsed");
    }

    public CostAlgebra<G, T> costAlgebra() {
        return algebra;
    }

    // ── Window growth ────────────────────────────────────────────

    /**
     * Advances head by one element and computes that element's best prefix
     * partition.
     *
     * Every group start from the new head back to the sequence start is tried,
     * the group cost being extended one element leftwards per step. Among
     * equal costs the first one found (the group start closest to head) wins.
     *
     * @throws IllegalStateException if head already is the last element.
     */
    public void expandHead() {
        int oldHead = prefix.frontier();
        if (view.isRightmost(oldHead))
            throw new IllegalStateException("Head window already covers the last element");
        requireAlgebra();
        int h = view.next(oldHead);
        requireHandle(h);

        final CostAlgebra<G, T> a = this.algebra;
        final int slot = prefix.size();
        G group = null;
        T best = null;
        int bestCutAt = LinkedView.LEFT;

        for (int i = slot; i >= 0; i--) {
            int s = i == slot ? h : prefix.member(i);
            group = group == null ? a.singleton(s) : a.extendLeft(s, group);
            int p = i == 0 ? LinkedView.LEFT : prefix.member(i - 1);
            T candidate = p == LinkedView.LEFT ? a.close(group) : a.append(prefix.cost(p), group);
            if (best == null || a.less(candidate, best)) {
                best = candidate;
                bestCutAt = p;
            }
            // Longer groups can only cost more than close(group) > best.
            if (expansionPruning && i > 0 && a.cannotDecrease(group) && a.less(best, a.close(group)))
                break;
        }

        prefix.push(h, best, bestCutAt);
        solved = false;
        expansions++;
        if (listener != null)
            listener.onWindowExpanded(epoch, WindowSide.HEAD, h, slot);
    }

    /**
     * Moves tail one element left and computes that element's best suffix
     * partition. Mirror of {@link #expandHead()}.
     *
     * @throws IllegalStateException if tail already is the first element.
     */
    public void expandTail() {
        int oldTail = suffix.frontier();
        if (view.isLeftmost(oldTail))
            throw new IllegalStateException("Tail window already covers the first element");
        requireAlgebra();
        int t = view.prev(oldTail);
        requireHandle(t);

        final CostAlgebra<G, T> a = this.algebra;
        final int slot = suffix.size();
        G group = null;
        T best = null;
        int bestCutAt = LinkedView.RIGHT;

        for (int i = slot; i >= 0; i--) {
            int s = i == slot ? t : suffix.member(i);
            group = group == null ? a.singleton(s) : a.extendRight(group, s);
            int n = i == 0 ? LinkedView.RIGHT : suffix.member(i - 1);
            T candidate = n == LinkedView.RIGHT ? a.close(group) : a.prepend(group, suffix.cost(n));
            if (best == null || a.less(candidate, best)) {
                best = candidate;
                bestCutAt = n;
            }
            if (expansionPruning && i > 0 && a.cannotDecrease(group) && a.less(best, a.close(group)))
                break;
        }

        suffix.push(t, best, bestCutAt);
        solved = false;
        expansions++;
        if (listener != null)
            listener.onWindowExpanded(epoch, WindowSide.TAIL, t, slot);
    }

    /**
     * Drops head's entry and moves head one element left.
     *
     * @throws IllegalStateException if the head window is empty.
     */
    public void contractHead() {
        int e = prefix.pop();
        solved = false;
        if (listener != null)
            listener.onWindowContracted(epoch, WindowSide.HEAD, e);
    }

    /**
     * Drops tail's entry and moves tail one element right.
     *
     * @throws IllegalStateException if the tail window is empty.
     */
    public void contractTail() {
        int e = suffix.pop();
        solved = false;
        if (listener != null)
            listener.onWindowContracted(epoch, WindowSide.TAIL, e);
    }

    // ── Solve ────────────────────────────────────────────────────

    /**
     * Finds and certifies one optimal cut. A no-op if nothing changed since the
     * last successful solve.
     *
     * @throws IllegalStateException if no cost algebra is set.
     * @throws RuntimeException      if the cost algebra or traversal threw; the
     *                               entries computed before the failure are kept.
     */
    public void solve() {
        if (solved)
            return;
        requireAlgebra();

        epoch++;
        expansions = 0;
        candidates = 0;
        final SolveListener l = this.listener;
        if (l != null)
            l.onSolveStart(epoch);

        try {
            if (view.isEmpty()) {
                bestCut = null;
            } else {
                closeGap();
                searchOverlap();
                bestCut = new Cut(bestElement, bestSide);
            }
            solved = true;
            certified = true;
            log.debug("Epoch {}: certified cut {} ({} candidates, {} expansions, head={}, tail={})",
                    epoch, bestCut, candidates, expansions, prefix.size(), suffix.size());
            if (l != null)
                l.onCutCertified(epoch, bestCut, candidates);
        } catch (RuntimeException e) {
            if (l != null)
                l.onSolveError(epoch, e);
            throw new RuntimeException("Solve failed at epoch " + epoch + ": " + e.getMessage(), e);
        } finally {
            bestCost = null;
            if (l != null)
                l.onSolveEnd(epoch, expansions);
        }
    }

    private void closeGap() {
        boolean growHead = true;
        while (!prefix.contains(suffix.frontier())) {
            if ((growHead || view.isLeftmost(suffix.frontier())) && !view.isRightmost(prefix.frontier()))
                expandHead();
            else
                expandTail();
            growHead = !growHead;
        }
    }

    private void searchOverlap() {
        final CostAlgebra<G, T> a = this.algebra;
        bestCost = null;

        int head = prefix.frontier();
        int tail = suffix.frontier();
        for (int i = prefix.indexOf(tail); i < prefix.size(); i++)
            consider(prefix.member(i), CutSide.LEFT);
        consider(head, CutSide.RIGHT);

        if (view.isLeftmost(tail) || view.isRightmost(head))
            return;

        // The region prev(tail)..next(head) taken as one group.
        int e = view.prev(tail);
        final int stop = view.next(head);
        G gap = a.singleton(e);
        while (e != stop) {
            e = view.next(e);
            gap = a.extendRight(gap, e);
        }

        boolean growTail = true;
        while (!view.isLeftmost(suffix.frontier()) && !view.isRightmost(prefix.frontier())) {
            if (a.cannotDecrease(gap) && a.less(bestCost, a.close(gap)))
                break;
            if (growTail) {
                expandTail();
                int t = suffix.frontier();
                consider(t, CutSide.LEFT);
                if (!view.isLeftmost(t))
                    gap = a.extendLeft(view.prev(t), gap);
            } else {
                expandHead();
                int h = prefix.frontier();
                consider(h, CutSide.RIGHT);
                if (!view.isRightmost(h))
                    gap = a.extendRight(gap, view.next(h));
            }
            growTail = !growTail;
        }
    }

    private void consider(int e, CutSide side) {
        T cost = side == CutSide.LEFT ? costAtLeftCut(e) : costAtRightCut(e);
        candidates++;
        if (bestCost == null || algebra.less(cost, bestCost)) {
            bestCost = cost;
            bestElement = e;
            bestSide = side;
        }
    }

    /**
     * Exact cost of the best partition that starts a group at {@code e}.
     * Requires {@code e} in the tail window and its predecessor in the head
     * window.
     */
    public T costAtLeftCut(int e) {
        requireAlgebra();
        int p = view.prev(e);
        T right = suffix.cost(e);
        return p == LinkedView.LEFT ? right : algebra.join(prefix.cost(p), right);
    }

    /**
     * Exact cost of the best partition that ends a group at {@code e}.
     * Requires {@code e} in the head window and its successor in the tail
     * window.
     */
    public T costAtRightCut(int e) {
        requireAlgebra();
        int n = view.next(e);
        T left = prefix.cost(e);
        return n == LinkedView.RIGHT ? left : algebra.join(left, suffix.cost(n));
    }

    // ── Damage ───────────────────────────────────────────────────

    /**
     * Declares that elements strictly between {@code after} and
     * {@code before} may have changed, been inserted or been removed. Either
     * bound may be {@link Traversal#NONE} for an open end.
     *
     * Head is trimmed back to {@code after} and tail back to {@code before}.
     * A bound that lies outside its window already excludes every cached entry
     * on that side from the damage.
     */
    public void notifyChanged(int after, int before) {
        requireHandleOrNone(after);
        requireHandleOrNone(before);

        if (after == Traversal.NONE) {
            while (prefix.size() > 0)
                contractHead();
        } else {
            int keep = prefix.indexOf(after);
            if (keep != UNSET)
                while (prefix.size() > keep + 1)
                    contractHead();
        }

        if (before == Traversal.NONE) {
            while (suffix.size() > 0)
                contractTail();
        } else {
            int keep = suffix.indexOf(before);
            if (keep != UNSET)
                while (suffix.size() > keep + 1)
                    contractTail();
        }
        solved = false;
    }

    /**
     * Everything strictly after {@code element} may have changed; everything
     * at or before it is unchanged. {@link Traversal#NONE} means the whole
     * sequence. Every suffix entry reaches the end of the sequence, so the tail
     * window is dropped entirely.
     */
    public void notifyAfter(int element) {
        notifyChanged(element, Traversal.NONE);
    }

    /**
     * Everything strictly before {@code element} may have changed; everything
     * at or after it is unchanged. Mirror of {@link #notifyAfter(int)}.
     */
    public void notifyBefore(int element) {
        notifyChanged(Traversal.NONE, element);
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * Returns the group containing {@code element} in the optimal partition.
     *
     * Re-solves first if damage was reported since the last solve. The walk
     * follows cached cuts outward from the best cut, so its cost is the number
     * of groups between the best cut and the element.
     *
     * @throws IllegalStateException    if no solve succeeded under the current
     *                                  cost algebra.
     * @throws IllegalArgumentException if the element is not part of the
     *                                  solved sequence.
     */
    public Interval interval(int element) {
        if (!certified)
            throw new IllegalStateException("interval() requires a successful solve()");
        requireHandle(element);
        solve();
        if (bestCut == null || (!prefix.contains(element) && !suffix.contains(element)))
            throw new IllegalArgumentException("Element " + element + " is not part of the solved sequence");

        int left = leftOfBestCut();
        int right = rightOfBestCut();
        if (left != LinkedView.LEFT && compare(element, left) <= 0)
            return walkPrefix(element, left);
        return walkSuffix(element, right);
    }

    /**
     * Returns every group of the optimal partition, left to right.
     *
     * @throws IllegalStateException if no solve succeeded under the current
     *                               cost algebra.
     */
    public List<Interval> groups() {
        if (!certified)
            throw new IllegalStateException("groups() requires a successful solve()");
        solve();
        if (bestCut == null)
            return Collections.emptyList();

        List<Interval> out = new ArrayList<>();
        int end = leftOfBestCut();
        while (end != LinkedView.LEFT) {
            int cut = prefix.cut(end);
            out.add(new Interval(firstAfter(cut), end));
            end = cut;
        }
        Collections.reverse(out);

        int start = rightOfBestCut();
        while (start != LinkedView.RIGHT) {
            int cut = suffix.cut(start);
            out.add(new Interval(start, lastBefore(cut)));
            start = cut;
        }
        return out;
    }

    /**
     * Orders two elements in O(1) using positional indices. Both must have
     * been indexed by the last solve.
     *
     * @return negative, zero or positive as {@code a} is left of, equal to or
     *         right of {@code b}.
     */
    public int compare(int a, int b) {
        int la = prefix.indexOf(a), lb = prefix.indexOf(b);
        if (la != UNSET && lb != UNSET)
            return Integer.compare(la, lb);
        int ra = suffix.indexOf(a), rb = suffix.indexOf(b);
        if (ra != UNSET && rb != UNSET)
            return Integer.compare(rb, ra);
        // One is only left of tail, the other only right of head.
        if (la != UNSET && rb != UNSET)
            return -1;
        if (ra != UNSET && lb != UNSET)
            return 1;
        throw new IllegalArgumentException("Cannot order elements " + a + " and " + b + ": not indexed");
    }

    private Interval walkPrefix(int element, int end) {
        while (true) {
            int cut = prefix.cut(end);
            if (cut == LinkedView.LEFT || compare(element, cut) > 0)
                return new Interval(firstAfter(cut), end);
            end = cut;
        }
    }

    private Interval walkSuffix(int element, int start) {
        while (true) {
            int cut = suffix.cut(start);
            if (cut == LinkedView.RIGHT || compare(element, cut) < 0)
                return new Interval(start, lastBefore(cut));
            start = cut;
        }
    }

    private int firstAfter(int cut) {
        return cut == LinkedView.LEFT ? prefix.member(0) : prefix.member(prefix.indexOf(cut) + 1);
    }

    private int lastBefore(int cut) {
        return cut == LinkedView.RIGHT ? suffix.member(0) : suffix.member(suffix.indexOf(cut) + 1);
    }

    private int leftOfBestCut() {
        return bestCut.side() == CutSide.LEFT ? view.prev(bestCut.element()) : bestCut.element();
    }

    private int rightOfBestCut() {
        return bestCut.side() == CutSide.LEFT ? bestCut.element() : view.next(bestCut.element());
    }

    // ── State ────────────────────────────────────────────────────

    public boolean isSolved() {
        return solved;
    }

    /** The certified cut of the last solve; null before any solve or for an empty sequence. */
    public Cut bestCut() {
        return bestCut;
    }

    public long epoch() {
        return epoch;
    }

    /** Rightmost element with valid prefix entries, or {@link LinkedView#LEFT}. */
    public int head() {
        return prefix.frontier();
    }

    /** Leftmost element with valid suffix entries, or {@link LinkedView#RIGHT}. */
    public int tail() {
        return suffix.frontier();
    }

    public int headSize() {
        return prefix.size();
    }

    public int tailSize() {
        return suffix.size();
    }

    /** Position counted from the sequence start, or {@link #UNSET}. */
    public int leftIndex(int element) {
        return prefix.indexOf(element);
    }

    /** Position counted from the sequence end, or {@link #UNSET}. */
    public int rightIndex(int element) {
        return suffix.indexOf(element);
    }

    /** @throws IllegalStateException if the element is outside the head window. */
    public T prefixCost(int element) {
        return prefix.cost(element);
    }

    /** @throws IllegalStateException if the element is outside the tail window. */
    public T suffixCost(int element) {
        return suffix.cost(element);
    }

    /** Element ending the previous group of the element's best prefix partition. */
    public int prefixCut(int element) {
        return prefix.cut(element);
    }

    /** Element starting the next group of the element's best suffix partition. */
    public int suffixCut(int element) {
        return suffix.cut(element);
    }

    public LinkedView view() {
        return view;
    }

    private void requireAlgebra() {
        if (algebra == null)
            throw new IllegalStateException("No cost algebra set");
    }

    private static void requireHandle(int e) {
        if (e < 0)
            throw new IllegalArgumentException("Not an element handle: " + e);
    }

    private static void requireHandleOrNone(int e) {
        if (e < 0 && e != Traversal.NONE)
            throw new IllegalArgumentException("Not an element handle: " + e);
    }

    /**
     * Builder for a PartitionEngine.
     */
    public static final class Builder<G, T> {
        private final Traversal traversal;
        private CostAlgebra<G, T> algebra;
        private SolveListener listener;
        private boolean expansionPruning = true;

        private Builder(Traversal traversal, CostAlgebra<G, T> algebra) {
            this.traversal = traversal;
            this.algebra = algebra;
        }

        public Builder<G, T> costAlgebra(CostAlgebra<G, T> algebra) {
            this.algebra = algebra;
            return this;
        }

        public Builder<G, T> listener(SolveListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Whether window growth may stop scanning once the algebra's
         * monotonicity oracle proves no longer group can win. Results are the
         * same either way. Enabled by default.
         */
        public Builder<G, T> expansionPruning(boolean enabled) {
            this.expansionPruning = enabled;
            return this;
        }

        public PartitionEngine<G, T> build() {
            return new PartitionEngine<>(traversal, algebra, listener, expansionPruning);
        }
    }
}
