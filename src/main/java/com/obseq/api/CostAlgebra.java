package com.obseq.api;

/**
 * The cost model a partition is optimized against.
 *
 * A partition is an ordered run of groups; each group is a contiguous run of
 * elements. The algebra knows three kinds of cost:
 *
 * - Element: a single client element, addressed by its handle.
 * - Group cost (G): the cost of one group in isolation.
 * - Total cost (T): the cost of a whole partition (or of a prefix / suffix of
 * one).
 *
 * There is no "empty" cost value. The empty group or empty partition is
 * expressed by which operation the engine calls: {@link #singleton(int)} is an
 * element combined with nothing, {@link #close(Object)} is a group that is the
 * only group of its partition.
 *
 * Direction:
 * The engine grows groups in both directions. {@link #extendLeft(int, Object)}
 * and {@link #prepend(Object, Object)} default to their right-hand
 * counterparts with the arguments swapped, which is only correct for an
 * algebra whose combination does not depend on order. An asymmetric algebra
 * must override both mirrors.
 *
 * Monotonicity:
 * {@link #cannotDecrease(Object)} lets the engine stop scanning early. It must
 * only return true when extending the group with further elements can never
 * lower its cost, and when any partition containing a group that includes it
 * costs at least {@code close(group)}. Returning false is always safe.
 *
 * @param <G> Group cost type.
 * @param <T> Total cost type.
 */
public interface CostAlgebra<G, T> {

    /** Cost of a group holding only {@code element}. */
    G singleton(int element);

    /** Cost of {@code group} with {@code element} appended on its right. */
    G extendRight(G group, int element);

    /** Cost of {@code group} with {@code element} prepended on its left. */
    default G extendLeft(int element, G group) {
        return extendRight(group, element);
    }

    /** Total cost of a partition whose only group is {@code group}. */
    T close(G group);

    /** Total cost of {@code total} followed by one more group. */
    T append(T total, G group);

    /** Total cost of one group followed by the partition {@code total}. */
    default T prepend(G group, T total) {
        return append(total, group);
    }

    /**
     * Total cost of the concatenation of two partitions: {@code prefix} covers
     * the elements left of a cut, {@code suffix} the elements right of it.
     *
     * For an additive model this is plain addition.
     */
    T join(T prefix, T suffix);

    /**
     * Strict ordering of total costs. Two costs where neither is less are
     * treated as equal.
     */
    boolean less(T a, T b);

    /**
     * Monotonicity oracle for a group cost.
     *
     * @return true only if growing {@code group} can never make it, or any
     *         partition containing it, cheaper than {@code close(group)}.
     */
    default boolean cannotDecrease(G group) {
        return false;
    }
}
