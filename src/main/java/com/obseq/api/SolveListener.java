package com.obseq.api;

/**
 * Observability interface for monitoring the partition engine.
 *
 * Implementations can be registered with the PartitionEngine to receive
 * callbacks while it grows and shrinks its windows and certifies cuts. This is
 * the primary mechanism for:
 *
 * - Profiling: Measuring how long a solve takes (end time - start time).
 * - Debugging: Tracing which elements were (re)computed by a solve.
 * - Metrics: Counting how much of the sequence an edit actually invalidated.
 *
 * Performance Warning:
 * Window callbacks fire once per expanded or contracted element. Keep
 * implementations lightweight; any blocking I/O here directly slows every
 * solve.
 */
public interface SolveListener {

    /**
     * Called immediately before a solve starts searching.
     * Not called for a solve that is a no-op because nothing changed.
     *
     * @param epoch The incrementing solve counter of the engine.
     */
    void onSolveStart(long epoch);

    /**
     * Called after one element has been added to a window.
     *
     * @param epoch   Current solve epoch.
     * @param side    Which window grew.
     * @param element The element that joined the window.
     * @param index   Its positional index within that window.
     */
    void onWindowExpanded(long epoch, WindowSide side, int element, int index);

    /**
     * Called after one element has been dropped from a window by a damage
     * notification.
     *
     * @param epoch   The epoch of the last solve.
     * @param side    Which window shrank.
     * @param element The element that left the window.
     */
    void onWindowContracted(long epoch, WindowSide side, int element);

    /**
     * Called once the optimal cut has been certified.
     *
     * @param epoch      Current solve epoch.
     * @param cut        The certified cut, or null for an empty sequence.
     * @param candidates Number of cut candidates evaluated during the search.
     */
    void onCutCertified(long epoch, Cut cut, int candidates);

    /**
     * Called when a collaborator (cost algebra or traversal) threw during a
     * solve.
     *
     * @param epoch Current solve epoch.
     * @param error The exception that occurred.
     */
    void onSolveError(long epoch, Throwable error);

    /**
     * Called when the solve is complete, successfully or not.
     *
     * @param epoch      Current solve epoch.
     * @param expansions Number of elements added to either window during this
     *                   solve.
     */
    void onSolveEnd(long epoch, int expansions);
}
