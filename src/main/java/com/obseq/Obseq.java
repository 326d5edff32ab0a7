package com.obseq;

import com.obseq.api.CostAlgebra;
import com.obseq.api.Traversal;
import com.obseq.engine.PartitionEngine;

/**
 * Obseq: incremental optimal partitioning of client-owned sequences.
 *
 * <h2>Model</h2>
 * <p>
 * A client keeps an ordered sequence of elements (an "obseq") and wants it
 * split into contiguous groups of minimum total cost:
 * <ul>
 * <li><b>Elements</b> are addressed by stable integer handles and walked
 * through a {@link Traversal}; the engine never copies the sequence.</li>
 * <li><b>Costs</b> come from a pluggable {@link CostAlgebra}.</li>
 * <li><b>Edits</b> are reported as damaged regions; only table entries that
 * depend on the damaged region are recomputed.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Windowed:</b> A solve certifies one optimal cut from two partial DP
 * tables, often without scanning the whole sequence.</li>
 * <li><b>O(1) ordering:</b> Window positions give constant-time element
 * comparisons.</li>
 * <li><b>Disruptor Ready:</b> {@link com.obseq.disruptor.EditPipeline} puts
 * the engine behind a ring buffer for single-owner, lock-free operation.</li>
 * </ul>
 */
public final class Obseq {

    private Obseq() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new engine builder.
     *
     * @param traversal The client's traversal over its sequence.
     * @param algebra   The cost model to optimize.
     * @return A new {@link PartitionEngine.Builder}.
     */
    public static <G, T> PartitionEngine.Builder<G, T> builder(Traversal traversal, CostAlgebra<G, T> algebra) {
        return PartitionEngine.builder(traversal, algebra);
    }
}
