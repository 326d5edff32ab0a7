package com.obseq.disruptor;

import com.lmax.disruptor.EventHandler;
import com.obseq.engine.PartitionEngine;
import com.obseq.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

/**
 * Disruptor EventHandler that consumes EditEvents and drives the engine.
 *
 * <p>
 * This class acts as the bridge between the LMAX Disruptor ring buffer and a
 * {@link PartitionEngine}. It runs on a single dedicated consumer thread, which
 * thereby becomes the one owner of both the client sequence and the engine.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer writes an {@link EditEvent} into the ring buffer.</li>
 * <li>This handler applies the event's edit to the client sequence and reports
 * the damaged region to the engine, trimming its windows.</li>
 * <li><b>Batching:</b> {@link PartitionEngine#solve()} runs only at the end of a
 * batch (the Disruptor's {@code endOfBatch} or the event's own flag), so a
 * burst of edits is re-optimized once.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * An exception from the edit, the damage notification or the solve is counted
 * and logged here, rate-limited, and never reaches the Disruptor: the consumer
 * thread stays alive and the next batch re-solves from the entries that
 * survived. The damage bounds are reported even when the edit threw, since it
 * may have changed the sequence before failing.
 */
@Log4j2
public final class PartitionPublisher implements EventHandler<EditEvent> {
    private final PartitionEngine<?, ?> engine;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);
    private PostSolveCallback postSolve;
    private long editsApplied;
    private long failures;

    public PartitionPublisher(PartitionEngine<?, ?> engine) {
        this.engine = engine;
    }

    /**
     * Sets a callback invoked after every solve, on the consumer thread.
     * Intervals may be read from the engine inside the callback.
     */
    public void setPostSolveCallback(PostSolveCallback cb) {
        this.postSolve = cb;
    }

    @Override
    public void onEvent(EditEvent event, long sequence, boolean endOfBatch) {
        try {
            SequenceEdit edit = event.edit();
            try {
                if (edit != null) {
                    edit.apply();
                    editsApplied++;
                }
            } finally {
                engine.notifyChanged(event.after(), event.before());
            }

            if (event.isBatchEnd() || endOfBatch) {
                engine.solve();
                if (postSolve != null)
                    postSolve.onSolved(engine, engine.epoch());
            }
        } catch (RuntimeException e) {
            failures++;
            errors.log("Edit " + sequence + " failed: " + e.getMessage(), e);
        } finally {
            event.clear();
        }
    }

    public long editsApplied() {
        return editsApplied;
    }

    /** Events whose edit, notification or solve threw. */
    public long failures() {
        return failures;
    }

    /**
     * Callback interface for post-solve actions.
     */
    @FunctionalInterface
    public interface PostSolveCallback {
        /**
         * Called after the engine has re-solved.
         *
         * @param engine The solved engine.
         * @param epoch  Its solve epoch.
         */
        void onSolved(PartitionEngine<?, ?> engine, long epoch);
    }
}
