package com.obseq.disruptor;

import com.obseq.api.Traversal;

/**
 * A mutable holder for one sequence edit, used within the LMAX Disruptor
 * RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for the lifetime of the pipeline.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code edit}: The client mutation to run, or null for a bare damage
 * notification.</li>
 * <li>{@code after} / {@code before}: Bounds of the changed region, exclusive,
 * {@link Traversal#NONE} for an open end.</li>
 * <li>{@code batchEnd}: Forced end-of-batch flag to trigger a solve.</li>
 * </ul>
 */
public final class EditEvent {
    private SequenceEdit edit;
    private int after = Traversal.NONE;
    private int before = Traversal.NONE;
    private boolean batchEnd;
    private long sequenceId;

    /**
     * Configures the event.
     *
     * @param edit     Mutation to apply, may be null.
     * @param after    Last unchanged element before the edit, or NONE.
     * @param before   First unchanged element after the edit, or NONE.
     * @param batchEnd If true, forces a solve after this event.
     * @param seqId    The sequence ID (for correlation/logging).
     */
    public void set(SequenceEdit edit, int after, int before, boolean batchEnd, long seqId) {
        this.edit = edit;
        this.after = after;
        this.before = before;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public SequenceEdit edit() {
        return edit;
    }

    public int after() {
        return after;
    }

    public int before() {
        return before;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        edit = null;
        after = Traversal.NONE;
        before = Traversal.NONE;
        batchEnd = false;
        sequenceId = 0;
    }
}
