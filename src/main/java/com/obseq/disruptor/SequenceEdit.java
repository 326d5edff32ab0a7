package com.obseq.disruptor;

/**
 * A client mutation of its own sequence, executed on the engine's owner
 * thread right before the matching damage notification.
 */
@FunctionalInterface
public interface SequenceEdit {

    /** Applies the mutation to the client's sequence. */
    void apply();
}
