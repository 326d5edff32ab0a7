package com.obseq.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.obseq.engine.PartitionEngine;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a {@link PartitionEngine} behind a Disruptor ring buffer.
 *
 * <p>
 * Any number of producer threads may call {@link #publish}; edits are applied
 * and solved strictly one at a time on the single consumer thread.
 */
@Log4j2
public final class EditPipeline implements AutoCloseable {
    private final Disruptor<EditEvent> disruptor;
    private final PartitionPublisher publisher;
    private RingBuffer<EditEvent> ringBuffer;

    /**
     * @param engine     The engine to drive; must not be touched by any other
     *                   thread once the pipeline is started.
     * @param bufferSize Ring buffer size, a power of two.
     */
    public EditPipeline(PartitionEngine<?, ?> engine, int bufferSize) {
        this.publisher = new PartitionPublisher(engine);
        this.disruptor = new Disruptor<>(
                EditEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(publisher);
    }

    public PartitionPublisher publisher() {
        return publisher;
    }

    public EditPipeline start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Pipeline already started");
        ringBuffer = disruptor.start();
        log.info("Edit pipeline started (buffer size {})", ringBuffer.getBufferSize());
        return this;
    }

    /**
     * Publishes an edit. Blocks while the ring buffer is full.
     *
     * @param edit     Mutation to run on the consumer thread, may be null.
     * @param after    Last unchanged element before the edit, or NONE.
     * @param before   First unchanged element after the edit, or NONE.
     * @param batchEnd If true, forces a solve once this event is consumed.
     */
    public void publish(SequenceEdit edit, int after, int before, boolean batchEnd) {
        if (ringBuffer == null)
            throw new IllegalStateException("Pipeline not started");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(edit, after, before, batchEnd, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Waits for all published edits to be processed, then stops the consumer. */
    @Override
    public void close() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Edit pipeline stopped after {} edits", publisher.editsApplied());
    }
}
