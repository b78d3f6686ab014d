package com.questrail.bincodec.observability;

/**
 * Main interface for receiving codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Codec instances are shared across threads, so implementations must be
 * thread-safe.</p>
 */
public interface CodecObservabilitySink {
    /**
     * Called when a batch decode leaves undecoded trailing bytes.
     * @param event the ragged tail details
     */
    void onRaggedTail(RaggedTailEvent event);

    /**
     * Called when an exact batch decode is rejected because of a ragged tail.
     * @param event the ragged tail details
     */
    void onIncompleteBatch(RaggedTailEvent event);
}
