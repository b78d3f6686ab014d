package com.questrail.bincodec.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRaggedTail(RaggedTailEvent event) {}

    @Override
    public void onIncompleteBatch(RaggedTailEvent event) {}
}
