package com.questrail.bincodec.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onRaggedTail(RaggedTailEvent event) {
        log.debug("{} {} batch: {} bytes -> {} values, {} trailing bytes undecoded",
            event.width(),
            event.order(),
            event.inputLength(),
            event.decodedCount(),
            event.remainingByteCount());
    }

    @Override
    public void onIncompleteBatch(RaggedTailEvent event) {
        log.warn("{} {} exact decode rejected: {} bytes is not a multiple of the width ({} trailing)",
            event.width(),
            event.order(),
            event.inputLength(),
            event.remainingByteCount());
    }
}
