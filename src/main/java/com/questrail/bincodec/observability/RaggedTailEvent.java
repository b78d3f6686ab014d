package com.questrail.bincodec.observability;

import com.questrail.bincodec.api.ByteOrder;

import java.time.Instant;

/**
 * Record describing a batch decode whose input was not a whole number of
 * values.
 */
public record RaggedTailEvent(
    Instant timestamp,
    String width,
    ByteOrder order,
    int inputLength,
    int decodedCount,
    int remainingByteCount
) {
}
