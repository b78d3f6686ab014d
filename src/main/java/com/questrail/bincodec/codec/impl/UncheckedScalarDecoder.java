package com.questrail.bincodec.codec.impl;

import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.api.UnsignedWidth;

/**
 * UncheckedScalarDecoder
 * -----------------------------------------------------------------------------
 * Fast-path scalar decode with no length check.
 *
 * <p><strong>Precondition:</strong> {@code chunk.length == width.byteCount()}.
 * This is not verified. A longer chunk is silently truncated to its first W
 * bytes; a shorter one throws {@link ArrayIndexOutOfBoundsException}.</p>
 *
 * <p>Callers are {@link DefaultUnsignedCodec}'s chunk classification, after
 * {@link ByteChunker} has fixed the length, and its bounded decode, once it
 * has checked the remaining length itself.</p>
 */
final class UncheckedScalarDecoder
{
    private UncheckedScalarDecoder() {}

    static <T> T decodeExact(UnsignedWidth<T> width, byte[] chunk, ByteOrder order)
    {
        return decodeAt(width, chunk, 0, order);
    }

    static <T> T decodeAt(UnsignedWidth<T> width, byte[] bytes, int offset, ByteOrder order)
    {
        return width.fromBits(order.compose(bytes, offset, width.byteCount()));
    }
}
