package com.questrail.bincodec.codec.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ByteChunker
 * -----------------------------------------------------------------------------
 * Splits a byte sequence into consecutive chunks of a fixed width.
 *
 * <p>For an input of length L and width W the result holds exactly
 * {@code ceil(L / W)} chunks. All have length W except the last, which has
 * length {@code L mod W} when that is non-zero. Each chunk is a copy, never a
 * view, so concatenating the chunks reconstructs the input exactly.</p>
 */
public final class ByteChunker
{
    private ByteChunker() {}

    /**
     * @param bytes input sequence (not modified)
     * @param width chunk width in bytes
     * @return the chunks in input order; empty for empty input
     * @throws IllegalArgumentException if {@code width} is not positive
     */
    public static List<byte[]> chunk(byte[] bytes, int width)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (width <= 0) {
            throw new IllegalArgumentException("Chunk width must be positive (was " + width + ")");
        }
        if (bytes.length == 0) {
            return Collections.emptyList();
        }

        final int count = chunkCount(bytes.length, width);
        final List<byte[]> chunks = new ArrayList<>(count);

        for (int start = 0; start < bytes.length; start += width) {
            final int end = Math.min(start + width, bytes.length);
            chunks.add(Arrays.copyOfRange(bytes, start, end));
        }
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Returns {@code ceil(length / width)}.
     */
    static int chunkCount(int length, int width)
    {
        return length / width + (length % width == 0 ? 0 : 1);
    }
}
