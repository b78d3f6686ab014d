package com.questrail.bincodec.codec.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ByteChunkerTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link ByteChunker}.
 *
 * <p>Chunking must be lossless: ceil(L/W) chunks whose concatenation is the
 * input, every chunk full-width except possibly the last.</p>
 */
final class ByteChunkerTest
{
    @Test
    void emptyInputYieldsNoChunks()
    {
        assertTrue(ByteChunker.chunk(new byte[0], 4).isEmpty());
    }

    @Test
    void exactMultipleYieldsFullChunks()
    {
        List<byte[]> chunks = ByteChunker.chunk(new byte[] { 1, 2, 3, 4 }, 2);

        assertEquals(2, chunks.size());
        assertArrayEquals(new byte[] { 1, 2 }, chunks.get(0));
        assertArrayEquals(new byte[] { 3, 4 }, chunks.get(1));
    }

    @Test
    void remainderBecomesShortFinalChunk()
    {
        List<byte[]> chunks = ByteChunker.chunk(new byte[] { 1, 2, 3, 4, 5 }, 2);

        assertEquals(3, chunks.size());
        assertArrayEquals(new byte[] { 5 }, chunks.get(2));
    }

    @Test
    void inputShorterThanWidthIsSingleShortChunk()
    {
        List<byte[]> chunks = ByteChunker.chunk(new byte[] { 9, 8, 7 }, 8);

        assertEquals(1, chunks.size());
        assertArrayEquals(new byte[] { 9, 8, 7 }, chunks.get(0));
    }

    @Test
    void chunksAreCopiesNotViews()
    {
        byte[] input = { 1, 2, 3, 4 };
        List<byte[]> chunks = ByteChunker.chunk(input, 2);

        chunks.get(0)[0] = 42;
        assertEquals(1, input[0]);

        input[3] = 99;
        assertEquals(4, chunks.get(1)[1]);
    }

    @Test
    void chunkingReconstructsInputForEveryLengthAndWidth()
    {
        Random random = new Random(0x5EED);

        for (int width : new int[] { 2, 4, 8 }) {
            for (int length = 0; length <= 3 * width + 1; length++) {
                byte[] input = new byte[length];
                random.nextBytes(input);

                List<byte[]> chunks = ByteChunker.chunk(input, width);

                assertEquals(ByteChunker.chunkCount(length, width), chunks.size());
                assertEquals((length + width - 1) / width, chunks.size());

                ByteArrayOutputStream joined = new ByteArrayOutputStream();
                for (int i = 0; i < chunks.size(); i++) {
                    byte[] chunk = chunks.get(i);
                    if (i < chunks.size() - 1) {
                        assertEquals(width, chunk.length);
                    }
                    joined.writeBytes(chunk);
                }
                assertArrayEquals(input, joined.toByteArray(), "width=" + width + " length=" + length);
            }
        }
    }

    @Test
    void rejectsNonPositiveWidth()
    {
        assertThrows(IllegalArgumentException.class, () -> ByteChunker.chunk(new byte[] { 1 }, 0));
        assertThrows(IllegalArgumentException.class, () -> ByteChunker.chunk(new byte[] { 1 }, -2));
        assertThrows(NullPointerException.class, () -> ByteChunker.chunk(null, 2));
    }
}
