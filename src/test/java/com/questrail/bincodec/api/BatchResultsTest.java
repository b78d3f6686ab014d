package com.questrail.bincodec.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the outcome and aggregate value types.
 */
final class BatchResultsTest
{
    @Test
    void undecodedKeepsPrivateCopyOfBytes()
    {
        byte[] source = { 0x7F };
        DecodeOutcome<Integer> outcome = DecodeOutcome.undecoded(source);
        source[0] = 0x00;

        DecodeOutcome.Undecoded<Integer> undecoded = assertInstanceOf(DecodeOutcome.Undecoded.class, outcome);
        assertArrayEquals(new byte[] { 0x7F }, undecoded.bytes());

        undecoded.bytes()[0] = 0x01;
        assertArrayEquals(new byte[] { 0x7F }, undecoded.bytes());
        assertEquals(1, undecoded.byteCount());
        assertFalse(undecoded.isDecoded());
    }

    @Test
    void undecodedEqualityIsByContent()
    {
        assertEquals(DecodeOutcome.<Integer>undecoded(new byte[] { 1, 2 }),
                DecodeOutcome.<Integer>undecoded(new byte[] { 1, 2 }));
        assertNotEquals(DecodeOutcome.<Integer>undecoded(new byte[] { 1 }),
                DecodeOutcome.<Integer>undecoded(new byte[] { 2 }));
    }

    @Test
    void batchResultIsImmutableSnapshot()
    {
        List<Integer> values = new ArrayList<>(List.of(1, 2));
        BatchResult<Integer> batch = new BatchResult<>(values, 0);
        values.add(3);

        assertEquals(List.of(1, 2), batch.decoded());
        assertThrows(UnsupportedOperationException.class, () -> batch.decoded().add(4));
        assertTrue(batch.isComplete());
        assertEquals(2, batch.decodedCount());
    }

    @Test
    void batchResultRejectsNegativeRemainder()
    {
        assertThrows(IllegalArgumentException.class, () -> new BatchResult<>(List.of(), -1));
    }

    @Test
    void exactResultIsAllDecodedOnlyWithoutRemainder()
    {
        ExactBatchResult<Integer> all = ExactBatchResult.of(new BatchResult<>(List.of(1, 2), 0));
        assertEquals(new ExactBatchResult.AllDecoded<>(List.of(1, 2)), all);
        assertEquals(Optional.of(List.of(1, 2)), all.values());
        assertTrue(all.isAllDecoded());

        ExactBatchResult<Integer> partial = ExactBatchResult.of(new BatchResult<>(List.of(1, 2), 1));
        assertEquals(new ExactBatchResult.Incomplete<>(1), partial);
        assertTrue(partial.values().isEmpty());
        assertFalse(partial.isAllDecoded());
    }

    @Test
    void incompleteRequiresPositiveCount()
    {
        assertThrows(IllegalArgumentException.class, () -> new ExactBatchResult.Incomplete<Long>(0));
    }
}
