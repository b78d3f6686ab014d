package com.questrail.bincodec.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ByteOrderTest
 * -----------------------------------------------------------------------------
 * Unit tests for the bit composition rules carried by {@link ByteOrder}.
 */
final class ByteOrderTest
{
    private static final byte[] BYTES = { 0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07, (byte) 0x80 };

    @Test
    void littleEndianTreatsFirstByteAsLeastSignificant()
    {
        assertEquals(0x0201L, ByteOrder.LITTLE_ENDIAN.compose(BYTES, 0, 2));
        assertEquals(0x04030201L, ByteOrder.LITTLE_ENDIAN.compose(BYTES, 0, 4));
        assertEquals(0x8007060504030201L, ByteOrder.LITTLE_ENDIAN.compose(BYTES, 0, 8));
    }

    @Test
    void bigEndianTreatsFirstByteAsMostSignificant()
    {
        assertEquals(0x0102L, ByteOrder.BIG_ENDIAN.compose(BYTES, 0, 2));
        assertEquals(0x01020304L, ByteOrder.BIG_ENDIAN.compose(BYTES, 0, 4));
        assertEquals(0x0102030405060780L, ByteOrder.BIG_ENDIAN.compose(BYTES, 0, 8));
    }

    @Test
    void composeHonoursOffset()
    {
        assertEquals(0x0706L, ByteOrder.LITTLE_ENDIAN.compose(BYTES, 5, 2));
        assertEquals(0x0607L, ByteOrder.BIG_ENDIAN.compose(BYTES, 5, 2));
    }

    @Test
    void composeDoesNotSignExtendHighBytes()
    {
        byte[] ff = { (byte) 0xFF, (byte) 0xFF };
        assertEquals(0xFFFFL, ByteOrder.LITTLE_ENDIAN.compose(ff, 0, 2));
        assertEquals(0xFFFFL, ByteOrder.BIG_ENDIAN.compose(ff, 0, 2));
    }

    @Test
    void scatterIsInverseOfCompose()
    {
        for (ByteOrder order : ByteOrder.values()) {
            byte[] out = new byte[8];
            order.scatter(0x8007060504030201L, out, 0, 8);
            assertEquals(0x8007060504030201L, order.compose(out, 0, 8), order.name());
        }
    }

    @Test
    void scatterWritesOnlyTheRequestedWidth()
    {
        byte[] out = new byte[4];
        ByteOrder.BIG_ENDIAN.scatter(0x1234L, out, 1, 2);
        assertArrayEquals(new byte[] { 0x00, 0x12, 0x34, 0x00 }, out);

        ByteOrder.LITTLE_ENDIAN.scatter(0x1234L, out, 1, 2);
        assertArrayEquals(new byte[] { 0x00, 0x34, 0x12, 0x00 }, out);
    }

    @Test
    void reverseSwapsOrder()
    {
        assertSame(ByteOrder.BIG_ENDIAN, ByteOrder.LITTLE_ENDIAN.reverse());
        assertSame(ByteOrder.LITTLE_ENDIAN, ByteOrder.BIG_ENDIAN.reverse());
    }

    @Test
    void nioBridgeRoundTrips()
    {
        for (ByteOrder order : ByteOrder.values()) {
            assertSame(order, ByteOrder.fromNio(order.toNio()));
        }
        assertSame(java.nio.ByteOrder.LITTLE_ENDIAN, ByteOrder.LITTLE_ENDIAN.toNio());
        assertThrows(NullPointerException.class, () -> ByteOrder.fromNio(null));
    }
}
