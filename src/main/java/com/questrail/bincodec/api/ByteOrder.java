package com.questrail.bincodec.api;

import java.util.Objects;

/**
 * ByteOrder
 * -----------------------------------------------------------------------------
 * Selects how the bytes of a fixed-width unsigned integer are sequenced.
 *
 * <p>This is pure data: a two-valued selector with no payload. Each constant
 * carries the bit composition rule for its order so that the codec never
 * branches on the selector itself.</p>
 *
 * <ul>
 *   <li>{@link #LITTLE_ENDIAN}: byte 0 is least significant,
 *       {@code value = Σ b[i] << (8*i)}</li>
 *   <li>{@link #BIG_ENDIAN}: byte 0 is most significant,
 *       {@code value = Σ b[i] << (8*(W-1-i))}</li>
 * </ul>
 *
 * <p>Widths are 1 to 8 bytes. Composition results are returned as the raw
 * 64-bit pattern; interpretation as an unsigned value of a given width is the
 * job of {@link UnsignedWidth}.</p>
 */
public enum ByteOrder
{
    LITTLE_ENDIAN {
        @Override
        public long compose(byte[] bytes, int offset, int width)
        {
            long bits = 0L;
            for (int i = width - 1; i >= 0; i--) {
                bits = (bits << 8) | (bytes[offset + i] & 0xFFL);
            }
            return bits;
        }

        @Override
        public void scatter(long bits, byte[] target, int offset, int width)
        {
            for (int i = 0; i < width; i++) {
                target[offset + i] = (byte) ((bits >>> (8 * i)) & 0xFF);
            }
        }
    },

    BIG_ENDIAN {
        @Override
        public long compose(byte[] bytes, int offset, int width)
        {
            long bits = 0L;
            for (int i = 0; i < width; i++) {
                bits = (bits << 8) | (bytes[offset + i] & 0xFFL);
            }
            return bits;
        }

        @Override
        public void scatter(long bits, byte[] target, int offset, int width)
        {
            for (int i = 0; i < width; i++) {
                target[offset + width - 1 - i] = (byte) ((bits >>> (8 * i)) & 0xFF);
            }
        }
    };

    /**
     * Composes {@code width} bytes starting at {@code offset} into one value.
     *
     * <p>No bounds policy is applied here: the caller guarantees that
     * {@code offset + width <= bytes.length}.</p>
     */
    public abstract long compose(byte[] bytes, int offset, int width);

    /**
     * Writes the low {@code width} bytes of {@code bits} into {@code target}
     * starting at {@code offset}, in this order's byte sequence.
     */
    public abstract void scatter(long bits, byte[] target, int offset, int width);

    /**
     * Returns the opposite order.
     */
    public ByteOrder reverse()
    {
        return this == LITTLE_ENDIAN ? BIG_ENDIAN : LITTLE_ENDIAN;
    }

    /**
     * Returns the equivalent JDK selector.
     */
    public java.nio.ByteOrder toNio()
    {
        return this == LITTLE_ENDIAN
                ? java.nio.ByteOrder.LITTLE_ENDIAN
                : java.nio.ByteOrder.BIG_ENDIAN;
    }

    /**
     * Maps a JDK selector onto this enum.
     */
    public static ByteOrder fromNio(java.nio.ByteOrder order)
    {
        Objects.requireNonNull(order, "order");
        return order == java.nio.ByteOrder.LITTLE_ENDIAN ? LITTLE_ENDIAN : BIG_ENDIAN;
    }
}
