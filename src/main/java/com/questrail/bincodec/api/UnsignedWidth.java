package com.questrail.bincodec.api;

import java.util.Objects;

/**
 * UnsignedWidth
 * -----------------------------------------------------------------------------
 * Type-level width parameter for the fixed-width codec.
 *
 * <p>Java has no unsigned primitive types, so each width names the boxed type
 * that carries its values and the conversion between that type and the raw
 * 64-bit pattern produced by {@link ByteOrder#compose}:</p>
 *
 * <table>
 *   <caption>Supported widths</caption>
 *   <tr><th>Width</th><th>Bytes</th><th>Java type</th><th>Range</th></tr>
 *   <tr><td>{@link #U16}</td><td>2</td><td>{@code Integer}</td><td>0 .. 0xFFFF</td></tr>
 *   <tr><td>{@link #U32}</td><td>4</td><td>{@code Long}</td><td>0 .. 0xFFFF_FFFF</td></tr>
 *   <tr><td>{@link #U64}</td><td>8</td><td>{@code Long}</td><td>all 64 bits, read as unsigned</td></tr>
 * </table>
 *
 * <p>There is exactly one instance per width; identity comparison is valid.
 * Codec logic is written once against this type and instantiated for the
 * three widths.</p>
 *
 * @param <T> the boxed Java type carrying values of this width
 */
public abstract class UnsignedWidth<T>
{
    public static final UnsignedWidth<Integer> U16 = new UnsignedWidth<>("u16", 2, Integer.class)
    {
        @Override
        public Integer fromBits(long bits)
        {
            return (int) (bits & 0xFFFFL);
        }

        @Override
        long checkedBits(Integer value)
        {
            final int v = value;
            if (v < 0 || v > 0xFFFF) {
                throw outOfRange(Integer.toString(v));
            }
            return v;
        }

        @Override
        public Integer maxValue()
        {
            return 0xFFFF;
        }
    };

    public static final UnsignedWidth<Long> U32 = new UnsignedWidth<>("u32", 4, Long.class)
    {
        @Override
        public Long fromBits(long bits)
        {
            return bits & 0xFFFF_FFFFL;
        }

        @Override
        long checkedBits(Long value)
        {
            final long v = value;
            if (v < 0 || v > 0xFFFF_FFFFL) {
                throw outOfRange(Long.toString(v));
            }
            return v;
        }

        @Override
        public Long maxValue()
        {
            return 0xFFFF_FFFFL;
        }
    };

    public static final UnsignedWidth<Long> U64 = new UnsignedWidth<>("u64", 8, Long.class)
    {
        @Override
        public Long fromBits(long bits)
        {
            return bits;
        }

        @Override
        long checkedBits(Long value)
        {
            // Every 64-bit pattern is a valid unsigned value.
            return value;
        }

        @Override
        public Long maxValue()
        {
            return -1L;
        }

        @Override
        public String format(Long value)
        {
            return Long.toUnsignedString(value);
        }
    };

    private final String name;
    private final int byteCount;
    private final Class<T> valueType;

    private UnsignedWidth(String name, int byteCount, Class<T> valueType)
    {
        this.name = name;
        this.byteCount = byteCount;
        this.valueType = valueType;
    }

    /**
     * Returns the number of bytes (W) in one encoded value.
     */
    public final int byteCount()
    {
        return byteCount;
    }

    /**
     * Returns the number of bits in one encoded value.
     */
    public final int bitCount()
    {
        return byteCount * 8;
    }

    /**
     * Returns the boxed Java type carrying values of this width.
     */
    public final Class<T> valueType()
    {
        return valueType;
    }

    /**
     * Interprets the low {@link #bitCount()} bits of {@code bits} as a value
     * of this width. Higher bits are ignored.
     */
    public abstract T fromBits(long bits);

    /**
     * Returns the raw bit pattern of {@code value}.
     *
     * @throws UnsignedRangeException if {@code value} is not representable at
     *         this width, or is not an instance of {@link #valueType()}
     */
    public final long toBits(T value)
    {
        Objects.requireNonNull(value, "value");
        if (!valueType.isInstance(value)) {
            throw new UnsignedRangeException(
                    name + " values must be " + valueType.getSimpleName()
                            + " (was " + value.getClass().getSimpleName() + ")");
        }
        return checkedBits(value);
    }

    /**
     * Returns the largest value representable at this width.
     */
    public abstract T maxValue();

    /**
     * Renders {@code value} as an unsigned decimal string.
     */
    public String format(T value)
    {
        return String.valueOf(value);
    }

    abstract long checkedBits(T value);

    final UnsignedRangeException outOfRange(String value)
    {
        return new UnsignedRangeException(
                name + " value out of range 0.." + format(maxValue()) + " (was " + value + ")");
    }

    @Override
    public String toString()
    {
        return name;
    }
}
