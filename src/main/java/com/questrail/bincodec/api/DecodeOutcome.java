package com.questrail.bincodec.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * DecodeOutcome
 * -----------------------------------------------------------------------------
 * Result of decoding one chunk of a byte sequence.
 *
 * <p>A chunk either held a full value ({@link Decoded}) or was shorter than
 * the width and is handed back untouched ({@link Undecoded}). A short chunk is
 * never padded or decoded with garbage, and its bytes are never dropped: the
 * caller can always recover them losslessly.</p>
 *
 * @param <T> the boxed Java type of decoded values
 */
public sealed interface DecodeOutcome<T>
        permits DecodeOutcome.Decoded, DecodeOutcome.Undecoded
{
    /**
     * Returns true for {@link Decoded}.
     */
    boolean isDecoded();

    /**
     * Number of input bytes this outcome accounts for.
     */
    int byteCount();

    static <T> DecodeOutcome<T> decoded(T value, int byteCount)
    {
        return new Decoded<>(value, byteCount);
    }

    static <T> DecodeOutcome<T> undecoded(byte[] bytes)
    {
        return new Undecoded<>(bytes);
    }

    /**
     * A chunk that contained a full value.
     */
    record Decoded<T>(T value, int byteCount) implements DecodeOutcome<T>
    {
        public Decoded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isDecoded()
        {
            return true;
        }
    }

    /**
     * A chunk too short to decode. Holds a private copy of its bytes.
     */
    final class Undecoded<T> implements DecodeOutcome<T>
    {
        private final byte[] bytes;

        private Undecoded(byte[] bytes)
        {
            this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        /**
         * Returns a copy of the leftover bytes.
         */
        public byte[] bytes()
        {
            return bytes.clone();
        }

        @Override
        public boolean isDecoded()
        {
            return false;
        }

        @Override
        public int byteCount()
        {
            return bytes.length;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Undecoded<?> that)) return false;
            return Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode()
        {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString()
        {
            return "Undecoded[length=" + bytes.length + "]";
        }
    }
}
