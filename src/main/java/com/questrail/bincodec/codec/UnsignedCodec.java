package com.questrail.bincodec.codec;

import com.questrail.bincodec.api.BatchResult;
import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.api.DecodeOutcome;
import com.questrail.bincodec.api.ExactBatchResult;
import com.questrail.bincodec.api.UnsignedWidth;

import java.util.List;
import java.util.Optional;

/**
 * UnsignedCodec
 * -----------------------------------------------------------------------------
 * Endianness-aware codec for unsigned integers of one fixed width.
 *
 * <p>Implementations are stateless and immutable; every method is a pure
 * function of its arguments and may be called concurrently, provided the
 * caller does not mutate an input array during the call.</p>
 *
 * <p>The methods that take no {@link ByteOrder} use the codec's configured
 * default order.</p>
 *
 * @param <T> the boxed Java type carrying values of this width
 */
public interface UnsignedCodec<T>
{
    /**
     * Returns the width this codec is specialised for.
     */
    UnsignedWidth<T> width();

    /**
     * Returns the order used by the overloads without an explicit order.
     */
    ByteOrder defaultOrder();

    /**
     * Decode one value from the front of {@code bytes}.
     *
     * <p>Bytes beyond the first W are ignored. The input is not modified.</p>
     *
     * @param bytes source bytes
     * @param order byte order of the encoded value
     * @return the decoded value; {@link Optional#empty()} if fewer than W bytes
     *         are available
     */
    Optional<T> decode(byte[] bytes, ByteOrder order);

    /**
     * Decode one value starting at {@code offset}.
     *
     * @return the decoded value; {@link Optional#empty()} if the offset lies
     *         outside {@code bytes} or fewer than W bytes remain after it
     */
    Optional<T> decode(byte[] bytes, int offset, ByteOrder order);

    /**
     * Encode one value into a fresh array of exactly W bytes.
     *
     * @throws com.questrail.bincodec.api.UnsignedRangeException if the value
     *         is not representable at this width
     */
    byte[] encode(T value, ByteOrder order);

    /**
     * Chunk {@code bytes} at width W and classify each chunk.
     *
     * <p>Full chunks are {@link DecodeOutcome.Decoded}; a short final chunk is
     * {@link DecodeOutcome.Undecoded} and carries a copy of its bytes.</p>
     */
    List<DecodeOutcome<T>> decodeChunks(byte[] bytes, ByteOrder order);

    /**
     * Decode every whole value in {@code bytes}, reporting how many trailing
     * bytes did not form a value.
     */
    BatchResult<T> decodeAll(byte[] bytes, ByteOrder order);

    /**
     * Decode {@code bytes} as a clean array of W-byte values.
     *
     * @return {@link ExactBatchResult.AllDecoded} when the length is a multiple
     *         of W; otherwise {@link ExactBatchResult.Incomplete} with the
     *         ragged tail length and no values
     */
    ExactBatchResult<T> decodeExact(byte[] bytes, ByteOrder order);

    /**
     * Encode each value into its own fresh W-byte array, in input order.
     */
    List<byte[]> encodeAll(List<T> values, ByteOrder order);

    /**
     * Encode each value and concatenate the results into one buffer of
     * {@code values.size() * W} bytes.
     */
    byte[] encodeAllFlat(List<T> values, ByteOrder order);

    default Optional<T> decode(byte[] bytes)
    {
        return decode(bytes, defaultOrder());
    }

    default byte[] encode(T value)
    {
        return encode(value, defaultOrder());
    }

    default BatchResult<T> decodeAll(byte[] bytes)
    {
        return decodeAll(bytes, defaultOrder());
    }

    default ExactBatchResult<T> decodeExact(byte[] bytes)
    {
        return decodeExact(bytes, defaultOrder());
    }

    default List<byte[]> encodeAll(List<T> values)
    {
        return encodeAll(values, defaultOrder());
    }
}
