package com.questrail.bincodec.codec.impl;

import com.questrail.bincodec.api.BatchResult;
import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.api.DecodeOutcome;
import com.questrail.bincodec.api.ExactBatchResult;
import com.questrail.bincodec.api.UnsignedWidth;
import com.questrail.bincodec.codec.UnsignedCodec;
import com.questrail.bincodec.config.CodecConfig;
import com.questrail.bincodec.observability.CodecObservabilitySink;
import com.questrail.bincodec.observability.RaggedTailEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultUnsignedCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link UnsignedCodec}, written once and
 * parameterised by {@link UnsignedWidth}.
 *
 * <p>Batch decoding performs the following steps, in order:</p>
 * <ol>
 *   <li>Chunk the input at width W ({@link ByteChunker})</li>
 *   <li>Classify each chunk: full chunks are decoded through
 *       {@link UncheckedScalarDecoder}, a short final chunk becomes
 *       {@link DecodeOutcome.Undecoded}</li>
 *   <li>Partition the outcomes into the decoded values (original order) and
 *       the sum of the undecoded chunk lengths</li>
 * </ol>
 *
 * <p>A ragged tail is reported to the configured
 * {@link CodecObservabilitySink}; it is never an error.</p>
 */
public final class DefaultUnsignedCodec<T> implements UnsignedCodec<T>
{
    private final UnsignedWidth<T> width;
    private final ByteOrder defaultOrder;
    private final CodecObservabilitySink sink;

    public DefaultUnsignedCodec(UnsignedWidth<T> width, CodecConfig config)
    {
        this.width = Objects.requireNonNull(width, "width");
        Objects.requireNonNull(config, "config");
        this.defaultOrder = config.defaultOrder();
        this.sink = config.observabilitySink();
    }

    @Override
    public UnsignedWidth<T> width()
    {
        return width;
    }

    @Override
    public ByteOrder defaultOrder()
    {
        return defaultOrder;
    }

    @Override
    public Optional<T> decode(byte[] bytes, ByteOrder order)
    {
        return decode(bytes, 0, order);
    }

    @Override
    public Optional<T> decode(byte[] bytes, int offset, ByteOrder order)
    {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(order, "order");

        // Fewer than W bytes available: absent, not an error.
        if (offset < 0 || bytes.length - offset < width.byteCount()) {
            return Optional.empty();
        }
        return Optional.of(UncheckedScalarDecoder.decodeAt(width, bytes, offset, order));
    }

    @Override
    public byte[] encode(T value, ByteOrder order)
    {
        Objects.requireNonNull(order, "order");

        final long bits = width.toBits(value);
        final byte[] out = new byte[width.byteCount()];
        order.scatter(bits, out, 0, out.length);
        return out;
    }

    @Override
    public List<DecodeOutcome<T>> decodeChunks(byte[] bytes, ByteOrder order)
    {
        Objects.requireNonNull(order, "order");

        final List<byte[]> chunks = ByteChunker.chunk(bytes, width.byteCount());
        final List<DecodeOutcome<T>> outcomes = new ArrayList<>(chunks.size());

        for (byte[] chunk : chunks) {
            if (chunk.length == width.byteCount()) {
                T value = UncheckedScalarDecoder.decodeExact(width, chunk, order);
                outcomes.add(DecodeOutcome.decoded(value, chunk.length));
            }
            else {
                outcomes.add(DecodeOutcome.undecoded(chunk));
            }
        }
        return Collections.unmodifiableList(outcomes);
    }

    @Override
    public BatchResult<T> decodeAll(byte[] bytes, ByteOrder order)
    {
        final BatchResult<T> batch = partition(decodeChunks(bytes, order));
        if (!batch.isComplete()) {
            sink.onRaggedTail(raggedTail(bytes, order, batch));
        }
        return batch;
    }

    @Override
    public ExactBatchResult<T> decodeExact(byte[] bytes, ByteOrder order)
    {
        final BatchResult<T> batch = partition(decodeChunks(bytes, order));
        if (!batch.isComplete()) {
            sink.onIncompleteBatch(raggedTail(bytes, order, batch));
        }
        return ExactBatchResult.of(batch);
    }

    @Override
    public List<byte[]> encodeAll(List<T> values, ByteOrder order)
    {
        Objects.requireNonNull(values, "values");

        final List<byte[]> out = new ArrayList<>(values.size());
        for (T value : values) {
            out.add(encode(value, order));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public byte[] encodeAllFlat(List<T> values, ByteOrder order)
    {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(order, "order");

        final int w = width.byteCount();
        final byte[] out = new byte[Math.multiplyExact(values.size(), w)];
        int offset = 0;
        for (T value : values) {
            order.scatter(width.toBits(value), out, offset, w);
            offset += w;
        }
        return out;
    }

    // Remaining = sum of all undecoded lengths, not just the last chunk's.
    private BatchResult<T> partition(List<DecodeOutcome<T>> outcomes)
    {
        final List<T> decoded = new ArrayList<>(outcomes.size());
        int remaining = 0;

        for (DecodeOutcome<T> outcome : outcomes) {
            if (outcome instanceof DecodeOutcome.Decoded<T> d) {
                decoded.add(d.value());
            }
            else {
                remaining += outcome.byteCount();
            }
        }
        return new BatchResult<>(decoded, remaining);
    }

    private RaggedTailEvent raggedTail(byte[] bytes, ByteOrder order, BatchResult<T> batch)
    {
        return new RaggedTailEvent(
                Instant.now(),
                width.toString(),
                order,
                bytes.length,
                batch.decodedCount(),
                batch.remainingByteCount());
    }

    @Override
    public String toString()
    {
        return "DefaultUnsignedCodec[" + width + ", defaultOrder=" + defaultOrder + ']';
    }
}
