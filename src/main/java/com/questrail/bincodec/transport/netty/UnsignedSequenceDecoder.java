package com.questrail.bincodec.transport.netty;

import com.questrail.bincodec.api.BatchResult;
import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.api.ExactBatchResult;
import com.questrail.bincodec.codec.UnsignedCodec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.util.List;
import java.util.Objects;

/**
 * UnsignedSequenceDecoder
 * =============================================================================
 * Netty inbound handler that decodes each received {@link ByteBuf} as a
 * sequence of fixed-width unsigned integers.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure adapter</strong>. It copies the readable bytes
 * of each buffer into a {@code byte[]}, hands them to the codec and emits the
 * codec's result downstream:
 * <ul>
 *   <li>{@link BatchResult} in lenient mode (ragged tails reported as a count)</li>
 *   <li>{@link ExactBatchResult} in exact mode</li>
 * </ul>
 *
 * <p>It MUST NOT accumulate bytes across reads or split buffers into frames.
 * The inbound buffer is released by {@link MessageToMessageDecoder}.</p>
 */
@ChannelHandler.Sharable
public final class UnsignedSequenceDecoder<T> extends MessageToMessageDecoder<ByteBuf>
{
    private final UnsignedCodec<T> codec;
    private final ByteOrder order;
    private final boolean exact;

    private UnsignedSequenceDecoder(UnsignedCodec<T> codec, ByteOrder order, boolean exact)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.order = Objects.requireNonNull(order, "order");
        this.exact = exact;
    }

    /**
     * Emits a {@link BatchResult} per inbound buffer.
     */
    public static <T> UnsignedSequenceDecoder<T> lenient(UnsignedCodec<T> codec, ByteOrder order)
    {
        return new UnsignedSequenceDecoder<>(codec, order, false);
    }

    /**
     * Emits an {@link ExactBatchResult} per inbound buffer.
     */
    public static <T> UnsignedSequenceDecoder<T> exact(UnsignedCodec<T> codec, ByteOrder order)
    {
        return new UnsignedSequenceDecoder<>(codec, order, true);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out)
    {
        // Copy the payload into a plain byte[] so Netty types stop here.
        final byte[] bytes = ByteBufUtil.getBytes(msg);

        if (exact) {
            out.add(codec.decodeExact(bytes, order));
        }
        else {
            out.add(codec.decodeAll(bytes, order));
        }
    }
}
