package com.questrail.bincodec.transport.netty;

import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.codec.UnsignedCodec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.util.List;
import java.util.Objects;

/**
 * UnsignedSequenceEncoder
 * =============================================================================
 * Netty outbound handler that writes a {@link List} of unsigned values as
 * consecutive W-byte encodings, in list order.
 *
 * <p>Values outside the codec's range fail the write: the
 * {@link com.questrail.bincodec.api.UnsignedRangeException} reaches the
 * write promise wrapped in an {@link io.netty.handler.codec.EncoderException}.</p>
 */
@ChannelHandler.Sharable
public final class UnsignedSequenceEncoder<T> extends MessageToByteEncoder<List<T>>
{
    private final UnsignedCodec<T> codec;
    private final ByteOrder order;

    public UnsignedSequenceEncoder(UnsignedCodec<T> codec, ByteOrder order)
    {
        super(listType());
        this.codec = Objects.requireNonNull(codec, "codec");
        this.order = Objects.requireNonNull(order, "order");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, List<T> msg, ByteBuf out)
    {
        out.writeBytes(codec.encodeAllFlat(msg, order));
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<List<T>> listType()
    {
        return (Class<List<T>>) (Class<?>) List.class;
    }
}
