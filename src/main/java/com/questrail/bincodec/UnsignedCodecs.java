package com.questrail.bincodec;

import com.questrail.bincodec.api.UnsignedWidth;
import com.questrail.bincodec.codec.UnsignedCodec;
import com.questrail.bincodec.codec.impl.DefaultUnsignedCodec;
import com.questrail.bincodec.config.CodecConfig;

/**
 * Composition root for the fixed-width codecs.
 *
 * <p>The shared instances use {@link CodecConfig#defaults()}. Codecs are
 * immutable and thread-safe, so the shared instances may be used anywhere.</p>
 */
public final class UnsignedCodecs
{
    private static final UnsignedCodec<Integer> UINT16 = create(UnsignedWidth.U16, CodecConfig.defaults());
    private static final UnsignedCodec<Long> UINT32 = create(UnsignedWidth.U32, CodecConfig.defaults());
    private static final UnsignedCodec<Long> UINT64 = create(UnsignedWidth.U64, CodecConfig.defaults());

    private UnsignedCodecs() {}

    public static UnsignedCodec<Integer> uint16()
    {
        return UINT16;
    }

    public static UnsignedCodec<Long> uint32()
    {
        return UINT32;
    }

    public static UnsignedCodec<Long> uint64()
    {
        return UINT64;
    }

    public static <T> UnsignedCodec<T> create(UnsignedWidth<T> width, CodecConfig config)
    {
        return new DefaultUnsignedCodec<>(width, config);
    }
}
