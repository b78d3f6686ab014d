package com.questrail.bincodec.platform;

import com.questrail.bincodec.api.ByteOrder;

/**
 * HostByteOrder
 * -----------------------------------------------------------------------------
 * Reports the native byte order of the executing machine.
 *
 * <p>The answer is taken once from the JDK's platform primitive
 * ({@link java.nio.ByteOrder#nativeOrder()}) and cached. The codec treats it
 * as an external fact and never re-derives it.</p>
 */
public final class HostByteOrder
{
    private static final ByteOrder NATIVE = ByteOrder.fromNio(java.nio.ByteOrder.nativeOrder());

    private HostByteOrder() {}

    public static ByteOrder get()
    {
        return NATIVE;
    }

    public static boolean isLittleEndian()
    {
        return NATIVE == ByteOrder.LITTLE_ENDIAN;
    }
}
