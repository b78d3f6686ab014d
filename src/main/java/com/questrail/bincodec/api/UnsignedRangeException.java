package com.questrail.bincodec.api;

/**
 * Indicates that a value cannot be represented as an unsigned integer of the
 * requested width.
 *
 * This typically reflects:
 * <ul>
 *   <li>A negative {@code Integer} or {@code Long} passed to a 16 or 32-bit codec</li>
 *   <li>A value above the width's maximum (e.g. {@code 0x1_0000} for 16 bits)</li>
 *   <li>A value of the wrong boxed type reaching a codec through raw collections</li>
 * </ul>
 *
 * It is a programming error, not an expected decode outcome.
 */
public final class UnsignedRangeException extends RuntimeException
{
    public UnsignedRangeException(String message) {
        super(message);
    }

    public UnsignedRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
