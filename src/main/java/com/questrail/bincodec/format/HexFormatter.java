package com.questrail.bincodec.format;

import java.util.List;
import java.util.Objects;

/**
 * HexFormatter
 * -----------------------------------------------------------------------------
 * Renders bytes as upper-case hexadecimal text.
 *
 * <p>A byte becomes two characters, high nibble first, with no separator
 * inside the byte. A sequence becomes the per-byte forms joined by single
 * spaces, in original order: {@code [0x00, 0xFF]} renders as {@code "00 FF"}.</p>
 */
public final class HexFormatter
{
    private static final char[] HEX_TABLE = "0123456789ABCDEF".toCharArray();

    private HexFormatter() {}

    public static String hex(byte b)
    {
        return new String(new char[] { HEX_TABLE[(b >>> 4) & 0x0F], HEX_TABLE[b & 0x0F] });
    }

    public static String hex(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            return "";
        }

        // 2 chars per byte plus one separator between each pair.
        final char[] out = new char[bytes.length * 3 - 1];
        int p = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                out[p++] = ' ';
            }
            final int v = bytes[i] & 0xFF;
            out[p++] = HEX_TABLE[v >>> 4];
            out[p++] = HEX_TABLE[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Renders a list of chunks (e.g. batch encoder output) as one sequence.
     */
    public static String hex(List<byte[]> chunks)
    {
        Objects.requireNonNull(chunks, "chunks");

        final StringBuilder sb = new StringBuilder();
        for (byte[] chunk : chunks) {
            if (chunk.length == 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(hex(chunk));
        }
        return sb.toString();
    }

    /**
     * Parses text produced by {@link #hex(byte[])}.
     *
     * <p>Pairs are separated by whitespace; either case is accepted.</p>
     *
     * @throws IllegalArgumentException if a token is not exactly two hex digits
     */
    public static byte[] parse(String text)
    {
        Objects.requireNonNull(text, "text");

        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new byte[0];
        }

        final String[] tokens = trimmed.split("\\s+");
        final byte[] out = new byte[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            final String token = tokens[i];
            if (token.length() != 2) {
                throw new IllegalArgumentException(
                        "Hex byte must be two digits (was \"" + token + "\" at position " + i + ")");
            }
            final int hi = Character.digit(token.charAt(0), 16);
            final int lo = Character.digit(token.charAt(1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException(
                        "Invalid hex byte \"" + token + "\" at position " + i);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
