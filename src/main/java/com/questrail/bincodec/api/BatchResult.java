package com.questrail.bincodec.api;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch decode: the values decoded in original order, and the
 * number of trailing bytes that did not form a whole value.
 *
 * <p>{@code remainingByteCount} is the sum of the lengths of all undecoded
 * chunks. Because only the final chunk of a partition can be short, it is
 * always in {@code [0, W-1]}.</p>
 */
public record BatchResult<T>(List<T> decoded, int remainingByteCount)
{
    public BatchResult {
        Objects.requireNonNull(decoded, "decoded");
        if (remainingByteCount < 0) {
            throw new IllegalArgumentException(
                    "remainingByteCount must be >= 0 (was " + remainingByteCount + ")");
        }
        decoded = List.copyOf(decoded);
    }

    /**
     * Returns true if every input byte was consumed by a decoded value.
     */
    public boolean isComplete()
    {
        return remainingByteCount == 0;
    }

    public int decodedCount()
    {
        return decoded.size();
    }
}
