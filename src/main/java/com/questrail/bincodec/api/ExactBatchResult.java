package com.questrail.bincodec.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a decode that only accepts a clean array of W-byte values.
 *
 * <p>{@link AllDecoded} when the input length is a multiple of the width;
 * otherwise {@link Incomplete}, carrying the number of ragged tail bytes and
 * none of the partially decoded values.</p>
 */
public sealed interface ExactBatchResult<T>
        permits ExactBatchResult.AllDecoded, ExactBatchResult.Incomplete
{
    /**
     * Returns the decoded values, or empty for {@link Incomplete}.
     */
    Optional<List<T>> values();

    default boolean isAllDecoded()
    {
        return values().isPresent();
    }

    /**
     * Maps a batch aggregate onto the exact form.
     */
    static <T> ExactBatchResult<T> of(BatchResult<T> batch)
    {
        Objects.requireNonNull(batch, "batch");
        if (batch.isComplete()) {
            return new AllDecoded<>(batch.decoded());
        }
        return new Incomplete<>(batch.remainingByteCount());
    }

    record AllDecoded<T>(List<T> decoded) implements ExactBatchResult<T>
    {
        public AllDecoded {
            decoded = List.copyOf(Objects.requireNonNull(decoded, "decoded"));
        }

        @Override
        public Optional<List<T>> values()
        {
            return Optional.of(decoded);
        }
    }

    record Incomplete<T>(int remainingByteCount) implements ExactBatchResult<T>
    {
        public Incomplete {
            if (remainingByteCount <= 0) {
                throw new IllegalArgumentException(
                        "Incomplete requires a positive remainingByteCount (was " + remainingByteCount + ")");
            }
        }

        @Override
        public Optional<List<T>> values()
        {
            return Optional.empty();
        }
    }
}
