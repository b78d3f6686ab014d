/**
 * Fixed-Width Unsigned Codec: Implementation
 * =============================================================================
 *
 * <p>Concrete codec built once against {@link com.questrail.bincodec.api.UnsignedWidth}
 * and instantiated for 16, 32 and 64 bits.</p>
 *
 * <pre>
 *   byte[]
 *        → ByteChunker.chunk
 *        → UncheckedScalarDecoder.decodeExact   (full chunks)
 *        → DecodeOutcome.Undecoded              (short final chunk)
 *        → BatchResult / ExactBatchResult
 * </pre>
 *
 * <p>The bounded scalar decode is the public entry for arbitrary input. The
 * unchecked decoder skips bounds checks and is reachable only from this
 * package, after chunking has fixed the length.</p>
 */
package com.questrail.bincodec.codec.impl;
