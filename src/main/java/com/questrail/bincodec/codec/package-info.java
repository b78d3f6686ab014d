/**
 * Fixed-Width Unsigned Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: conversion between
 * unsigned integers of 16, 32 and 64 bits and raw byte sequences, for single
 * values and for whole sequences.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[]
 *      → ByteChunker              (W-byte chunks, last one possibly short)
 *          → scalar decode        (full chunks only)
 *              → DecodeOutcome    (Decoded | Undecoded)
 *                  → BatchResult  (values, remaining byte count)
 *                      → ExactBatchResult (AllDecoded | Incomplete)
 * </pre>
 *
 * <p>Encoding runs the other way: each value becomes a fresh W-byte array,
 * and a batch encode is one such array per value.</p>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No framing, length prefixes, checksums or varints. Those belong to
 *       the caller.</li>
 *   <li>Short input and ragged tails are values, not exceptions.</li>
 *   <li>Inputs are borrowed read-only; outputs are freshly allocated.</li>
 * </ul>
 */
package com.questrail.bincodec.codec;
