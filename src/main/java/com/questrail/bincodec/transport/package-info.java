/**
 * Transport Adapters
 * =============================================================================
 *
 * <p>Adapters that apply the fixed-width codec to buffers moving through an
 * I/O stack. They are consumers of the codec layer, not part of it:</p>
 *
 * <pre>
 *   inbound buffer
 *        → UnsignedSequenceDecoder   (copy readable bytes, decode the batch)
 *            → BatchResult / ExactBatchResult
 *
 *   List of values
 *        → UnsignedSequenceEncoder   (W bytes per value, list order)
 *            → outbound buffer
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No framing is added or removed. Each inbound buffer is decoded as it
 *       arrives; a frame decoder placed earlier in the pipeline decides what a
 *       buffer holds.</li>
 *   <li>Netty types stay inside {@code transport.netty}. The codec, api and
 *       format packages never see them.</li>
 * </ul>
 */
package com.questrail.bincodec.transport;
