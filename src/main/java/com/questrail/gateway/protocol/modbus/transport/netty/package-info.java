/**
 * Modbus Netty Adapters
 * =============================================================================
 *
 * Pipeline handlers for embedders who already run Netty. Nothing here opens a
 * socket or a serial port; binding and connecting stay with the embedder.
 *
 * <h2>Why these adapters exist</h2>
 * A TCP stream does not preserve frame boundaries, so a Modbus server needs
 * the same framing the bridge core uses, expressed as a Netty decoder. These
 * classes provide that <strong>without</strong> letting Netty types leak into
 * the codec or transaction layers.
 *
 * <h2>Containment (binding)</h2>
 * <ul>
 *   <li>Frames leave the decoder as {@code byte[]}</li>
 *   <li>Reference-counted buffers are released inside this package</li>
 *   <li>No protocol interpretation beyond frame boundaries happens here</li>
 * </ul>
 */
package com.questrail.gateway.protocol.modbus.transport.netty;
