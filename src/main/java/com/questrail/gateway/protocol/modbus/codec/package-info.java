/**
 * Modbus Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the bridge:
 * the failure types and the stream-framing contract shared by the ASCII, RTU
 * and TCP implementations in {@code codec.impl}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> the transaction layer and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte[] from the link
 *        → ModbusStreamFramer      (frame boundaries)
 *            → wire decoder        (delimiters, checksum, header rules)
 *                → ModbusTransaction (unit id + protocol-neutral ADU)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Nothing here interprets register contents.</li>
 *   <li>No component here performs I/O or keeps per-link state.</li>
 *   <li>Every {@link com.questrail.gateway.protocol.modbus.codec.ModbusFrameException}
 *       means "drop this frame", never "stop the bridge".</li>
 * </ul>
 */
package com.questrail.gateway.protocol.modbus.codec;
