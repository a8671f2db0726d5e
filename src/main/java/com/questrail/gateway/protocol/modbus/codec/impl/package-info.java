/**
 * Modbus Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>Concrete checksum, encode/decode and stream-framing rules for the three
 * Modbus wire forms.</p>
 *
 * <pre>
 *   byte[] receive buffer
 *        → ModbusFramers.forProtocol(...).frame   (boundaries only)
 *        → ModbusAsciiCodec / ModbusRtuCodec / ModbusTcpCodec .decode
 *        → unit id + ADU
 * </pre>
 *
 * <p>Decoders fail fast with {@code ModbusBadFormException} or
 * {@code ModbusBadChecksumException}. Framers never throw on bad bytes; they
 * discard what cannot be used and report how much.</p>
 *
 * <p>All classes here are stateless. The only shared state is the CRC-16
 * lookup table, built once on first use.</p>
 */
package com.questrail.gateway.protocol.modbus.codec.impl;
