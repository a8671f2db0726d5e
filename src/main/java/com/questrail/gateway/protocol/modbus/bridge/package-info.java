/**
 * Modbus Bridge Service
 * =============================================================================
 *
 * Composes framers, codecs and {@code ModbusTransaction} into the request /
 * response relay of a protocol gateway.
 *
 * <pre>
 *   upstream bytes → ModbusBridge → DownstreamLink → device
 *   requester      ← ModbusBridge ← reply bytes
 * </pre>
 *
 * <p>Physical I/O and the response timeout belong to the
 * {@link com.questrail.gateway.protocol.modbus.bridge.DownstreamLink}
 * implementation; nothing in this package blocks on its own.</p>
 */
package com.questrail.gateway.protocol.modbus.bridge;
