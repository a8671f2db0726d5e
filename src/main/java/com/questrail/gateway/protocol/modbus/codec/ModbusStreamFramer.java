package com.questrail.gateway.protocol.modbus.codec;

/**
 * ModbusStreamFramer
 * -----------------------------------------------------------------------------
 * Splits a growing receive buffer into complete wire frames.
 *
 * <p>Unlike the decoders, a framer never throws on bad input. Unusable bytes
 * are discarded and reported through {@link FramingResult#discarded()} so the
 * caller can keep reading.</p>
 *
 * <p>A framer does <strong>not</strong> validate checksums. Each returned frame
 * still has to go through the matching decoder.</p>
 */
@FunctionalInterface
public interface ModbusStreamFramer
{
    /**
     * Extract every complete frame currently present in {@code buffer}.
     *
     * @param buffer bytes received so far, oldest first
     * @return the complete frames plus any bytes that must wait for more input
     */
    FramingResult frame(byte[] buffer);
}
