package com.questrail.gateway.protocol.modbus.codec;

/**
 * Indicates a structurally malformed frame.
 *
 * This typically reflects:
 * <ul>
 *   <li>Wrong start delimiter or odd / invalid hex digits (ASCII)</li>
 *   <li>Nonzero protocol id or inconsistent length field (TCP)</li>
 *   <li>An ADU longer than the protocol allows</li>
 *   <li>Input too short for a checksum</li>
 *   <li>A response addressed to the wrong unit or transaction</li>
 * </ul>
 */
public final class ModbusBadFormException extends ModbusFrameException
{
    public ModbusBadFormException(String message) {
        super(message);
    }

    public ModbusBadFormException(String message, Throwable cause) {
        super(message, cause);
    }
}
