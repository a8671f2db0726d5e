package com.questrail.gateway.protocol.modbus.model;

/**
 * Indicates that a protocol name could not be mapped to a {@link WireProtocol}.
 *
 * <p>This is a configuration error. Once a value is a {@link WireProtocol}
 * there is no runtime path that can produce it.</p>
 */
public final class ModbusBadProtocolException extends IllegalArgumentException
{
    public ModbusBadProtocolException(String message) {
        super(message);
    }
}
