package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.ModbusStreamFramer;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.util.Objects;

/**
 * Selects the stream framer for a wire protocol and exchange direction.
 */
public final class ModbusFramers
{
    private ModbusFramers() {}

    public static ModbusStreamFramer forProtocol(WireProtocol protocol, FramingDirection direction)
    {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(direction, "direction");

        return switch (protocol) {
            case ASCII -> ModbusAsciiCodec::frame;
            case RTU -> buffer -> ModbusRtuCodec.frame(buffer, direction);
            case TCP -> ModbusTcpCodec::frame;
        };
    }
}
