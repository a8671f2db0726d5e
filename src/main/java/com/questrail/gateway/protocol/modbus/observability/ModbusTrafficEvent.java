package com.questrail.gateway.protocol.modbus.observability;

import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing one frame crossing the bridge.
 *
 * @param label    where the bytes travelled, e.g. {@code "UP-REQ"} or {@code "DOWN-RSP"}
 * @param protocol wire form of the bytes
 * @param bytes    the frame; copied on the way in and out
 */
public record ModbusTrafficEvent(
    Instant timestamp,
    String label,
    WireProtocol protocol,
    byte[] bytes
) {
    public ModbusTrafficEvent {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(protocol, "protocol");
        bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }
}
