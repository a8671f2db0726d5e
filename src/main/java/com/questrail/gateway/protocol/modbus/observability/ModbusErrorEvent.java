package com.questrail.gateway.protocol.modbus.observability;

import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.time.Instant;

/**
 * Record representing a dropped frame or discarded input.
 *
 * @param protocol wire form involved
 * @param message  human-readable description
 * @param cause    underlying failure; may be {@code null}
 */
public record ModbusErrorEvent(
    Instant timestamp,
    WireProtocol protocol,
    String message,
    Throwable cause
) {
}
