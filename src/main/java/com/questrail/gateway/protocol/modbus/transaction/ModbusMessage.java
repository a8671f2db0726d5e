package com.questrail.gateway.protocol.modbus.transaction;

import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.util.Objects;

/**
 * One half of a transaction as it was received.
 *
 * <p>Arrays are copied on the way in and on the way out.</p>
 *
 * @param protocol wire form the bytes arrived in
 * @param raw      the complete frame as received
 * @param adu      function code + payload, protocol-neutral
 */
public record ModbusMessage(WireProtocol protocol, byte[] raw, byte[] adu)
{
    public ModbusMessage {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(adu, "adu");
        raw = raw.clone();
        adu = adu.clone();
    }

    @Override
    public byte[] raw() {
        return raw.clone();
    }

    @Override
    public byte[] adu() {
        return adu.clone();
    }

    /**
     * Function code (first ADU byte), unsigned.
     */
    public int functionCode() {
        return adu[0] & 0xFF;
    }

    /**
     * True if the function code carries the exception flag.
     */
    public boolean isException() {
        return (functionCode() & 0x80) != 0;
    }

    @Override
    public String toString() {
        return "ModbusMessage[" +
                "protocol=" + protocol +
                ", function=0x" + String.format("%02X", functionCode()) +
                ", rawLength=" + raw.length +
                ", aduLength=" + adu.length +
                ']';
    }
}
