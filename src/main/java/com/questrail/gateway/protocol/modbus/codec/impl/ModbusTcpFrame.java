package com.questrail.gateway.protocol.modbus.codec.impl;

import java.util.Objects;

/**
 * Fields of a validated Modbus/TCP frame.
 *
 * <p>The ADU is copied on the way in and on the way out.</p>
 *
 * @param transactionId 16-bit correlation value from the MBAP header
 * @param unitId        addressed unit (0-255)
 * @param adu           function code + payload
 */
public record ModbusTcpFrame(int transactionId, int unitId, byte[] adu)
{
    public ModbusTcpFrame {
        Objects.requireNonNull(adu, "adu");
        adu = adu.clone();
    }

    @Override
    public byte[] adu() {
        return adu.clone();
    }

    @Override
    public String toString() {
        return "ModbusTcpFrame[" +
                "transactionId=0x" + String.format("%04X", transactionId) +
                ", unitId=" + unitId +
                ", aduLength=" + adu.length +
                ']';
    }
}
