package com.questrail.gateway.protocol.modbus.codec;

/**
 * Indicates an LRC or CRC-16 mismatch between the received and computed values.
 */
public final class ModbusBadChecksumException extends ModbusFrameException
{
    private final int received;
    private final int computed;

    public ModbusBadChecksumException(String kind, int received, int computed) {
        super(String.format("%s mismatch: received=0x%X computed=0x%X", kind, received, computed));
        this.received = received;
        this.computed = computed;
    }

    public int received() {
        return received;
    }

    public int computed() {
        return computed;
    }
}
