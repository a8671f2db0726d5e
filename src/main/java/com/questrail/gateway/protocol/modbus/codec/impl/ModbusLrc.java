package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;

import java.util.Objects;

/**
 * ModbusLrc
 * -----------------------------------------------------------------------------
 * Longitudinal Redundancy Check used by Modbus/ASCII.
 *
 * <p>The LRC is the two's complement of the 8-bit sum of the <em>binary</em>
 * message bytes (unit id + ADU), never of their hex-ASCII rendering.</p>
 */
public final class ModbusLrc
{
    /** Smallest valid message: unit id + function code. */
    static final int MINIMUM_LENGTH = 2;

    private ModbusLrc() {}

    /**
     * Computes the LRC over the whole array.
     *
     * @throws ModbusBadFormException if fewer than two bytes are supplied
     */
    public static int compute(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        return compute(data, 0, data.length);
    }

    /**
     * Computes the LRC over {@code data[off, off + len)}.
     *
     * @throws ModbusBadFormException if {@code len} is less than two
     */
    public static int compute(byte[] data, int off, int len)
    {
        Objects.requireNonNull(data, "data");
        if (len < MINIMUM_LENGTH) {
            throw new ModbusBadFormException("LRC input too short: " + len + " byte(s)");
        }

        int sum = 0;
        for (int i = off; i < off + len; i++) {
            sum += data[i] & 0xFF;
        }
        return (((sum & 0xFF) ^ 0xFF) + 1) & 0xFF;
    }
}
