package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;

import java.util.Objects;

/**
 * ModbusCrc16
 * -----------------------------------------------------------------------------
 * Table-driven CRC-16/Modbus used by Modbus/RTU.
 *
 * <p>Parameters:</p>
 * <ul>
 *   <li>Width: 16</li>
 *   <li>Reflected polynomial: 0xA001</li>
 *   <li>Initial value: 0xFFFF</li>
 *   <li>No final XOR</li>
 * </ul>
 *
 * <p>On the wire the CRC follows the message low byte first, so the well
 * known request {@code 01 03 00 00 00 0A} is sent as
 * {@code 01 03 00 00 00 0A C5 CD} (CRC value 0xCDC5).</p>
 */
public final class ModbusCrc16
{
    /** Reflected polynomial used for table generation. */
    private static final int REFLECTED_POLY = 0xA001;

    /** Seed for every Modbus/RTU frame. */
    public static final int MODBUS_SEED = 0xFFFF;

    /** Smallest valid message: unit id + function code. */
    static final int MINIMUM_LENGTH = 2;

    private ModbusCrc16() {}

    /**
     * Computes the CRC over the whole array with the Modbus seed.
     *
     * @throws ModbusBadFormException if fewer than two bytes are supplied
     */
    public static int compute(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        return compute(data, 0, data.length, MODBUS_SEED);
    }

    /**
     * Computes the CRC over {@code data[off, off + len)} starting from {@code seed}.
     *
     * @throws ModbusBadFormException if {@code len} is less than two
     */
    public static int compute(byte[] data, int off, int len, int seed)
    {
        Objects.requireNonNull(data, "data");
        if (len < MINIMUM_LENGTH) {
            throw new ModbusBadFormException("CRC-16 input too short: " + len + " byte(s)");
        }

        final int[] table = TableHolder.TABLE;
        int crc = seed & 0xFFFF;
        for (int i = off; i < off + len; i++) {
            crc = (crc >>> 8) ^ table[(crc ^ data[i]) & 0xFF];
        }
        return crc & 0xFFFF;
    }

    /**
     * Returns entry {@code index} of the lookup table.
     */
    static int tableEntry(int index)
    {
        return TableHolder.TABLE[index];
    }

    /*
     * Initialization-on-demand holder. The JVM runs the static initializer
     * exactly once, on first access, and publishes the finished array to
     * every thread; no reader can observe a partially built table.
     */
    private static final class TableHolder
    {
        static final int[] TABLE = buildTable();

        private static int[] buildTable()
        {
            final int[] table = new int[256];
            for (int i = 0; i < 256; i++) {
                int data = i;
                int crc = 0;
                for (int bit = 0; bit < 8; bit++) {
                    if (((data ^ crc) & 0x0001) != 0) {
                        crc = (crc >>> 1) ^ REFLECTED_POLY;
                    } else {
                        crc >>>= 1;
                    }
                    data >>>= 1;
                }
                table[i] = crc;
            }
            return table;
        }
    }
}
