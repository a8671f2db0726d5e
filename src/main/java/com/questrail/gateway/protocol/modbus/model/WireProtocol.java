package com.questrail.gateway.protocol.modbus.model;

import java.util.Locale;
import java.util.Objects;

/**
 * WireProtocol
 * -----------------------------------------------------------------------------
 * The closed set of Modbus wire representations handled by the bridge.
 *
 * <p>Every operation that depends on the wire form dispatches over this enum
 * with an exhaustive {@code switch}. Adding a constant therefore breaks the
 * build at every dispatch site instead of failing at runtime.</p>
 */
public enum WireProtocol
{
    /** Modbus/ASCII: {@code ':'} + hex + LRC + CRLF. */
    ASCII(252, true),

    /** Modbus/RTU: binary + CRC-16 (little-endian). */
    RTU(252, true),

    /** Modbus/TCP: MBAP header + unit id + ADU. */
    TCP(255, false);

    private final int maxAduLength;
    private final boolean serial;

    WireProtocol(int maxAduLength, boolean serial)
    {
        this.maxAduLength = maxAduLength;
        this.serial = serial;
    }

    /**
     * Largest ADU (function code + payload) a frame of this protocol may carry.
     */
    public int maxAduLength()
    {
        return maxAduLength;
    }

    /**
     * True for the serial-line forms (ASCII and RTU).
     */
    public boolean isSerial()
    {
        return serial;
    }

    /**
     * Parses a protocol name as it appears in configuration.
     *
     * <p>Accepted (case-insensitive): {@code ascii}, {@code mbasc},
     * {@code modbus/ascii}, {@code modbus/asc}, {@code rtu}, {@code mbrtu},
     * {@code modbus/rtu}, {@code mbus/rtu}, {@code tcp}, {@code mbtcp},
     * {@code modbus/tcp}, {@code mbus/tcp}.</p>
     *
     * @throws ModbusBadProtocolException if the name is not recognized
     */
    public static WireProtocol parse(String name)
    {
        Objects.requireNonNull(name, "name");

        final String value = name.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "ascii":
            case "mbasc":
            case "modbus/ascii":
            case "modbus/asc":
                return ASCII;
            case "rtu":
            case "mbrtu":
            case "modbus/rtu":
            case "mbus/rtu":
                return RTU;
            case "tcp":
            case "mbtcp":
            case "modbus/tcp":
            case "mbus/tcp":
                return TCP;
            default:
                throw new ModbusBadProtocolException("Unknown Modbus wire protocol: '" + name + "'");
        }
    }
}
