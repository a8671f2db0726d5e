package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;

import java.util.Objects;

/**
 * ModbusRtuLengthEstimator
 * -----------------------------------------------------------------------------
 * Predicts the length of a Modbus/RTU frame from its first few bytes.
 *
 * <p>RTU has no delimiters; on a real line frames are separated by silence.
 * Once bytes have been buffered, the only way to find a boundary is to read
 * the function code (and sometimes an embedded byte count) and derive the
 * length from the function's fixed layout.</p>
 *
 * <p>Returned lengths cover unit id + ADU and <strong>exclude</strong> the two
 * CRC bytes, so the same estimate serves other serial encodings of the ADU.</p>
 *
 * <p>Two sentinel values are used:</p>
 * <ul>
 *   <li>{@link #NOT_YET}: not enough bytes to decide; wait for more input.
 *       The estimator never guesses in this case.</li>
 *   <li>{@link #UNKNOWABLE}: the function code has no known layout.</li>
 * </ul>
 */
public final class ModbusRtuLengthEstimator
{
    public static final int NOT_YET = 0;
    public static final int UNKNOWABLE = -1;

    private ModbusRtuLengthEstimator() {}

    public static int estimate(byte[] data, FramingDirection direction)
    {
        Objects.requireNonNull(direction, "direction");
        return switch (direction) {
            case REQUEST -> estimateRequest(data);
            case RESPONSE -> estimateResponse(data);
        };
    }

    /**
     * Estimate a request (master to slave) frame length.
     *
     * <ul>
     *   <li>FC 1-6: {@code id fc addr(2) count/value(2)} = 6</li>
     *   <li>FC 7, 11, 12, 17: {@code id fc} = 2</li>
     *   <li>FC 15, 16: {@code id fc addr(2) count(2) bytes(1) data...} = 7 + bytes</li>
     * </ul>
     */
    public static int estimateRequest(byte[] data)
    {
        return estimateRequest(data, 0, data.length);
    }

    static int estimateRequest(byte[] data, int off, int len)
    {
        Objects.requireNonNull(data, "data");
        if (len < 2) {
            return NOT_YET;
        }

        final int function = data[off + 1] & 0xFF;
        switch (function) {
            case 1: case 2: case 3: case 4: case 5: case 6:
                return 6;
            case 7: case 11: case 12: case 17:
                return 2;
            case 15: case 16:
                if (len < 7) {
                    return NOT_YET;
                }
                return 7 + (data[off + 6] & 0xFF);
            default:
                return UNKNOWABLE;
        }
    }

    /**
     * Estimate a response (slave to master) frame length.
     *
     * <ul>
     *   <li>Exception (FC with bit 7 set): {@code id fc code} = 3</li>
     *   <li>FC 1-4, 11: {@code id fc bytes(1) data...} = 3 + bytes</li>
     *   <li>FC 5, 6, 15, 16: {@code id fc addr(2) value/count(2)} = 6</li>
     * </ul>
     */
    public static int estimateResponse(byte[] data)
    {
        return estimateResponse(data, 0, data.length);
    }

    static int estimateResponse(byte[] data, int off, int len)
    {
        Objects.requireNonNull(data, "data");
        if (len < 2) {
            return NOT_YET;
        }

        final int function = data[off + 1] & 0xFF;
        if ((function & 0x80) != 0) {
            return 3;
        }

        switch (function) {
            case 1: case 2: case 3: case 4: case 11:
                if (len < 3) {
                    return NOT_YET;
                }
                return 3 + (data[off + 2] & 0xFF);
            case 5: case 6: case 15: case 16:
                return 6;
            default:
                return UNKNOWABLE;
        }
    }
}
