package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadChecksumException;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ModbusRtuCodec
 * -----------------------------------------------------------------------------
 * Wire rules for Modbus/RTU.
 *
 * <pre>
 *   unit id  ADU...  CRC-lo  CRC-hi
 * </pre>
 */
public final class ModbusRtuCodec
{
    /** CRC bytes appended to every frame. */
    static final int CRC_LENGTH = 2;

    private ModbusRtuCodec() {}

    /**
     * Append the CRC-16 (low byte first) to unit id + ADU.
     *
     * @throws ModbusBadFormException if fewer than two bytes are supplied
     */
    public static byte[] encode(byte[] unitAndAdu)
    {
        Objects.requireNonNull(unitAndAdu, "unitAndAdu");

        final int crc = ModbusCrc16.compute(unitAndAdu);
        final byte[] out = Arrays.copyOf(unitAndAdu, unitAndAdu.length + CRC_LENGTH);
        out[out.length - 2] = (byte) (crc & 0xFF);
        out[out.length - 1] = (byte) ((crc >>> 8) & 0xFF);
        return out;
    }

    /**
     * Validate and strip the trailing CRC-16.
     *
     * @throws ModbusBadFormException     if the frame cannot hold a message and a CRC
     * @throws ModbusBadChecksumException if the CRC does not match
     */
    public static byte[] decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (frame.length < ModbusCrc16.MINIMUM_LENGTH + CRC_LENGTH) {
            throw new ModbusBadFormException("RTU frame too short: " + frame.length + " byte(s)");
        }

        final int len = frame.length;
        final int received = ((frame[len - 1] & 0xFF) << 8) | (frame[len - 2] & 0xFF);
        final int computed = ModbusCrc16.compute(frame, 0, len - CRC_LENGTH, ModbusCrc16.MODBUS_SEED);

        if (received != computed) {
            throw new ModbusBadChecksumException("CRC-16", received, computed);
        }
        return Arrays.copyOf(frame, len - CRC_LENGTH);
    }

    /**
     * Split a receive buffer into complete RTU frames.
     *
     * <p>Frames are cut at estimated length + 2 CRC bytes. When the function
     * code has no known layout the rest of the buffer is taken as a single
     * frame (best effort; the CRC check in {@link #decode(byte[])} decides).</p>
     */
    public static FramingResult frame(byte[] buffer, FramingDirection direction)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(direction, "direction");

        final List<byte[]> frames = new ArrayList<>();
        int pos = 0;

        while (pos < buffer.length) {
            final int available = buffer.length - pos;
            final int expected = (direction == FramingDirection.REQUEST)
                    ? ModbusRtuLengthEstimator.estimateRequest(buffer, pos, available)
                    : ModbusRtuLengthEstimator.estimateResponse(buffer, pos, available);

            if (expected == ModbusRtuLengthEstimator.NOT_YET) {
                break;
            }

            if (expected == ModbusRtuLengthEstimator.UNKNOWABLE) {
                frames.add(Arrays.copyOfRange(buffer, pos, buffer.length));
                pos = buffer.length;
                break;
            }

            final int total = expected + CRC_LENGTH;
            if (total > available) {
                break;
            }

            frames.add(Arrays.copyOfRange(buffer, pos, pos + total));
            pos += total;
        }

        return new FramingResult(frames, Arrays.copyOfRange(buffer, pos, buffer.length), 0);
    }
}
