package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;
import com.questrail.gateway.protocol.modbus.model.ModbusConstants;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ModbusTcpCodec
 * -----------------------------------------------------------------------------
 * Wire rules for Modbus/TCP.
 *
 * <pre>
 *   byte 0-1 : transaction id (big-endian)
 *   byte 2-3 : protocol id, always 0x0000
 *   byte 4-5 : length of what follows (unit id + ADU), big-endian
 *   byte 6   : unit id
 *   byte 7.. : ADU
 * </pre>
 *
 * <p>There is no checksum; TCP already guarantees integrity.</p>
 */
public final class ModbusTcpCodec
{
    /** Bytes up to and including the length field. */
    static final int HEADER_LENGTH = 6;

    /** Header + unit id + function code. */
    static final int MINIMUM_LENGTH = 8;

    /** Smallest legal length field: unit id + function code. */
    static final int MINIMUM_LENGTH_FIELD = 2;

    /** Largest legal length field: unit id + a 255-byte ADU. */
    static final int MAXIMUM_LENGTH_FIELD = 256;

    private ModbusTcpCodec() {}

    /**
     * Build a complete TCP frame.
     *
     * @param transactionId 16-bit transaction id (higher bits are ignored)
     * @param unitId        unit id (0-255)
     * @param adu           function code + payload
     * @throws ModbusBadFormException if the ADU is empty or longer than 255 bytes
     */
    public static byte[] encode(int transactionId, int unitId, byte[] adu)
    {
        Objects.requireNonNull(adu, "adu");
        if (adu.length < 1 || adu.length > WireProtocol.TCP.maxAduLength()) {
            throw new ModbusBadFormException("TCP ADU length out of range: " + adu.length);
        }
        if (unitId < ModbusConstants.BROADCAST_UNIT_ID || unitId > ModbusConstants.MAX_UNIT_ID) {
            throw new IllegalArgumentException("unitId must be 0-" + ModbusConstants.MAX_UNIT_ID);
        }

        final int length = adu.length + 1;
        final byte[] out = new byte[HEADER_LENGTH + length];
        out[0] = (byte) ((transactionId >>> 8) & 0xFF);
        out[1] = (byte) (transactionId & 0xFF);
        out[2] = 0;
        out[3] = 0;
        out[4] = (byte) ((length >>> 8) & 0xFF);
        out[5] = (byte) (length & 0xFF);
        out[6] = (byte) unitId;
        System.arraycopy(adu, 0, out, 7, adu.length);
        return out;
    }

    /**
     * Validate and split a complete TCP frame.
     *
     * @throws ModbusBadFormException if the header is invalid
     */
    public static ModbusTcpFrame decode(byte[] frame)
    {
        validateHeader(frame);
        return new ModbusTcpFrame(
                transactionId(frame),
                frame[6] & 0xFF,
                Arrays.copyOfRange(frame, 7, frame.length));
    }

    /**
     * Confirm the header is structurally sound.
     *
     * @return always {@code true}; failures are thrown
     * @throws ModbusBadFormException on a short frame, nonzero protocol id,
     *                                length mismatch, or a length above 256
     */
    public static boolean validateHeader(byte[] frame)
    {
        return validateHeader(frame, null, null);
    }

    /**
     * Confirm the header is sound and belongs to the expected exchange.
     *
     * @param expectTransactionId transaction id the frame must carry
     * @param expectUnitId        unit id the frame must carry
     * @throws ModbusBadFormException on any structural problem or mismatch
     */
    public static boolean validateHeader(byte[] frame, int expectTransactionId, int expectUnitId)
    {
        return validateHeader(frame, Integer.valueOf(expectTransactionId), Integer.valueOf(expectUnitId));
    }

    private static boolean validateHeader(byte[] frame, Integer expectTransactionId, Integer expectUnitId)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.length < MINIMUM_LENGTH) {
            throw new ModbusBadFormException("TCP frame too short: " + frame.length + " byte(s)");
        }

        if (frame[2] != 0 || frame[3] != 0) {
            throw new ModbusBadFormException(String.format(
                    "TCP header has bad protocol id 0x%02X%02X", frame[2] & 0xFF, frame[3] & 0xFF));
        }

        final int declared = lengthField(frame);
        if (declared + HEADER_LENGTH != frame.length) {
            throw new ModbusBadFormException(String.format(
                    "TCP header length %d != frame length %d", declared + HEADER_LENGTH, frame.length));
        }

        if (declared > MAXIMUM_LENGTH_FIELD) {
            throw new ModbusBadFormException("TCP header declares more than 256 bytes: " + declared);
        }

        if (expectTransactionId != null && transactionId(frame) != (expectTransactionId & 0xFFFF)) {
            throw new ModbusBadFormException(String.format(
                    "Unexpected transaction id 0x%04X, expected 0x%04X",
                    transactionId(frame), expectTransactionId & 0xFFFF));
        }

        if (expectUnitId != null && (frame[6] & 0xFF) != expectUnitId) {
            throw new ModbusBadFormException(
                    "Unexpected unit id " + (frame[6] & 0xFF) + ", expected " + expectUnitId);
        }

        return true;
    }

    /**
     * Split a receive buffer into complete TCP frames using the length field.
     *
     * <p>A header with a nonzero protocol id, a length above 256 or below 2
     * cannot be resynchronised: everything from that header on is discarded.</p>
     */
    public static FramingResult frame(byte[] buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        final List<byte[]> frames = new ArrayList<>();
        int pos = 0;

        while (buffer.length - pos >= HEADER_LENGTH) {
            final int length = ((buffer[pos + 4] & 0xFF) << 8) | (buffer[pos + 5] & 0xFF);
            if (buffer[pos + 2] != 0 || buffer[pos + 3] != 0
                    || length < MINIMUM_LENGTH_FIELD || length > MAXIMUM_LENGTH_FIELD) {
                return new FramingResult(frames, new byte[0], buffer.length - pos);
            }

            final int total = HEADER_LENGTH + length;
            if (total > buffer.length - pos) {
                break;
            }

            frames.add(Arrays.copyOfRange(buffer, pos, pos + total));
            pos += total;
        }

        return new FramingResult(frames, Arrays.copyOfRange(buffer, pos, buffer.length), 0);
    }

    static int transactionId(byte[] frame)
    {
        return ((frame[0] & 0xFF) << 8) | (frame[1] & 0xFF);
    }

    static int lengthField(byte[] frame)
    {
        return ((frame[4] & 0xFF) << 8) | (frame[5] & 0xFF);
    }
}
