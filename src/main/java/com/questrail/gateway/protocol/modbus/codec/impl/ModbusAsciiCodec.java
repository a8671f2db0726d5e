package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadChecksumException;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * ModbusAsciiCodec
 * -----------------------------------------------------------------------------
 * Wire rules for Modbus/ASCII.
 *
 * <pre>
 *   ':'  hex(unit id + ADU)  hex(LRC)  CR LF
 * </pre>
 *
 * <p>Hex digits are emitted upper case. The LRC is computed over the binary
 * bytes, before hex encoding.</p>
 */
public final class ModbusAsciiCodec
{
    /** Start-of-frame delimiter. */
    static final byte START = ':';

    static final byte CR = '\r';
    static final byte LF = '\n';

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private ModbusAsciiCodec() {}

    /**
     * Render unit id + ADU as a complete ASCII frame.
     *
     * <p>{@code 01 03 00 00 00 0A} becomes {@code ":01030000000AF2\r\n"}.</p>
     *
     * @throws ModbusBadFormException if fewer than two bytes are supplied
     */
    public static byte[] encode(byte[] unitAndAdu)
    {
        Objects.requireNonNull(unitAndAdu, "unitAndAdu");

        final int lrc = ModbusLrc.compute(unitAndAdu);
        final String text = ":" + HEX.formatHex(unitAndAdu) + HEX.toHexDigits((byte) lrc) + "\r\n";
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Parse an ASCII frame back to unit id + ADU.
     *
     * <p>The trailing CR LF is optional: a frame ending in CR LF, in a single
     * CR or LF, or in neither is accepted.</p>
     *
     * @throws ModbusBadFormException     on a missing start byte or bad hex
     * @throws ModbusBadChecksumException if the LRC does not match
     */
    public static byte[] decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.length == 0 || frame[0] != START) {
            throw new ModbusBadFormException("ASCII frame must start with ':'");
        }

        int end = frame.length;
        if (end >= 2 && frame[end - 2] == CR && frame[end - 1] == LF) {
            end -= 2;
        } else if (frame[end - 1] == CR || frame[end - 1] == LF) {
            end -= 1;
        }

        final String body = new String(frame, 1, Math.max(0, end - 1), StandardCharsets.US_ASCII);
        if (body.length() < 2) {
            throw new ModbusBadFormException("ASCII frame carries no LRC");
        }

        final byte[] decoded;
        try {
            decoded = HexFormat.of().parseHex(body);
        } catch (IllegalArgumentException e) {
            throw new ModbusBadFormException("Bad hex form: odd digit count or invalid characters", e);
        }

        final int received = decoded[decoded.length - 1] & 0xFF;
        final byte[] message = Arrays.copyOf(decoded, decoded.length - 1);

        final int computed = ModbusLrc.compute(message);
        if (received != computed) {
            throw new ModbusBadChecksumException("LRC", received, computed);
        }
        return message;
    }

    /**
     * Split a receive buffer into complete {@code ':' ... '\n'} frames.
     *
     * <p>Bytes ahead of a {@code ':'} are discarded. A {@code ':'} seen before the
     * terminator restarts the frame, dropping the truncated bytes ahead of it.
     * Anything after the last {@code '\n'} that begins with {@code ':'} is kept
     * as the remainder.</p>
     */
    public static FramingResult frame(byte[] buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        final List<byte[]> frames = new ArrayList<>();
        int discarded = 0;
        int pos = 0;

        while (pos < buffer.length) {
            int start = indexOf(buffer, START, pos);
            if (start < 0) {
                discarded += buffer.length - pos;
                pos = buffer.length;
                break;
            }
            discarded += start - pos;

            int end = indexOf(buffer, LF, start + 1);
            int restart = lastIndexOf(buffer, START, start + 1, end < 0 ? buffer.length : end);
            if (restart >= 0) {
                discarded += restart - start;
                start = restart;
            }

            if (end < 0) {
                return new FramingResult(frames, Arrays.copyOfRange(buffer, start, buffer.length), discarded);
            }

            frames.add(Arrays.copyOfRange(buffer, start, end + 1));
            pos = end + 1;
        }

        return new FramingResult(frames, new byte[0], discarded);
    }

    private static int indexOf(byte[] data, byte value, int from)
    {
        for (int i = from; i < data.length; i++) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(byte[] data, byte value, int fromInclusive, int toExclusive)
    {
        for (int i = toExclusive - 1; i >= fromInclusive; i--) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }
}
