package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadChecksumException;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class ModbusRtuCodecTest
{
    private static final HexFormat HEX = HexFormat.of();

    // read holding registers 0..9, unit 1
    private static final byte[] READ_10 = HEX.parseHex("01030000000AC5CD");
    private static final byte[] READ_1 = HEX.parseHex("010300000001840A");

    // ---------------------------------------------------------------------
    // Encode / decode
    // ---------------------------------------------------------------------

    @Test
    void encodeAppendsCrcLowByteFirst()
    {
        assertArrayEquals(READ_10, ModbusRtuCodec.encode(HEX.parseHex("01030000000A")));
        assertArrayEquals(HEX.parseHex("018302C0F1"), ModbusRtuCodec.encode(HEX.parseHex("018302")));
    }

    @Test
    void encodeRejectsShortInput()
    {
        assertThrows(ModbusBadFormException.class, () -> ModbusRtuCodec.encode(new byte[] { 0x01 }));
    }

    @Test
    void decodeStripsValidCrc()
    {
        assertArrayEquals(HEX.parseHex("01030000000A"), ModbusRtuCodec.decode(READ_10));
    }

    @Test
    void decodesSmallestFrame()
    {
        assertArrayEquals(HEX.parseHex("0107"), ModbusRtuCodec.decode(HEX.parseHex("010741E2")));
    }

    @Test
    void decodeRejectsFrameTooShortForMessageAndCrc()
    {
        assertThrows(ModbusBadFormException.class, () -> ModbusRtuCodec.decode(HEX.parseHex("0107E2")));
        assertThrows(ModbusBadFormException.class, () -> ModbusRtuCodec.decode(new byte[0]));
    }

    @Test
    void decodeReportsBothCrcValuesOnMismatch()
    {
        ModbusBadChecksumException e = assertThrows(ModbusBadChecksumException.class,
                () -> ModbusRtuCodec.decode(HEX.parseHex("01030000000AC5CE")));
        assertEquals(0xCEC5, e.received());
        assertEquals(0xCDC5, e.computed());
    }

    @Test
    void roundTripsEveryLegalLength()
    {
        // unit id + ADU of 1..252 bytes
        for (int len = 2; len <= 253; len++) {
            byte[] message = new byte[len];
            for (int i = 0; i < len; i++) {
                message[i] = (byte) (i * 31 + len);
            }

            byte[] frame = ModbusRtuCodec.encode(message);
            assertEquals(len + 2, frame.length, "len=" + len);
            assertArrayEquals(message, ModbusRtuCodec.decode(frame), "len=" + len);
        }
    }

    // ---------------------------------------------------------------------
    // Stream framing
    // ---------------------------------------------------------------------

    @Test
    void framesConcatenatedRequests()
    {
        FramingResult result = ModbusRtuCodec.frame(concat(READ_10, READ_1), FramingDirection.REQUEST);

        assertEquals(2, result.frames().size());
        assertArrayEquals(READ_10, result.frames().get(0));
        assertArrayEquals(READ_1, result.frames().get(1));
        assertFalse(result.hasRemainder());
        assertEquals(0, result.discarded());
    }

    @Test
    void keepsPartialRequestAsRemainder()
    {
        byte[] partial = HEX.parseHex("01030000000AC5");
        FramingResult result = ModbusRtuCodec.frame(concat(READ_1, partial), FramingDirection.REQUEST);

        assertEquals(1, result.frames().size());
        assertArrayEquals(READ_1, result.frames().get(0));
        assertArrayEquals(partial, result.remainder());
    }

    @Test
    void framesWriteMultipleRegistersByEmbeddedByteCount()
    {
        byte[] write = ModbusRtuCodec.encode(HEX.parseHex("11100001000102000A"));
        FramingResult result = ModbusRtuCodec.frame(concat(write, READ_1), FramingDirection.REQUEST);

        assertEquals(2, result.frames().size());
        assertArrayEquals(write, result.frames().get(0));
        assertArrayEquals(READ_1, result.frames().get(1));
    }

    /**
     * The same bytes frame differently depending on which side sent them.
     */
    @Test
    void directionSelectsLayout()
    {
        byte[] response = HEX.parseHex("0103020064B9AF");

        FramingResult asResponse = ModbusRtuCodec.frame(response, FramingDirection.RESPONSE);
        assertEquals(1, asResponse.frames().size());
        assertArrayEquals(response, asResponse.frames().get(0));

        FramingResult asRequest = ModbusRtuCodec.frame(response, FramingDirection.REQUEST);
        assertFalse(asRequest.hasFrames());
        assertArrayEquals(response, asRequest.remainder());
    }

    @Test
    void framesExceptionResponse()
    {
        byte[] exception = HEX.parseHex("018302C0F1");
        FramingResult result = ModbusRtuCodec.frame(concat(exception, exception), FramingDirection.RESPONSE);

        assertEquals(2, result.frames().size());
        assertArrayEquals(exception, result.frames().get(1));
    }

    @Test
    void unknownFunctionTakesRestOfBuffer()
    {
        byte[] unknown = HEX.parseHex("012B0E01001122");
        FramingResult result = ModbusRtuCodec.frame(concat(READ_1, unknown), FramingDirection.REQUEST);

        assertEquals(2, result.frames().size());
        assertArrayEquals(unknown, result.frames().get(1));
        assertFalse(result.hasRemainder());
    }

    @Test
    void singleByteWaitsForMore()
    {
        FramingResult result = ModbusRtuCodec.frame(new byte[] { 0x01 }, FramingDirection.REQUEST);

        assertFalse(result.hasFrames());
        assertEquals(1, result.remainder().length);
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
