package com.questrail.gateway.protocol.modbus.codec.impl;

import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

final class ModbusTcpCodecTest
{
    private static final HexFormat HEX = HexFormat.of();

    private static final byte[] READ_10 = HEX.parseHex("123400000006" + "01" + "030000000A");

    // ---------------------------------------------------------------------
    // Encode / decode
    // ---------------------------------------------------------------------

    @Test
    void encodeBuildsMbapHeader()
    {
        assertArrayEquals(READ_10, ModbusTcpCodec.encode(0x1234, 1, HEX.parseHex("030000000A")));
    }

    @Test
    void encodeKeepsOnlyLow16BitsOfTransactionId()
    {
        byte[] frame = ModbusTcpCodec.encode(0x12345, 1, new byte[] { 0x07 });
        assertEquals(0x23, frame[0] & 0xFF);
        assertEquals(0x45, frame[1] & 0xFF);
    }

    @Test
    void encodeRejectsAduOutOfRange()
    {
        assertThrows(ModbusBadFormException.class, () -> ModbusTcpCodec.encode(0, 1, new byte[0]));
        assertThrows(ModbusBadFormException.class, () -> ModbusTcpCodec.encode(0, 1, new byte[256]));
        assertDoesNotThrow(() -> ModbusTcpCodec.encode(0, 1, new byte[255]));
    }

    @Test
    void encodeRejectsUnitIdOutOfRange()
    {
        assertThrows(IllegalArgumentException.class, () -> ModbusTcpCodec.encode(0, 256, new byte[] { 0x07 }));
        assertThrows(IllegalArgumentException.class, () -> ModbusTcpCodec.encode(0, -1, new byte[] { 0x07 }));
    }

    @Test
    void decodeSplitsHeaderAndAdu()
    {
        ModbusTcpFrame frame = ModbusTcpCodec.decode(READ_10);

        assertEquals(0x1234, frame.transactionId());
        assertEquals(1, frame.unitId());
        assertArrayEquals(HEX.parseHex("030000000A"), frame.adu());
    }

    // ---------------------------------------------------------------------
    // Header validation
    // ---------------------------------------------------------------------

    @Test
    void acceptsWellFormedHeader()
    {
        assertTrue(ModbusTcpCodec.validateHeader(READ_10));
        assertTrue(ModbusTcpCodec.validateHeader(READ_10, 0x1234, 1));
    }

    @Test
    void rejectsNonzeroProtocolIdInEitherByte()
    {
        assertThrows(ModbusBadFormException.class,
                () -> ModbusTcpCodec.validateHeader(HEX.parseHex("123400010006010300000001")));
        assertThrows(ModbusBadFormException.class,
                () -> ModbusTcpCodec.validateHeader(HEX.parseHex("123401000006010300000001")));
    }

    @Test
    void rejectsLengthMismatch()
    {
        assertThrows(ModbusBadFormException.class,
                () -> ModbusTcpCodec.validateHeader(HEX.parseHex("123400000007010300000001")));
        assertThrows(ModbusBadFormException.class,
                () -> ModbusTcpCodec.validateHeader(HEX.parseHex("12340000000601030000000100")));
    }

    @Test
    void rejectsShortFrame()
    {
        assertThrows(ModbusBadFormException.class,
                () -> ModbusTcpCodec.validateHeader(HEX.parseHex("12340000000101")));
    }

    @Test
    void rejectsLengthAbove256()
    {
        byte[] frame = new byte[6 + 0x0106];
        frame[4] = 0x01;
        frame[5] = 0x06;
        frame[6] = 0x01;
        frame[7] = 0x03;

        assertThrows(ModbusBadFormException.class, () -> ModbusTcpCodec.validateHeader(frame));
    }

    /**
     * A 255-byte ADU declares length 256, the largest legal value; it must
     * survive every path a frame takes.
     */
    @Test
    void maximumAduPassesEveryPath()
    {
        byte[] adu = new byte[255];
        adu[0] = 0x10;
        adu[254] = 0x7F;

        byte[] frame = ModbusTcpCodec.encode(0x1234, 1, adu);
        assertEquals(6 + 256, frame.length);
        assertEquals(0x01, frame[4]);
        assertEquals(0x00, frame[5]);

        assertTrue(ModbusTcpCodec.validateHeader(frame, 0x1234, 1));
        assertArrayEquals(adu, ModbusTcpCodec.decode(frame).adu());

        FramingResult result = ModbusTcpCodec.frame(frame);
        assertEquals(1, result.frames().size());
        assertArrayEquals(frame, result.frames().get(0));
        assertEquals(0, result.discarded());
    }

    @Test
    void roundTripsEveryLegalLength()
    {
        for (int len = 1; len <= 255; len++) {
            byte[] adu = new byte[len];
            for (int i = 0; i < len; i++) {
                adu[i] = (byte) (i * 17 + len);
            }

            byte[] frame = ModbusTcpCodec.encode(len, 7, adu);
            ModbusTcpFrame decoded = ModbusTcpCodec.decode(frame);

            assertEquals(len, decoded.transactionId(), "len=" + len);
            assertEquals(7, decoded.unitId(), "len=" + len);
            assertArrayEquals(adu, decoded.adu(), "len=" + len);
            assertEquals(1, ModbusTcpCodec.frame(frame).frames().size(), "len=" + len);
        }
    }

    @Test
    void rejectsUnexpectedTransactionId()
    {
        assertThrows(ModbusBadFormException.class, () -> ModbusTcpCodec.validateHeader(READ_10, 0x1235, 1));
    }

    @Test
    void rejectsUnexpectedUnitId()
    {
        assertThrows(ModbusBadFormException.class, () -> ModbusTcpCodec.validateHeader(READ_10, 0x1234, 2));
    }

    // ---------------------------------------------------------------------
    // Stream framing
    // ---------------------------------------------------------------------

    @Test
    void framesConcatenatedFrames()
    {
        byte[] second = ModbusTcpCodec.encode(0x1235, 2, new byte[] { 0x07 });
        FramingResult result = ModbusTcpCodec.frame(concat(READ_10, second));

        assertEquals(2, result.frames().size());
        assertArrayEquals(READ_10, result.frames().get(0));
        assertArrayEquals(second, result.frames().get(1));
        assertFalse(result.hasRemainder());
    }

    @Test
    void keepsPartialFrameAsRemainder()
    {
        byte[] partial = HEX.parseHex("1235000000060103");
        FramingResult result = ModbusTcpCodec.frame(concat(READ_10, partial));

        assertEquals(1, result.frames().size());
        assertArrayEquals(partial, result.remainder());
    }

    @Test
    void keepsIncompleteHeaderAsRemainder()
    {
        FramingResult result = ModbusTcpCodec.frame(HEX.parseHex("1234000000"));

        assertFalse(result.hasFrames());
        assertEquals(5, result.remainder().length);
        assertEquals(0, result.discarded());
    }

    @Test
    void discardsFromFirstBadHeader()
    {
        byte[] bad = HEX.parseHex("123500010006010300000001");
        FramingResult result = ModbusTcpCodec.frame(concat(READ_10, bad));

        assertEquals(1, result.frames().size());
        assertArrayEquals(READ_10, result.frames().get(0));
        assertFalse(result.hasRemainder());
        assertEquals(bad.length, result.discarded());
    }

    @Test
    void discardsLengthFieldAbove256()
    {
        FramingResult result = ModbusTcpCodec.frame(HEX.parseHex("123400000101" + "0103"));

        assertFalse(result.hasFrames());
        assertEquals(8, result.discarded());
    }

    @Test
    void discardsLengthFieldTooSmall()
    {
        FramingResult result = ModbusTcpCodec.frame(HEX.parseHex("12340000000101"));

        assertFalse(result.hasFrames());
        assertEquals(7, result.discarded());
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
