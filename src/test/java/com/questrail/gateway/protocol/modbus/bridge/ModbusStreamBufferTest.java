package com.questrail.gateway.protocol.modbus.bridge;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;
import com.questrail.gateway.protocol.modbus.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ModbusStreamBufferTest
{
    private static final HexFormat HEX = HexFormat.of();

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void holdsPartialFrameUntilComplete()
    {
        ModbusStreamBuffer buffer = new ModbusStreamBuffer(WireProtocol.RTU, FramingDirection.REQUEST, 1024, sink);

        assertTrue(buffer.append(HEX.parseHex("010300")).isEmpty());
        assertEquals(3, buffer.pendingBytes());

        List<byte[]> frames = buffer.append(HEX.parseHex("00000AC5CD01"));
        assertEquals(1, frames.size());
        assertArrayEquals(HEX.parseHex("01030000000AC5CD"), frames.get(0));
        assertEquals(1, buffer.pendingBytes());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void reportsDiscardedBytes()
    {
        ModbusStreamBuffer buffer = new ModbusStreamBuffer(WireProtocol.ASCII, FramingDirection.REQUEST, 1024, sink);

        List<byte[]> frames = buffer.append("junk:01030000000AF2\r\n".getBytes(StandardCharsets.US_ASCII));

        assertEquals(1, frames.size());
        assertEquals(1, sink.getErrors().size());
        assertTrue(sink.getErrors().get(0).message().contains("4"));
    }

    @Test
    void clearsWhenPendingExceedsLimit()
    {
        ModbusStreamBuffer buffer = new ModbusStreamBuffer(WireProtocol.TCP, FramingDirection.REQUEST, 16, sink);

        // header declares 255 bytes that never arrive
        assertTrue(buffer.append(HEX.parseHex("0001000000FF0103000000000000000000000000")).isEmpty());

        assertEquals(0, buffer.pendingBytes());
        assertEquals(1, sink.getErrors().size());
        assertEquals(WireProtocol.TCP, sink.getErrors().get(0).protocol());
    }

    @Test
    void clearDropsPendingBytes()
    {
        ModbusStreamBuffer buffer = new ModbusStreamBuffer(WireProtocol.TCP, FramingDirection.REQUEST, 1024, sink);
        buffer.append(HEX.parseHex("0001"));

        buffer.clear();

        assertEquals(0, buffer.pendingBytes());
    }

    @Test
    void rejectsNonPositiveLimit()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new ModbusStreamBuffer(WireProtocol.RTU, FramingDirection.REQUEST, 0, sink));
    }
}
