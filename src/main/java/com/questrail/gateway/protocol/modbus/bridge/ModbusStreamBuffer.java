package com.questrail.gateway.protocol.modbus.bridge;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusStreamFramer;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusFramers;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;
import com.questrail.gateway.protocol.modbus.observability.ModbusErrorEvent;
import com.questrail.gateway.protocol.modbus.observability.ModbusObservabilitySink;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ModbusStreamBuffer
 * -----------------------------------------------------------------------------
 * Accumulates chunks from a byte stream and hands out complete frames.
 *
 * <p>Bytes the framer cannot use yet are kept for the next chunk. If they
 * grow beyond {@code maxBufferedBytes} the buffer is cleared: the stream is
 * assumed to be garbage and the next chunk starts fresh.</p>
 *
 * <p>Not thread-safe; one buffer per link and direction.</p>
 */
public final class ModbusStreamBuffer
{
    private static final byte[] EMPTY = new byte[0];

    private final WireProtocol protocol;
    private final ModbusStreamFramer framer;
    private final int maxBufferedBytes;
    private final ModbusObservabilitySink sink;

    private byte[] pending = EMPTY;

    public ModbusStreamBuffer(WireProtocol protocol,
                              FramingDirection direction,
                              int maxBufferedBytes,
                              ModbusObservabilitySink sink)
    {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.framer = ModbusFramers.forProtocol(protocol, Objects.requireNonNull(direction, "direction"));
        if (maxBufferedBytes <= 0) {
            throw new IllegalArgumentException("maxBufferedBytes must be positive");
        }
        this.maxBufferedBytes = maxBufferedBytes;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Append a chunk and return every frame it completes, oldest first.
     */
    public List<byte[]> append(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");

        final byte[] buffer = Arrays.copyOf(pending, pending.length + chunk.length);
        System.arraycopy(chunk, 0, buffer, pending.length, chunk.length);

        final FramingResult result = framer.frame(buffer);
        if (result.discarded() > 0) {
            sink.onError(new ModbusErrorEvent(Instant.now(), protocol,
                    "Discarded " + result.discarded() + " unframed byte(s)", null));
        }

        pending = result.remainder();
        if (pending.length > maxBufferedBytes) {
            sink.onError(new ModbusErrorEvent(Instant.now(), protocol,
                    "Discarded " + pending.length + " buffered byte(s) over limit " + maxBufferedBytes, null));
            pending = EMPTY;
        }

        return result.frames();
    }

    /**
     * Bytes held back waiting for more input.
     */
    public int pendingBytes()
    {
        return pending.length;
    }

    public void clear()
    {
        pending = EMPTY;
    }
}
