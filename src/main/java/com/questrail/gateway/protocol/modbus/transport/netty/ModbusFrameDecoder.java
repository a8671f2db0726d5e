package com.questrail.gateway.protocol.modbus.transport.netty;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusStreamFramer;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusFramers;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;
import com.questrail.gateway.protocol.modbus.observability.ModbusErrorEvent;
import com.questrail.gateway.protocol.modbus.observability.ModbusObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * ModbusFrameDecoder
 * =============================================================================
 * Netty inbound decoder that cuts a byte stream into complete Modbus frames.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure framing adapter</strong> around
 * {@link ModbusStreamFramer}. It does not validate checksums or headers;
 * each emitted {@code byte[]} still goes through the transaction layer.
 *
 * <h2>Netty containment rule</h2>
 * {@code ByteBuf}s do not leave this package. Frames are emitted as
 * {@code byte[]} copies; the cumulation buffer is managed by
 * {@link ByteToMessageDecoder}.
 *
 * <h2>Overflow</h2>
 * If more than {@code maxBufferedBytes} are left unframed, they are skipped
 * and reported to the sink, so a garbage stream cannot grow without bound.
 */
public final class ModbusFrameDecoder extends ByteToMessageDecoder
{
    private final WireProtocol protocol;
    private final ModbusStreamFramer framer;
    private final int maxBufferedBytes;
    private final ModbusObservabilitySink sink;

    public ModbusFrameDecoder(WireProtocol protocol,
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

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        final int readable = in.readableBytes();
        if (readable == 0) {
            return;
        }

        // Copy the cumulation into a plain byte[] (Netty containment rule).
        final byte[] bytes = new byte[readable];
        in.getBytes(in.readerIndex(), bytes);

        final FramingResult result = framer.frame(bytes);

        // The remainder is always a suffix of the input.
        in.skipBytes(readable - result.remainder().length);
        out.addAll(result.frames());

        if (result.discarded() > 0) {
            sink.onError(new ModbusErrorEvent(Instant.now(), protocol,
                    "Discarded " + result.discarded() + " unframed byte(s)", null));
        }

        if (in.readableBytes() > maxBufferedBytes) {
            final int dropped = in.readableBytes();
            in.skipBytes(dropped);
            sink.onError(new ModbusErrorEvent(Instant.now(), protocol,
                    "Discarded " + dropped + " buffered byte(s) over limit " + maxBufferedBytes, null));
        }
    }
}
