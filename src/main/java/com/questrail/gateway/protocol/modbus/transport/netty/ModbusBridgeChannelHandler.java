package com.questrail.gateway.protocol.modbus.transport.netty;

import com.questrail.gateway.protocol.modbus.bridge.ModbusBridge;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * ModbusBridgeChannelHandler
 * =============================================================================
 * Hands complete upstream frames to a {@link ModbusBridge} and writes the
 * replies back to the channel.
 *
 * <p>Expected pipeline:</p>
 * <pre>
 *   ModbusFrameDecoder(upstream, REQUEST, ...)
 *        → ModbusBridgeChannelHandler
 * </pre>
 *
 * <p>The bridge's {@code DownstreamLink} usually blocks for the device's
 * answer. Add this handler with a separate {@code EventExecutorGroup} so the
 * channel's event loop is not held up.</p>
 *
 * <p>A link failure closes the channel; malformed frames never do.</p>
 */
public final class ModbusBridgeChannelHandler extends SimpleChannelInboundHandler<byte[]>
{
    private static final Logger log = LoggerFactory.getLogger(ModbusBridgeChannelHandler.class);

    private final ModbusBridge bridge;

    public ModbusBridgeChannelHandler(ModbusBridge bridge)
    {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, byte[] frame) throws Exception
    {
        Optional<byte[]> reply = bridge.handleFrame(frame);
        if (reply.isPresent()) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(reply.get()));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.error("Modbus bridge link failed, closing {}", ctx.channel(), cause);
        ctx.close();
    }
}
