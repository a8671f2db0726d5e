package com.questrail.gateway.protocol.modbus.bridge;

import com.questrail.gateway.protocol.modbus.codec.FramingDirection;
import com.questrail.gateway.protocol.modbus.codec.FramingResult;
import com.questrail.gateway.protocol.modbus.codec.ModbusFrameException;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusFramers;
import com.questrail.gateway.protocol.modbus.config.ModbusBridgeConfig;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;
import com.questrail.gateway.protocol.modbus.observability.ModbusErrorEvent;
import com.questrail.gateway.protocol.modbus.observability.ModbusObservabilitySink;
import com.questrail.gateway.protocol.modbus.observability.ModbusTrafficEvent;
import com.questrail.gateway.protocol.modbus.observability.ModbusTransactionEvent;
import com.questrail.gateway.protocol.modbus.observability.NullObservabilitySink;
import com.questrail.gateway.protocol.modbus.transaction.ModbusTransaction;
import com.questrail.gateway.protocol.modbus.transaction.TransactionState;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ModbusBridge
 * =============================================================================
 * Carries Modbus requests from an upstream wire form to a downstream wire form
 * and the responses back again.
 *
 * <h2>Request path</h2>
 *
 * <pre>
 *   upstream bytes
 *        → ModbusStreamBuffer          (upstream framer, request direction)
 *            → ModbusTransaction.setRequest(frame, upstream)
 *                → getRequest(downstream)
 *                    → DownstreamLink.exchange(...)
 * </pre>
 *
 * <h2>Response path</h2>
 *
 * <pre>
 *   reply bytes
 *        → downstream framer (response direction), first complete frame
 *            → ModbusTransaction.setResponse(frame, downstream)
 *                → getResponse(upstream)
 *   or, with no usable reply:
 *        → getNoResponseError(upstream)   (empty for ASCII / RTU upstream)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * Malformed frames and checksum failures are reported to the sink and
 * dropped; they never escape this class. {@link IOException}s from the link
 * do escape: a dead link is the caller's problem.
 *
 * <p>Modbus is half-duplex, so one bridge serves one link and processes one
 * transaction at a time. Not thread-safe.</p>
 */
public final class ModbusBridge
{
    private final ModbusBridgeConfig config;
    private final DownstreamLink link;
    private final ModbusObservabilitySink sink;
    private final ModbusStreamBuffer upstreamBuffer;

    public ModbusBridge(ModbusBridgeConfig config, DownstreamLink link)
    {
        this(config, link, NullObservabilitySink.INSTANCE);
    }

    public ModbusBridge(ModbusBridgeConfig config, DownstreamLink link, ModbusObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.link = Objects.requireNonNull(link, "link");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.upstreamBuffer = new ModbusStreamBuffer(
                config.upstreamProtocol(), FramingDirection.REQUEST, config.maxBufferedBytes(), sink);
    }

    public ModbusBridgeConfig config()
    {
        return config;
    }

    /**
     * Feed a chunk of upstream bytes.
     *
     * @return replies for every request the chunk completed, in order; a
     *         request that earns no reply contributes nothing
     */
    public List<byte[]> onUpstreamBytes(byte[] chunk) throws IOException
    {
        final List<byte[]> replies = new ArrayList<>();
        for (byte[] frame : upstreamBuffer.append(chunk)) {
            handleFrame(frame).ifPresent(replies::add);
        }
        return replies;
    }

    /**
     * Bridge one complete upstream request frame.
     *
     * @return the reply for the requester, or empty if nothing must be sent
     */
    public Optional<byte[]> handleFrame(byte[] frame) throws IOException
    {
        Objects.requireNonNull(frame, "frame");

        final WireProtocol upstream = config.upstreamProtocol();
        final WireProtocol downstream = config.downstreamProtocol();

        sink.onTraffic(new ModbusTrafficEvent(Instant.now(), "UP-REQ", upstream, frame));

        // 1) Upstream request -> transaction (drop malformed frames)
        final ModbusTransaction tx = new ModbusTransaction();
        final byte[] outbound;
        try {
            tx.setRequest(frame, upstream);
            transitioned(tx, TransactionState.EMPTY);
            outbound = tx.getRequest(downstream);
        } catch (ModbusFrameException e) {
            dropped(upstream, "Bad upstream request", e);
            return Optional.empty();
        }

        sink.onTraffic(new ModbusTrafficEvent(Instant.now(), "DOWN-REQ", downstream, outbound));

        // 2) Broadcast: forward and stay silent
        if (!tx.expectsResponse()) {
            link.broadcast(outbound);
            return Optional.empty();
        }

        // 3) Downstream exchange -> response, if one usable frame came back
        final Optional<byte[]> reply = link.exchange(outbound);
        if (reply.isPresent() && reply.get().length > 0) {
            sink.onTraffic(new ModbusTrafficEvent(Instant.now(), "DOWN-RSP", downstream, reply.get()));

            if (absorbResponse(tx, reply.get(), downstream)) {
                try {
                    final byte[] response = tx.getResponse(upstream);
                    sink.onTraffic(new ModbusTrafficEvent(Instant.now(), "UP-RSP", upstream, response));
                    return Optional.of(response);
                } catch (ModbusFrameException e) {
                    dropped(upstream, "Response cannot be rendered upstream", e);
                    return Optional.empty();
                }
            }
        }

        // 4) No usable response: synthesize what the upstream protocol expects
        final Optional<byte[]> error = tx.getNoResponseError(upstream);
        transitioned(tx, TransactionState.REQUEST_SET);
        error.ifPresent(bytes -> sink.onTraffic(new ModbusTrafficEvent(Instant.now(), "UP-RSP", upstream, bytes)));
        return error;
    }

    private boolean absorbResponse(ModbusTransaction tx, byte[] reply, WireProtocol downstream)
    {
        final FramingResult framed = ModbusFramers.forProtocol(downstream, FramingDirection.RESPONSE).frame(reply);
        if (!framed.hasFrames()) {
            dropped(downstream, framed.discarded() > 0
                    ? "Discarded " + framed.discarded() + " byte(s) of unframeable downstream response"
                    : "Incomplete downstream response", null);
            return false;
        }

        try {
            tx.setResponse(framed.frames().get(0), downstream);
        } catch (ModbusFrameException e) {
            dropped(downstream, "Bad downstream response", e);
            return false;
        }

        transitioned(tx, TransactionState.REQUEST_SET);
        return true;
    }

    private void transitioned(ModbusTransaction tx, TransactionState from)
    {
        sink.onTransactionEvent(new ModbusTransactionEvent(
                Instant.now(), tx.unitId(), tx.sequence(), from, tx.state()));
    }

    private void dropped(WireProtocol protocol, String message, Throwable cause)
    {
        sink.onError(new ModbusErrorEvent(Instant.now(), protocol, message, cause));
    }
}
