package com.questrail.gateway.protocol.modbus.transaction;

import com.questrail.gateway.protocol.modbus.codec.ModbusBadChecksumException;
import com.questrail.gateway.protocol.modbus.codec.ModbusBadFormException;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusAsciiCodec;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusRtuCodec;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusTcpCodec;
import com.questrail.gateway.protocol.modbus.codec.impl.ModbusTcpFrame;
import com.questrail.gateway.protocol.modbus.model.ModbusConstants;
import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * ModbusTransaction
 * =============================================================================
 * One Modbus request/response exchange, held in protocol-neutral form.
 *
 * <h2>What this represents</h2>
 * A request arrives in one wire form, is re-rendered in another wire form for
 * the far side of the bridge, and the far side's response is absorbed and
 * re-rendered back toward the requester. The transaction carries exactly the
 * state that must survive that round trip:
 * <ul>
 *   <li>the unit id the request was addressed to</li>
 *   <li>the Modbus/TCP transaction id (only meaningful on TCP)</li>
 *   <li>the request and response ADUs, independent of framing</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * See {@link TransactionState}. Calls made in the wrong state throw
 * {@link IllegalStateException}; wire defects throw
 * {@link ModbusBadFormException} or {@link ModbusBadChecksumException} and
 * leave the state unchanged.
 *
 * <h2>Threading</h2>
 * Not thread-safe. A transaction belongs to the single bridging flow that
 * created it.
 *
 * <h2>Transaction ids</h2>
 * A TCP response is only checked against this transaction's own id. Nothing
 * here tracks other outstanding transactions; a driver with several requests
 * in flight must keep their ids distinct itself.
 */
public final class ModbusTransaction
{
    private TransactionState state = TransactionState.EMPTY;

    private int unitId = ModbusConstants.DEFAULT_UNIT_ID;
    private int transactionId = ModbusConstants.DEFAULT_TRANSACTION_ID;

    private ModbusMessage request;
    private ModbusMessage response;

    // -------------------------------------------------------------------------
    // Request
    // -------------------------------------------------------------------------

    /**
     * Absorb a raw request frame.
     *
     * @param raw      complete frame, exactly as received
     * @param protocol wire form of {@code raw}
     * @throws ModbusBadFormException     on a malformed frame or oversized ADU
     * @throws ModbusBadChecksumException on an LRC/CRC mismatch
     */
    public void setRequest(byte[] raw, WireProtocol protocol)
    {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(protocol, "protocol");
        requireState(TransactionState.EMPTY, "setRequest");

        final Decoded decoded = switch (protocol) {
            case ASCII -> Decoded.serial(ModbusAsciiCodec.decode(raw));
            case RTU -> Decoded.serial(ModbusRtuCodec.decode(raw));
            case TCP -> Decoded.tcp(ModbusTcpCodec.decode(raw));
        };
        checkAduLength(decoded.adu(), protocol);

        this.unitId = decoded.unitId();
        if (protocol == WireProtocol.TCP) {
            this.transactionId = decoded.transactionId();
        }
        this.request = new ModbusMessage(protocol, raw, decoded.adu());
        this.state = TransactionState.REQUEST_SET;
    }

    /**
     * Render the request in {@code protocol}.
     *
     * <p>For TCP the stored transaction id is reused, so a request that came in
     * over TCP goes back out with the same id.</p>
     */
    public byte[] getRequest(WireProtocol protocol)
    {
        Objects.requireNonNull(protocol, "protocol");
        if (request == null) {
            throw new IllegalStateException("No request data");
        }
        return render(protocol, request.adu());
    }

    // -------------------------------------------------------------------------
    // Response
    // -------------------------------------------------------------------------

    /**
     * Absorb a raw response frame from the far side.
     *
     * <p>The response must be addressed to the same unit as the request. For
     * TCP it must also carry this transaction's id.</p>
     *
     * @throws ModbusBadFormException     on a malformed frame, oversized ADU or
     *                                    unit / transaction id mismatch
     * @throws ModbusBadChecksumException on an LRC/CRC mismatch
     */
    public void setResponse(byte[] raw, WireProtocol protocol)
    {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(protocol, "protocol");
        requireState(TransactionState.REQUEST_SET, "setResponse");

        final Decoded decoded = switch (protocol) {
            case ASCII -> Decoded.serial(ModbusAsciiCodec.decode(raw));
            case RTU -> Decoded.serial(ModbusRtuCodec.decode(raw));
            case TCP -> {
                ModbusTcpCodec.validateHeader(raw, transactionId, unitId);
                yield Decoded.tcp(ModbusTcpCodec.decode(raw));
            }
        };

        if (decoded.unitId() != unitId) {
            throw new ModbusBadFormException(
                    "Unexpected unit id " + decoded.unitId() + " in response, expected " + unitId);
        }
        checkAduLength(decoded.adu(), protocol);

        this.response = new ModbusMessage(protocol, raw, decoded.adu());
        this.state = TransactionState.RESPONSE_SET;
    }

    /**
     * Render the response in {@code protocol}, addressed as the request was.
     */
    public byte[] getResponse(WireProtocol protocol)
    {
        Objects.requireNonNull(protocol, "protocol");
        if (response == null) {
            throw new IllegalStateException("No response data");
        }
        return render(protocol, response.adu());
    }

    // -------------------------------------------------------------------------
    // Timeout
    // -------------------------------------------------------------------------

    /**
     * Produce what the requester should receive when the far side never answered.
     *
     * <ul>
     *   <li>ASCII, RTU: nothing. Serial Modbus has no "no answer" frame; the
     *       bridge must stay silent on that side.</li>
     *   <li>TCP: exception response {@code fc | 0x80, 0x0B} (gateway target
     *       device failed to respond) with the stored transaction id.</li>
     * </ul>
     *
     * <p>The transaction moves to {@link TransactionState#TIMED_OUT}.</p>
     */
    public Optional<byte[]> getNoResponseError(WireProtocol protocol)
    {
        Objects.requireNonNull(protocol, "protocol");
        requireState(TransactionState.REQUEST_SET, "getNoResponseError");

        final Optional<byte[]> result = switch (protocol) {
            case ASCII, RTU -> Optional.empty();
            case TCP -> Optional.of(ModbusTcpCodec.encode(transactionId, unitId, new byte[] {
                    (byte) (request.functionCode() | ModbusConstants.EXCEPTION_FLAG),
                    (byte) ModbusConstants.GATEWAY_TARGET_NO_RESPONSE
            }));
        };

        this.state = TransactionState.TIMED_OUT;
        return result;
    }

    // -------------------------------------------------------------------------
    // Identity
    // -------------------------------------------------------------------------

    public TransactionState state()
    {
        return state;
    }

    /**
     * Addressed unit; {@link ModbusConstants#DEFAULT_UNIT_ID} until a request is set.
     */
    public int unitId()
    {
        return unitId;
    }

    /**
     * True unless the request was a broadcast (unit id 0).
     */
    public boolean expectsResponse()
    {
        return unitId != ModbusConstants.BROADCAST_UNIT_ID;
    }

    /**
     * Modbus/TCP transaction id as an unsigned 16-bit value.
     */
    public int sequence()
    {
        return transactionId;
    }

    /**
     * Modbus/TCP transaction id as it appears on the wire (2 bytes, big-endian).
     */
    public byte[] sequenceBytes()
    {
        return new byte[] { (byte) ((transactionId >>> 8) & 0xFF), (byte) (transactionId & 0xFF) };
    }

    /**
     * Override the transaction id used when rendering TCP frames.
     */
    public void setSequence(int sequence)
    {
        requireNotTerminal("setSequence");
        this.transactionId = sequence & 0xFFFF;
    }

    /**
     * Override the transaction id from wire bytes.
     *
     * <p>Input is forced to exactly two bytes: shorter input is padded with
     * zero bytes, longer input is truncated.</p>
     */
    public void setSequence(byte[] sequence)
    {
        Objects.requireNonNull(sequence, "sequence");
        final byte[] two = Arrays.copyOf(sequence, 2);
        setSequence(((two[0] & 0xFF) << 8) | (two[1] & 0xFF));
    }

    public Optional<ModbusMessage> request()
    {
        return Optional.ofNullable(request);
    }

    public Optional<ModbusMessage> response()
    {
        return Optional.ofNullable(response);
    }

    @Override
    public String toString()
    {
        return "ModbusTransaction[" +
                "state=" + state +
                ", unitId=" + unitId +
                ", sequence=0x" + String.format("%04X", transactionId) +
                ", request=" + request +
                ", response=" + response +
                ']';
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private byte[] render(WireProtocol protocol, byte[] adu)
    {
        checkAduLength(adu, protocol);
        return switch (protocol) {
            case ASCII -> ModbusAsciiCodec.encode(withUnitId(adu));
            case RTU -> ModbusRtuCodec.encode(withUnitId(adu));
            case TCP -> ModbusTcpCodec.encode(transactionId, unitId, adu);
        };
    }

    private byte[] withUnitId(byte[] adu)
    {
        final byte[] out = new byte[adu.length + 1];
        out[0] = (byte) unitId;
        System.arraycopy(adu, 0, out, 1, adu.length);
        return out;
    }

    private static void checkAduLength(byte[] adu, WireProtocol protocol)
    {
        if (adu.length > protocol.maxAduLength()) {
            throw new ModbusBadFormException(String.format(
                    "ADU length %d exceeds %s maximum of %d", adu.length, protocol, protocol.maxAduLength()));
        }
    }

    private void requireState(TransactionState expected, String operation)
    {
        if (state != expected) {
            throw new IllegalStateException(operation + " not allowed in state " + state);
        }
    }

    private void requireNotTerminal(String operation)
    {
        if (state.isTerminal()) {
            throw new IllegalStateException(operation + " not allowed in state " + state);
        }
    }

    private record Decoded(int unitId, int transactionId, byte[] adu)
    {
        static Decoded serial(byte[] unitAndAdu)
        {
            return new Decoded(
                    unitAndAdu[0] & 0xFF,
                    ModbusConstants.DEFAULT_TRANSACTION_ID,
                    Arrays.copyOfRange(unitAndAdu, 1, unitAndAdu.length));
        }

        static Decoded tcp(ModbusTcpFrame frame)
        {
            return new Decoded(frame.unitId(), frame.transactionId(), frame.adu());
        }
    }
}
