package com.questrail.gateway.protocol.modbus.model;

/**
 * Protocol constants shared by the codecs and the transaction layer.
 */
public final class ModbusConstants
{
    /** Unit id reserved for broadcast requests; no response is expected. */
    public static final int BROADCAST_UNIT_ID = 0;

    /** Unit id assumed when none has been received yet. */
    public static final int DEFAULT_UNIT_ID = 1;

    /** Highest addressable unit id. */
    public static final int MAX_UNIT_ID = 255;

    /** Transaction id assumed when none has been received yet. */
    public static final int DEFAULT_TRANSACTION_ID = 0;

    /** Set on the function code of every exception response. */
    public static final int EXCEPTION_FLAG = 0x80;

    /** Exception code: gateway target device failed to respond. */
    public static final int GATEWAY_TARGET_NO_RESPONSE = 0x0B;

    private ModbusConstants() {}
}
