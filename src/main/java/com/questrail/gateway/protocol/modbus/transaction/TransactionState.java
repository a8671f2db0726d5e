package com.questrail.gateway.protocol.modbus.transaction;

/**
 * Lifecycle of a {@link ModbusTransaction}.
 *
 * <pre>
 *   EMPTY → REQUEST_SET → RESPONSE_SET
 *                       ↘ TIMED_OUT
 * </pre>
 *
 * <p>There is no transition back. A finished transaction is discarded.</p>
 */
public enum TransactionState
{
    EMPTY,
    REQUEST_SET,
    RESPONSE_SET,
    TIMED_OUT;

    /**
     * True once the exchange can no longer change.
     */
    public boolean isTerminal()
    {
        return this == RESPONSE_SET || this == TIMED_OUT;
    }
}
