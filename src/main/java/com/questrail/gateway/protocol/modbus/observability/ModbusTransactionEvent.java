package com.questrail.gateway.protocol.modbus.observability;

import com.questrail.gateway.protocol.modbus.transaction.TransactionState;

import java.time.Instant;

/**
 * Record representing a transaction state transition.
 */
public record ModbusTransactionEvent(
    Instant timestamp,
    int unitId,
    int sequence,
    TransactionState oldState,
    TransactionState newState
) {
    /**
     * True if the transaction ended without a response.
     */
    public boolean isTimeout() {
        return newState == TransactionState.TIMED_OUT;
    }
}
