package com.questrail.gateway.protocol.modbus.observability;

/**
 * Main interface for receiving Modbus bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ModbusObservabilitySink {
    /**
     * Called when a transaction changes state.
     * @param event the transition details
     */
    void onTransactionEvent(ModbusTransactionEvent event);

    /**
     * Called for every frame the bridge receives or emits.
     * @param event the bytes and where they travelled
     */
    void onTraffic(ModbusTrafficEvent event);

    /**
     * Called when a frame is dropped or buffered bytes are discarded.
     * @param event the error event
     */
    void onError(ModbusErrorEvent event);
}
