package com.questrail.gateway.protocol.modbus.observability;

/**
 * No-op implementation of ModbusObservabilitySink.
 */
public final class NullObservabilitySink implements ModbusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransactionEvent(ModbusTransactionEvent event) {}

    @Override
    public void onTraffic(ModbusTrafficEvent event) {}

    @Override
    public void onError(ModbusErrorEvent event) {}
}
