package com.questrail.gateway.protocol.modbus.observability;

import com.questrail.gateway.protocol.modbus.model.WireProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ModbusObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jModbusObservabilitySink implements ModbusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jModbusObservabilitySink.class);

    @Override
    public void onTransactionEvent(ModbusTransactionEvent event) {
        if (event.isTimeout()) {
            log.info("Unit {} seq 0x{}: no response", event.unitId(), String.format("%04X", event.sequence()));
            return;
        }
        log.debug("Unit {} seq 0x{}: {} -> {}",
            event.unitId(),
            String.format("%04X", event.sequence()),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onTraffic(ModbusTrafficEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        boolean text = event.protocol() == WireProtocol.ASCII;
        for (String line : ModbusHexDump.dump(event.label(), event.bytes(), text)) {
            log.debug("{}", line);
        }
    }

    @Override
    public void onError(ModbusErrorEvent event) {
        if (event.cause() != null) {
            log.warn("Modbus {} dropped: {} ({})", event.protocol(), event.message(), event.cause().getMessage());
        } else {
            log.warn("Modbus {} dropped: {}", event.protocol(), event.message());
        }
    }
}
