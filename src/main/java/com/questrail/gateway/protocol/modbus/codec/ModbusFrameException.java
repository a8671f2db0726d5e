package com.questrail.gateway.protocol.modbus.codec;

/**
 * Base type for wire-level Modbus failures.
 *
 * <p>Every subclass means "drop this frame". None of them is fatal to the
 * bridge; callers report the failure and carry on with the next frame.</p>
 */
public abstract class ModbusFrameException extends RuntimeException
{
    protected ModbusFrameException(String message) {
        super(message);
    }

    protected ModbusFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
