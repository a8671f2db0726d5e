package com.questrail.gateway.protocol.modbus.codec;

/**
 * Which half of an exchange a stream framer is looking at.
 *
 * <p>Only RTU cares: request and response frames of the same function code
 * have different lengths, and RTU carries no delimiter to tell them apart.</p>
 */
public enum FramingDirection
{
    /** Master to slave (request / indication). */
    REQUEST,

    /** Slave to master (response / confirmation). */
    RESPONSE
}
