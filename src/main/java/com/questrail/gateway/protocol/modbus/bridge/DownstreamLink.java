package com.questrail.gateway.protocol.modbus.bridge;

import java.io.IOException;
import java.util.Optional;

/**
 * DownstreamLink
 * -----------------------------------------------------------------------------
 * Minimal port toward the devices addressed by the bridge.
 *
 * <p>Implementations own the physical I/O (serial port, socket, test harness)
 * and the response timeout. The bridge only hands over wire-ready bytes and
 * takes back whatever arrived.</p>
 *
 * <p>An {@link IOException} means the link itself is unusable; the bridge
 * does not catch it.</p>
 */
public interface DownstreamLink
{
    /**
     * Send a request and wait for the reply.
     *
     * @param request wire-ready request in the downstream protocol
     * @return the bytes received, or {@link Optional#empty()} if nothing
     *         arrived before the link's timeout
     */
    Optional<byte[]> exchange(byte[] request) throws IOException;

    /**
     * Send a broadcast request; no reply is expected.
     *
     * <p>The default delegates to {@link #exchange(byte[])} and ignores the result.
     * Links that can skip the response wait should override this.</p>
     */
    default void broadcast(byte[] request) throws IOException
    {
        exchange(request);
    }
}
