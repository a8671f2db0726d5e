package com.questrail.gateway.protocol.modbus.config;

import com.questrail.gateway.protocol.modbus.model.WireProtocol;

import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for a {@code ModbusBridge}.
 *
 * <ul>
 *   <li><b>upstreamProtocol</b>: wire form spoken by the requesting side
 *       (default TCP).</li>
 *   <li><b>downstreamProtocol</b>: wire form spoken by the addressed devices
 *       (default RTU).</li>
 *   <li><b>maxBufferedBytes</b>: ceiling for bytes held while waiting for a
 *       frame to complete (default 1024; at least one full ASCII frame).</li>
 * </ul>
 */
public record ModbusBridgeConfig(
    WireProtocol upstreamProtocol,
    WireProtocol downstreamProtocol,
    int maxBufferedBytes
) {
    /** Largest Modbus frame on any wire: an ASCII frame, ':' + 2 x (1 + 252 + 1) hex digits + CRLF. */
    public static final int MIN_BUFFERED_BYTES = 511;

    public static final String KEY_UPSTREAM_PROTOCOL = "modbus.upstream.protocol";
    public static final String KEY_DOWNSTREAM_PROTOCOL = "modbus.downstream.protocol";
    public static final String KEY_MAX_BUFFERED_BYTES = "modbus.buffer.max-bytes";

    public ModbusBridgeConfig {
        Objects.requireNonNull(upstreamProtocol, "upstreamProtocol");
        Objects.requireNonNull(downstreamProtocol, "downstreamProtocol");
        if (maxBufferedBytes < MIN_BUFFERED_BYTES) {
            throw new IllegalArgumentException("maxBufferedBytes must be at least " + MIN_BUFFERED_BYTES);
        }
    }

    public static ModbusBridgeConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the {@code modbus.*} keys; absent keys keep their defaults.
     * Protocol names may use any alias accepted by {@link WireProtocol#parse(String)}.
     *
     * @throws com.questrail.gateway.protocol.modbus.model.ModbusBadProtocolException on an unknown protocol name
     * @throws IllegalArgumentException on a non-numeric or too small buffer size
     */
    public static ModbusBridgeConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        Builder builder = builder();

        String upstream = properties.getProperty(KEY_UPSTREAM_PROTOCOL);
        if (upstream != null) {
            builder.withUpstreamProtocol(WireProtocol.parse(upstream));
        }

        String downstream = properties.getProperty(KEY_DOWNSTREAM_PROTOCOL);
        if (downstream != null) {
            builder.withDownstreamProtocol(WireProtocol.parse(downstream));
        }

        String maxBytes = properties.getProperty(KEY_MAX_BUFFERED_BYTES);
        if (maxBytes != null) {
            try {
                builder.withMaxBufferedBytes(Integer.parseInt(maxBytes.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(KEY_MAX_BUFFERED_BYTES + " is not a number: '" + maxBytes + "'", e);
            }
        }

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WireProtocol upstreamProtocol = WireProtocol.TCP;
        private WireProtocol downstreamProtocol = WireProtocol.RTU;
        private int maxBufferedBytes = 1024;

        public Builder withUpstreamProtocol(WireProtocol upstreamProtocol) {
            this.upstreamProtocol = upstreamProtocol;
            return this;
        }

        public Builder withDownstreamProtocol(WireProtocol downstreamProtocol) {
            this.downstreamProtocol = downstreamProtocol;
            return this;
        }

        public Builder withMaxBufferedBytes(int maxBufferedBytes) {
            this.maxBufferedBytes = maxBufferedBytes;
            return this;
        }

        public ModbusBridgeConfig build() {
            return new ModbusBridgeConfig(upstreamProtocol, downstreamProtocol, maxBufferedBytes);
        }
    }
}
