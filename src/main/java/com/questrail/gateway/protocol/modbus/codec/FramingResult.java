package com.questrail.gateway.protocol.modbus.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link ModbusStreamFramer#frame(byte[])} call.
 *
 * @param frames    complete frames in arrival order (never null, may be empty)
 * @param remainder bytes to keep for the next call (never null, may be empty)
 * @param discarded number of bytes dropped as unusable
 */
public record FramingResult(
        List<byte[]> frames,
        byte[] remainder,
        int discarded
) {
    public FramingResult {
        Objects.requireNonNull(frames, "frames");
        Objects.requireNonNull(remainder, "remainder");
        if (discarded < 0) {
            throw new IllegalArgumentException("discarded must be non-negative");
        }
        frames = Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public boolean hasFrames() {
        return !frames.isEmpty();
    }

    public boolean hasRemainder() {
        return remainder.length > 0;
    }

    @Override
    public String toString() {
        return "FramingResult[" +
                "frames=" + frames.size() +
                ", remainder=" + remainder.length +
                ", discarded=" + discarded +
                ']';
    }
}
