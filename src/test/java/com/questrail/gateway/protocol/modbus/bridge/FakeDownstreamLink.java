package com.questrail.gateway.protocol.modbus.bridge;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FakeDownstreamLink
 * -----------------------------------------------------------------------------
 * Test-only {@link DownstreamLink} implementation.
 *
 * <p>Replies are scripted in order; an unscripted exchange behaves like a
 * device that never answered. Sent requests and broadcasts are recorded.</p>
 */
public final class FakeDownstreamLink implements DownstreamLink {

    private final Deque<Optional<byte[]>> replies = new ArrayDeque<>();
    private final List<byte[]> exchanged = new ArrayList<>();
    private final List<byte[]> broadcasts = new ArrayList<>();
    private IOException failure;

    public FakeDownstreamLink reply(byte[] bytes) {
        replies.add(Optional.of(Objects.requireNonNull(bytes, "bytes")));
        return this;
    }

    public FakeDownstreamLink silence() {
        replies.add(Optional.empty());
        return this;
    }

    public FakeDownstreamLink failWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public Optional<byte[]> exchange(byte[] request) throws IOException {
        Objects.requireNonNull(request, "request");
        if (failure != null) {
            throw failure;
        }
        exchanged.add(request.clone());
        Optional<byte[]> next = replies.poll();
        return next == null ? Optional.empty() : next;
    }

    @Override
    public void broadcast(byte[] request) throws IOException {
        Objects.requireNonNull(request, "request");
        if (failure != null) {
            throw failure;
        }
        broadcasts.add(request.clone());
    }

    public List<byte[]> exchanged() {
        return Collections.unmodifiableList(exchanged);
    }

    public List<byte[]> broadcasts() {
        return Collections.unmodifiableList(broadcasts);
    }
}
