package io.selectivetests.core.request;

import io.selectivetests.core.output.Output;

import java.util.Objects;

/**
 * Handed to a {@link TestDiscoverer} with each discovery request: the listener to feed
 * discovered batches into, and a channel for engine warnings that bypasses the selection.
 */
public final class DiscoveryEventsRegistrar {

    private final TestDiscoveryListener listener;
    private final Output output;

    public DiscoveryEventsRegistrar(TestDiscoveryListener listener, Output output) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.output = Objects.requireNonNull(output, "output");
    }

    public TestDiscoveryListener listener() {
        return listener;
    }

    public void logWarning(String message) {
        output.warning(message);
    }
}
