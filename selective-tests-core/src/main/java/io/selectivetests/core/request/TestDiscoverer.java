package io.selectivetests.core.request;

import java.util.concurrent.CompletableFuture;

/**
 * Discovers the tests available in a set of sources.
 */
public interface TestDiscoverer {

    /**
     * Starts discovery. Each batch of discovered test cases is passed to
     * {@code registrar.listener()} before the returned future completes.
     *
     * @param payload        sources and run settings
     * @param registrar      receives discovered batches and engine warnings
     * @param protocolConfig protocol version spoken with the engine
     * @return a future completing when discovery is finished, or exceptionally when it fails
     */
    CompletableFuture<Void> discoverTests(DiscoveryRequestPayload payload,
                                          DiscoveryEventsRegistrar registrar,
                                          ProtocolConfig protocolConfig);
}
