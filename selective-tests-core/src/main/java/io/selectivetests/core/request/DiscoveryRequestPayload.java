package io.selectivetests.core.request;

import java.util.List;

/**
 * What to discover: the test sources and the effective run settings.
 */
public record DiscoveryRequestPayload(List<String> sources, RunSettings runSettings) {

    public DiscoveryRequestPayload {
        sources = List.copyOf(sources);
    }
}
