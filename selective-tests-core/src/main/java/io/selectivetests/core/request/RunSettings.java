package io.selectivetests.core.request;

import java.util.Map;

/**
 * Opaque key/value settings passed unchanged to both discovery and run requests.
 */
public record RunSettings(Map<String, String> parameters) {

    public static final RunSettings EMPTY = new RunSettings(Map.of());

    public RunSettings {
        parameters = Map.copyOf(parameters);
    }
}
