package io.selectivetests.core;

/**
 * The invocation is not usable as configured: no fragments, no sources, or a
 * test case filter combined with name fragments. Raised before any discovery request.
 */
public class ConfigurationException extends SelectiveTestsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
