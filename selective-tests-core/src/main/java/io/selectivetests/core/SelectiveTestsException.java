package io.selectivetests.core;

/**
 * Base type for failures raised by the selection pipeline itself.
 * Failures raised by discovery or run collaborators are never wrapped in this type.
 */
public class SelectiveTestsException extends RuntimeException {

    public SelectiveTestsException(String message) {
        super(message);
    }

    public SelectiveTestsException(String message, Throwable cause) {
        super(message, cause);
    }
}
