package io.selectivetests.core.output;

/**
 * User-facing message channel with two severities.
 */
public interface Output {

    void information(String message);

    void warning(String message);
}
