package io.selectivetests.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Output} that writes to SLF4J: information at INFO, warnings at WARN.
 */
public final class LoggingOutput implements Output {

    private static final Logger log = LoggerFactory.getLogger(LoggingOutput.class);

    @Override
    public void information(String message) {
        log.info(message);
    }

    @Override
    public void warning(String message) {
        log.warn(message);
    }
}
