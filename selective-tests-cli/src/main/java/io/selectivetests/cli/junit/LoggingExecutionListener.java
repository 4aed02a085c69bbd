package io.selectivetests.cli.junit;

import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the outcome of every executed test.
 */
final class LoggingExecutionListener implements TestExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingExecutionListener.class);

    @Override
    public void executionSkipped(TestIdentifier testIdentifier, String reason) {
        log.info("  SKIPPED {}: {}", testIdentifier.getDisplayName(), reason);
    }

    @Override
    public void executionFinished(TestIdentifier testIdentifier, TestExecutionResult result) {
        if (!testIdentifier.isTest()) {
            return;
        }
        switch (result.getStatus()) {
            case SUCCESSFUL -> log.debug("  PASSED  {}", testIdentifier.getLegacyReportingName());
            case ABORTED -> log.info("  ABORTED {}", testIdentifier.getLegacyReportingName());
            case FAILED -> log.warn("  FAILED  {}: {}", testIdentifier.getLegacyReportingName(),
                    result.getThrowable().map(Throwable::getMessage).orElse("no details"));
        }
    }
}
