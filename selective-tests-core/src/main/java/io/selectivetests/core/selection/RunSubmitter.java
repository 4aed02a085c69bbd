package io.selectivetests.core.selection;

import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.filter.FilterTracker;
import io.selectivetests.core.output.Output;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.ProtocolConfig;
import io.selectivetests.core.request.RunSettings;
import io.selectivetests.core.request.TestRequestManager;
import io.selectivetests.core.request.TestRunRequestPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.TreeSet;

/**
 * Decides, once discovery has completed, whether the selection is run, and submits it.
 */
public final class RunSubmitter {

    private static final Logger log = LoggerFactory.getLogger(RunSubmitter.class);

    private final SelectiveTestsConfig config;
    private final TestRequestManager requestManager;
    private final Output output;
    private final ProtocolConfig protocolConfig;

    public RunSubmitter(SelectiveTestsConfig config, TestRequestManager requestManager,
                        Output output, ProtocolConfig protocolConfig) {
        this.config = config;
        this.requestManager = requestManager;
        this.output = output;
        this.protocolConfig = protocolConfig;
    }

    /**
     * Builds the decision from the accumulated selection. Has no side effects.
     *
     * @param selection   the cumulative selection after discovery completed
     * @param tracker     fragments still unmatched
     * @param fragments   all fragments, in argument order
     * @param runSettings settings captured at execution start
     */
    public RunDecision decide(SelectionAccumulator selection, FilterTracker tracker,
                              List<String> fragments, RunSettings runSettings) {
        List<DiscoveredTestCase> selected = selection.selectedTestCases();
        long discoveredCount = selection.discoveredTestCount();

        if (!selected.isEmpty()) {
            String warning = null;
            if (!tracker.allMatched()) {
                // Sorted so the message is stable across runs
                String missing = String.join(", ", new TreeSet<>(tracker.remaining()));
                warning = String.format(
                        "A total of %d tests were discovered but some tests do not match the specified "
                        + "selection criteria(%s). Use right value(s) and try again.",
                        discoveredCount, missing);
            }
            // The command line never keeps a runner session alive
            TestRunRequestPayload payload = new TestRunRequestPayload(
                    selected, runSettings, false, config.testCaseFilter());
            return new RunDecision(RunDecision.Action.RUN, warning, payload);
        }

        if (discoveredCount > 0) {
            String warning = String.format(
                    "A total of %d tests were discovered but no test matches the specified "
                    + "selection criteria(%s). Use right value(s) and try again.",
                    discoveredCount, String.join(", ", fragments));
            return new RunDecision(RunDecision.Action.NO_MATCH, warning, null);
        }

        String warning = String.format(
                "No test is available in %s. Make sure that test discoverer & executors are registered "
                + "and platform & framework version settings are appropriate and try again.",
                String.join(", ", config.sources()));
        if (!config.hasTestAdapterPath()) {
            warning = warning + " Additionally, path to test adapters can be specified using "
                    + "--test-adapter-path. Example: --test-adapter-path <pathToCustomAdapters>.";
        }
        return new RunDecision(RunDecision.Action.NO_DISCOVERY, warning, null);
    }

    /**
     * Surfaces the decision's warning and, for {@link RunDecision.Action#RUN}, submits the run.
     * Failures of the run engine propagate unchanged.
     */
    public void submit(RunDecision decision) {
        decision.warningMessage().ifPresent(output::warning);

        if (decision.action() != RunDecision.Action.RUN) {
            log.info("No tests selected ({}). Skipping test run.", decision.action());
            return;
        }

        log.debug("Test run is queued with {} test cases", decision.payload().testCases().size());
        requestManager.runTests(decision.payload(), protocolConfig);
    }
}
