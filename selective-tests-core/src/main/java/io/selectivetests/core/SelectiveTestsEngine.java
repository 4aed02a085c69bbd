package io.selectivetests.core;

import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.filter.FilterTracker;
import io.selectivetests.core.filter.FragmentParser;
import io.selectivetests.core.output.LoggingOutput;
import io.selectivetests.core.output.Output;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.DiscoveryEventsRegistrar;
import io.selectivetests.core.request.DiscoveryRequestPayload;
import io.selectivetests.core.request.ProtocolConfig;
import io.selectivetests.core.request.RunSettings;
import io.selectivetests.core.request.RunSettingsProvider;
import io.selectivetests.core.request.TestRequestManager;
import io.selectivetests.core.selection.RunDecision;
import io.selectivetests.core.selection.RunSubmitter;
import io.selectivetests.core.selection.SelectingDiscoveryListener;
import io.selectivetests.core.selection.SelectionAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Main orchestrator: parses name fragments, discovers tests, selects the matching ones and runs them.
 *
 * <p>Usage:
 * <pre>{@code
 * SelectiveTestsEngine engine = new SelectiveTestsEngine(config, requestManager, settingsProvider, output);
 * engine.initialize("FooTest,BarTest.parses");
 * SelectiveTestsResult result = engine.execute();
 * // result.selectedTests() were submitted for execution
 * }</pre>
 *
 * <p>One engine serves one invocation; none of its state is shared with other engines.
 */
public final class SelectiveTestsEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectiveTestsEngine.class);

    /** Lifecycle of one invocation. */
    public enum State { UNINITIALIZED, PARSED, VALIDATED, DISCOVERING, COMPLETED }

    /** Overall outcome. Warnings never turn an invocation into a failure. */
    public enum ResultCode { SUCCESS }

    /**
     * Result of a selective test invocation.
     */
    public record SelectiveTestsResult(
            ResultCode code,
            RunDecision.Action action,
            List<DiscoveredTestCase> selectedTests,
            Set<String> undiscoveredFilters,
            long discoveredTestCount
    ) {
        public boolean runSubmitted() {
            return action == RunDecision.Action.RUN;
        }
    }

    private final SelectiveTestsConfig config;
    private final TestRequestManager requestManager;
    private final RunSettingsProvider runSettingsProvider;
    private final Output output;
    private final ProtocolConfig protocolConfig;

    private State state = State.UNINITIALIZED;
    private List<String> fragments;
    private FilterTracker tracker;
    private final SelectionAccumulator selection = new SelectionAccumulator();
    private RunSettings effectiveRunSettings;

    /** Engine reporting through SLF4J. */
    public SelectiveTestsEngine(SelectiveTestsConfig config, TestRequestManager requestManager,
                                RunSettingsProvider runSettingsProvider) {
        this(config, requestManager, runSettingsProvider, new LoggingOutput());
    }

    public SelectiveTestsEngine(SelectiveTestsConfig config, TestRequestManager requestManager,
                                RunSettingsProvider runSettingsProvider, Output output) {
        this(config, requestManager, runSettingsProvider, output, ProtocolConfig.DEFAULT);
    }

    public SelectiveTestsEngine(SelectiveTestsConfig config, TestRequestManager requestManager,
                                RunSettingsProvider runSettingsProvider, Output output,
                                ProtocolConfig protocolConfig) {
        this.config = config;
        this.requestManager = requestManager;
        this.runSettingsProvider = runSettingsProvider;
        this.output = output;
        this.protocolConfig = protocolConfig;
    }

    /**
     * Parses the raw {@code --tests} argument. Every fragment starts out undiscovered.
     *
     * @throws ConfigurationException if the argument yields no fragment
     */
    public void initialize(String argument) {
        requireState(State.UNINITIALIZED);
        fragments = new FragmentParser(config, output).parse(argument);
        tracker = new FilterTracker(fragments);
        state = State.PARSED;
    }

    /**
     * Runs the pipeline: validate, discover (blocking until discovery completes), then submit
     * exactly the selected tests.
     *
     * <p>Discovery and run failures raised by the request manager propagate unchanged. If
     * discovery is cancelled, or this thread is interrupted while waiting for it, no run is
     * submitted.
     *
     * @throws ConfigurationException if no sources are configured or a test case filter is active
     */
    public SelectiveTestsResult execute() {
        requireState(State.PARSED);
        validate();

        effectiveRunSettings = runSettingsProvider.activeRunSettings();

        log.info("=== Selective Tests ===");
        log.info("Sources: {}", config.sources());
        log.info("Name fragments: {}", fragments);

        state = State.DISCOVERING;
        discoverAndSelect();

        RunSubmitter submitter = new RunSubmitter(config, requestManager, output, protocolConfig);
        RunDecision decision = submitter.decide(selection, tracker, fragments, effectiveRunSettings);
        submitter.submit(decision);
        state = State.COMPLETED;

        List<DiscoveredTestCase> selected = selection.selectedTestCases();
        log.info("=== Result: {} of {} discovered tests selected ===",
                selected.size(), selection.discoveredTestCount());
        selected.forEach(t -> log.debug("  -> {}", t.fullyQualifiedName()));

        return new SelectiveTestsResult(
                ResultCode.SUCCESS,
                decision.action(),
                selected,
                tracker.remaining(),
                selection.discoveredTestCount()
        );
    }

    public State state() {
        return state;
    }

    private void validate() {
        if (config.sources().isEmpty()) {
            throw new ConfigurationException("No test source files were specified.");
        }
        if (config.hasTestCaseFilter()) {
            throw new ConfigurationException(
                    "The --testcasefilter argument cannot be specified with --tests. "
                    + "Filtering of test cases is not applicable when tests are specified.");
        }
        state = State.VALIDATED;
    }

    private void discoverAndSelect() {
        output.information("Starting test discovery, please wait...");

        DiscoveryEventsRegistrar registrar = new DiscoveryEventsRegistrar(
                new SelectingDiscoveryListener(fragments, tracker, selection), output);
        CompletableFuture<Void> discovery = requestManager.discoverTests(
                new DiscoveryRequestPayload(config.sources(), effectiveRunSettings), registrar, protocolConfig);

        try {
            discovery.get();
        } catch (InterruptedException e) {
            discovery.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for test discovery");
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new SelectiveTestsException("Test discovery failed: " + cause.getMessage(), cause);
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Expected state " + expected + " but was " + state);
        }
    }
}
