package io.selectivetests.cli;

import io.selectivetests.cli.junit.JUnitPlatformTestRequestManager;
import io.selectivetests.core.ConfigurationException;
import io.selectivetests.core.SelectiveTestsEngine;
import io.selectivetests.core.SelectiveTestsEngine.SelectiveTestsResult;
import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.discovery.SourceTestDiscoverer;
import io.selectivetests.core.request.RunSettings;
import org.junit.platform.launcher.listeners.TestExecutionSummary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * CLI command: selective-tests --tests &lt;names|file.txt&gt; SOURCE...
 * <p>
 * Discovers the tests in the given sources, keeps those whose fully-qualified name contains
 * one of the comma-separated name fragments (ignoring case) and runs exactly those.
 * <p>
 * Exit codes: 0 when the invocation succeeded, even if no test matched; 1 for a configuration
 * error or failed tests; 2 for invalid command line usage.
 */
@Command(
        name = "selective-tests",
        mixinStandardHelpOptions = true,
        version = "selective-tests 1.0.0",
        description = "Runs only the tests whose fully-qualified names contain one of the given name fragments."
)
public class SelectiveTestsCommand implements Callable<Integer> {

    /** How tests are discovered in the sources. */
    public enum DiscoveryMode {
        /** Sources are compiled class directories or jars, scanned by the JUnit Platform. */
        CLASSPATH,
        /** Sources are project directories whose test sources are parsed. */
        SOURCE
    }

    @Spec
    private CommandSpec spec;

    @Option(names = "--tests", required = true, paramLabel = "<names|file.txt>",
            description = "Comma-separated test name fragments (\\, escapes a comma), "
                    + "or a .txt file containing them.")
    private String tests;

    @Parameters(paramLabel = "SOURCE", arity = "0..*",
            description = "Test sources: class directories or jars, or project directories with --discovery source.")
    private List<String> sources = new ArrayList<>();

    @Option(names = "--discovery", defaultValue = "classpath",
            description = "Discovery mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private DiscoveryMode discovery;

    @Option(names = "--test-adapter-path", paramLabel = "<path>",
            description = "Jars or directories with additional test engines, separated by the platform path separator.")
    private String testAdapterPath;

    @Option(names = {"--classpath", "-cp"}, paramLabel = "<path>",
            description = "Extra classpath entries the tests need, separated by the platform path separator.")
    private String classpath;

    @Option(names = "--testcasefilter", paramLabel = "<expression>",
            description = "Tag expression narrowing the run. Cannot be combined with --tests.")
    private String testCaseFilter;

    @Option(names = {"-c", "--config"}, paramLabel = "<key=value>",
            description = "Run setting passed to the test engines as a configuration parameter.")
    private Map<String, String> runSettings = new LinkedHashMap<>();

    /** Creates the command line for this command, as used by {@link SelectiveTestsCli}. */
    public static CommandLine commandLine() {
        return new CommandLine(new SelectiveTestsCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        ConsoleOutput output = new ConsoleOutput(spec.commandLine().getOut(), spec.commandLine().getErr());

        SelectiveTestsConfig config;
        try {
            config = SelectiveTestsConfig.builder()
                    .sources(sources)
                    .testAdapterPath(testAdapterPath)
                    .testCaseFilter(testCaseFilter)
                    .build();
        } catch (IllegalArgumentException e) {
            output.error(e.getMessage());
            return 1;
        }

        ExecutorService discoveryExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "selective-tests-discovery");
            thread.setDaemon(true);
            return thread;
        });
        try (JUnitPlatformTestRequestManager requestManager = createRequestManager(config, discoveryExecutor)) {
            RunSettings settings = new RunSettings(runSettings);
            SelectiveTestsEngine engine = new SelectiveTestsEngine(config, requestManager, () -> settings, output);
            engine.initialize(tests);
            SelectiveTestsResult result = engine.execute();

            if (!result.runSubmitted()) {
                return 0;
            }
            return requestManager.lastRunSummary()
                    .map(this::reportSummary)
                    .orElse(0);
        } catch (ConfigurationException e) {
            output.error(e.getMessage());
            return 1;
        } finally {
            discoveryExecutor.shutdownNow();
        }
    }

    private JUnitPlatformTestRequestManager createRequestManager(SelectiveTestsConfig config,
                                                                 ExecutorService discoveryExecutor) {
        var adapterPath = JUnitPlatformTestRequestManager.splitPath(testAdapterPath);
        var extraClasspath = JUnitPlatformTestRequestManager.splitPath(classpath);
        return switch (discovery) {
            case CLASSPATH -> JUnitPlatformTestRequestManager.forClasspathRoots(
                    adapterPath, extraClasspath, discoveryExecutor);
            case SOURCE -> JUnitPlatformTestRequestManager.forDiscoverer(
                    new SourceTestDiscoverer(config, discoveryExecutor), adapterPath, extraClasspath);
        };
    }

    private int reportSummary(TestExecutionSummary summary) {
        summary.printTo(spec.commandLine().getOut());
        if (summary.getTotalFailureCount() > 0) {
            summary.printFailuresTo(spec.commandLine().getOut(), 10);
            return 1;
        }
        return 0;
    }
}
