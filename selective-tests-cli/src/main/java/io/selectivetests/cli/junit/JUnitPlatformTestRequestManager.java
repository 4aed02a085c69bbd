package io.selectivetests.cli.junit;

import io.selectivetests.core.SelectiveTestsException;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.DiscoveryEventsRegistrar;
import io.selectivetests.core.request.DiscoveryRequestPayload;
import io.selectivetests.core.request.ProtocolConfig;
import io.selectivetests.core.request.TestDiscoverer;
import io.selectivetests.core.request.TestRequestManager;
import io.selectivetests.core.request.TestRunRequestPayload;
import org.junit.platform.engine.DiscoverySelector;
import org.junit.platform.engine.discovery.DiscoverySelectors;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.Launcher;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.TagFilter;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder;
import org.junit.platform.launcher.core.LauncherFactory;
import org.junit.platform.launcher.listeners.SummaryGeneratingListener;
import org.junit.platform.launcher.listeners.TestExecutionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Discovers and runs tests through the JUnit Platform {@link Launcher}.
 *
 * <p>Tests are loaded in a dedicated class loader over the classpath roots, the test adapter
 * path (extra test engines, e.g. the Vintage or Spock engine) and any extra classpath entries.
 * In classpath mode each source is a classpath root (a class directory or jar) and yields one
 * discovery batch. In source mode discovery is delegated to another {@link TestDiscoverer},
 * and the tests are run from the extra classpath.
 */
public final class JUnitPlatformTestRequestManager implements TestRequestManager, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JUnitPlatformTestRequestManager.class);

    private final TestDiscoverer sourceDiscoverer;
    private final List<Path> testAdapterPath;
    private final List<Path> classpath;
    private final Executor executor;

    private URLClassLoader classLoader;
    private volatile TestExecutionSummary lastRunSummary;

    private JUnitPlatformTestRequestManager(TestDiscoverer sourceDiscoverer, List<Path> testAdapterPath,
                                            List<Path> classpath, Executor executor) {
        this.sourceDiscoverer = sourceDiscoverer;
        this.testAdapterPath = List.copyOf(testAdapterPath);
        this.classpath = List.copyOf(classpath);
        this.executor = executor;
    }

    /**
     * Discovers tests by scanning each source as a classpath root.
     *
     * @param testAdapterPath jars or directories holding additional test engines
     * @param classpath       extra entries the tests need, e.g. their dependencies
     * @param executor        runs discovery; batches are delivered on its threads
     */
    public static JUnitPlatformTestRequestManager forClasspathRoots(List<Path> testAdapterPath,
                                                                    List<Path> classpath,
                                                                    Executor executor) {
        return new JUnitPlatformTestRequestManager(null, testAdapterPath, classpath, executor);
    }

    /**
     * Delegates discovery to {@code discoverer} and runs the selected tests from {@code classpath}.
     */
    public static JUnitPlatformTestRequestManager forDiscoverer(TestDiscoverer discoverer,
                                                                List<Path> testAdapterPath,
                                                                List<Path> classpath) {
        return new JUnitPlatformTestRequestManager(discoverer, testAdapterPath, classpath, Runnable::run);
    }

    /**
     * Splits a {@link File#pathSeparator}-separated path list, ignoring blank entries.
     */
    public static List<Path> splitPath(String pathList) {
        List<Path> paths = new ArrayList<>();
        if (pathList == null || pathList.isBlank()) {
            return paths;
        }
        for (String entry : pathList.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                paths.add(Path.of(entry.strip()));
            }
        }
        return paths;
    }

    @Override
    public CompletableFuture<Void> discoverTests(DiscoveryRequestPayload payload,
                                                 DiscoveryEventsRegistrar registrar,
                                                 ProtocolConfig protocolConfig) {
        if (sourceDiscoverer != null) {
            return sourceDiscoverer.discoverTests(payload, registrar, protocolConfig);
        }

        List<Path> roots = new ArrayList<>();
        for (String source : payload.sources()) {
            Path root = Path.of(source);
            if (Files.exists(root)) {
                roots.add(root);
            } else {
                registrar.logWarning("Test source " + source + " was not found; skipping it.");
            }
        }
        ClassLoader loader = classLoader(roots);

        return CompletableFuture.runAsync(() -> withContextClassLoader(loader, () -> {
            Launcher launcher = LauncherFactory.create();
            int total = 0;
            for (Path root : roots) {
                List<DiscoveredTestCase> batch = discoverRoot(launcher, root, payload);
                if (!batch.isEmpty()) {
                    total += batch.size();
                    registrar.listener().onDiscoveredTests(batch);
                }
            }
            log.info("[classpath] Discovered {} tests in {} sources", total, roots.size());
            return null;
        }), executor);
    }

    @Override
    public void runTests(TestRunRequestPayload payload, ProtocolConfig protocolConfig) {
        List<DiscoverySelector> selectors = new ArrayList<>();
        Set<String> classNames = new LinkedHashSet<>();
        ClassLoader loader = classLoader(List.of());

        for (DiscoveredTestCase testCase : payload.testCases()) {
            Optional<String> uniqueId = testCase.uniqueId();
            if (uniqueId.isPresent()) {
                selectors.add(DiscoverySelectors.selectUniqueId(uniqueId.get()));
            } else if (classNames.add(testCase.className())) {
                selectors.add(DiscoverySelectors.selectClass(loader, testCase.className()));
            }
        }

        LauncherDiscoveryRequestBuilder builder = LauncherDiscoveryRequestBuilder.request()
                .selectors(selectors)
                .filters(new SelectedTestsFilter(payload.testCases()))
                .configurationParameters(payload.runSettings().parameters());
        if (payload.testCaseFilter() != null && !payload.testCaseFilter().isBlank()) {
            builder.filters(TagFilter.includeTags(payload.testCaseFilter()));
        }
        LauncherDiscoveryRequest request = builder.build();

        log.info("Running {} selected tests", payload.testCases().size());
        SummaryGeneratingListener summary = new SummaryGeneratingListener();
        withContextClassLoader(loader, () -> {
            LauncherFactory.create().execute(request, summary, new LoggingExecutionListener());
            return null;
        });

        lastRunSummary = summary.getSummary();
        log.info("Run finished: {} succeeded, {} failed, {} skipped",
                lastRunSummary.getTestsSucceededCount(),
                lastRunSummary.getTotalFailureCount(),
                lastRunSummary.getTestsSkippedCount());
    }

    /** Summary of the most recent run, empty until a run has completed. */
    public Optional<TestExecutionSummary> lastRunSummary() {
        return Optional.ofNullable(lastRunSummary);
    }

    @Override
    public synchronized void close() {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close test class loader: {}", e.getMessage());
        }
        classLoader = null;
    }

    private List<DiscoveredTestCase> discoverRoot(Launcher launcher, Path root, DiscoveryRequestPayload payload) {
        LauncherDiscoveryRequest request = LauncherDiscoveryRequestBuilder.request()
                .selectors(DiscoverySelectors.selectClasspathRoots(Set.of(root)))
                .configurationParameters(payload.runSettings().parameters())
                .build();
        TestPlan plan = launcher.discover(request);

        String source = root.toString();
        List<DiscoveredTestCase> batch = new ArrayList<>();
        for (TestIdentifier engine : plan.getRoots()) {
            for (TestIdentifier identifier : plan.getDescendants(engine)) {
                toTestCase(source, identifier).ifPresent(batch::add);
            }
        }
        log.debug("Discovered {} tests in {}", batch.size(), root);
        return batch;
    }

    /**
     * Method-backed identifiers become {@code Class.method}; this also covers parameterized
     * tests and test factories, whose invocations only exist at execution time.
     */
    private static Optional<DiscoveredTestCase> toTestCase(String source, TestIdentifier identifier) {
        if (identifier.getSource().orElse(null) instanceof MethodSource method) {
            return Optional.of(DiscoveredTestCase.ofUniqueId(source,
                    method.getClassName() + "." + method.getMethodName(),
                    method.getClassName(), method.getMethodName(), identifier.getUniqueId()));
        }
        if (identifier.isTest()) {
            return Optional.of(DiscoveredTestCase.ofUniqueId(source,
                    identifier.getLegacyReportingName(), identifier.getLegacyReportingName(),
                    null, identifier.getUniqueId()));
        }
        return Optional.empty();
    }

    private synchronized ClassLoader classLoader(List<Path> roots) {
        if (classLoader == null) {
            List<URL> urls = new ArrayList<>();
            List<Path> entries = new ArrayList<>(roots);
            entries.addAll(testAdapterPath);
            entries.addAll(classpath);
            for (Path entry : entries) {
                try {
                    urls.add(entry.toUri().toURL());
                } catch (MalformedURLException e) {
                    throw new SelectiveTestsException("Invalid classpath entry: " + entry, e);
                }
            }
            log.debug("Test class loader entries: {}", entries);
            classLoader = new URLClassLoader("selective-tests", urls.toArray(new URL[0]),
                    JUnitPlatformTestRequestManager.class.getClassLoader());
        }
        return classLoader;
    }

    private static <T> T withContextClassLoader(ClassLoader loader, Supplier<T> action) {
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(loader);
        try {
            return action.get();
        } finally {
            thread.setContextClassLoader(previous);
        }
    }
}
