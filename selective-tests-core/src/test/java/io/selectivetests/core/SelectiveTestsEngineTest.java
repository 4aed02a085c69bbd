package io.selectivetests.core;

import io.selectivetests.core.SelectiveTestsEngine.SelectiveTestsResult;
import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.output.RecordingOutput;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.DiscoveryEventsRegistrar;
import io.selectivetests.core.request.DiscoveryRequestPayload;
import io.selectivetests.core.request.ProtocolConfig;
import io.selectivetests.core.request.RunSettings;
import io.selectivetests.core.request.TestRequestManager;
import io.selectivetests.core.request.TestRunRequestPayload;
import io.selectivetests.core.selection.RunDecision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SelectiveTestsEngineTest {

    @TempDir
    Path tempDir;

    private final RecordingOutput output = new RecordingOutput();

    /**
     * Delivers each configured batch from a separate thread, then completes discovery.
     */
    private static final class ScriptedRequestManager implements TestRequestManager {

        private final List<List<DiscoveredTestCase>> batches;
        private final List<TestRunRequestPayload> runs = new ArrayList<>();
        private final AtomicInteger discoveryRequests = new AtomicInteger();
        private DiscoveryRequestPayload lastDiscovery;

        ScriptedRequestManager(List<List<DiscoveredTestCase>> batches) {
            this.batches = batches;
        }

        @Override
        public CompletableFuture<Void> discoverTests(DiscoveryRequestPayload payload,
                                                     DiscoveryEventsRegistrar registrar,
                                                     ProtocolConfig protocolConfig) {
            discoveryRequests.incrementAndGet();
            lastDiscovery = payload;
            return CompletableFuture.runAsync(() -> batches.forEach(registrar.listener()::onDiscoveredTests));
        }

        @Override
        public void runTests(TestRunRequestPayload payload, ProtocolConfig protocolConfig) {
            runs.add(payload);
        }
    }

    private static List<DiscoveredTestCase> threeTests() {
        return List.of(
                DiscoveredTestCase.ofMethod("tests.jar", "N", "A1"),
                DiscoveredTestCase.ofMethod("tests.jar", "N", "A2"),
                DiscoveredTestCase.ofMethod("tests.jar", "N", "B1"));
    }

    private static SelectiveTestsConfig config() {
        return SelectiveTestsConfig.builder().sources(List.of("tests.jar")).build();
    }

    private SelectiveTestsEngine engine(SelectiveTestsConfig config, TestRequestManager manager) {
        return new SelectiveTestsEngine(config, manager, () -> RunSettings.EMPTY, output);
    }

    @Test
    void selectsAndRunsMatchingTests() {
        List<DiscoveredTestCase> tests = threeTests();
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(tests));
        SelectiveTestsEngine engine = engine(config(), manager);

        engine.initialize("A");
        SelectiveTestsResult result = engine.execute();

        assertEquals(SelectiveTestsEngine.ResultCode.SUCCESS, result.code());
        assertEquals(List.of(tests.get(0), tests.get(1)), result.selectedTests());
        assertTrue(result.undiscoveredFilters().isEmpty());
        assertEquals(3, result.discoveredTestCount());
        assertTrue(result.runSubmitted());
        assertEquals(1, manager.runs.size());
        assertEquals(result.selectedTests(), manager.runs.get(0).testCases());
        assertTrue(output.warnings().isEmpty());
        assertEquals(SelectiveTestsEngine.State.COMPLETED, engine.state());
    }

    @Test
    void noMatchIsAWarningNotAFailure() {
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(threeTests()));
        SelectiveTestsEngine engine = engine(config(), manager);

        engine.initialize("Z");
        SelectiveTestsResult result = engine.execute();

        assertEquals(SelectiveTestsEngine.ResultCode.SUCCESS, result.code());
        assertEquals(RunDecision.Action.NO_MATCH, result.action());
        assertTrue(result.selectedTests().isEmpty());
        assertEquals(3, result.discoveredTestCount());
        assertEquals(Set.of("Z"), result.undiscoveredFilters());
        assertEquals(1, output.warnings().size());
        assertTrue(output.warnings().get(0).contains("Z"));
        assertTrue(manager.runs.isEmpty());
    }

    @Test
    void noDiscoveredTestsIsAWarningNotAFailure() {
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of());
        SelectiveTestsEngine engine = engine(config(), manager);

        engine.initialize("A");
        SelectiveTestsResult result = engine.execute();

        assertEquals(SelectiveTestsEngine.ResultCode.SUCCESS, result.code());
        assertEquals(RunDecision.Action.NO_DISCOVERY, result.action());
        assertEquals(0, result.discoveredTestCount());
        assertTrue(output.warnings().get(0).contains("No test is available in tests.jar"));
        assertTrue(manager.runs.isEmpty());
    }

    @Test
    void batchesAcrossSourcesAccumulate() {
        DiscoveredTestCase parser = DiscoveredTestCase.ofMethod("a.jar", "com.example.ParserTest", "parses");
        DiscoveredTestCase lexer = DiscoveredTestCase.ofMethod("b.jar", "com.example.LexerTest", "lexes");
        DiscoveredTestCase other = DiscoveredTestCase.ofMethod("b.jar", "com.example.OtherTest", "other");
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(
                List.of(parser), List.of(lexer, other), List.of(parser)));
        SelectiveTestsEngine engine = engine(
                SelectiveTestsConfig.builder().sources(List.of("a.jar", "b.jar")).build(), manager);

        engine.initialize("lexer,PARSER,Missing");
        SelectiveTestsResult result = engine.execute();

        assertEquals(List.of(parser, lexer), result.selectedTests());
        assertEquals(4, result.discoveredTestCount());
        assertEquals(Set.of("Missing"), result.undiscoveredFilters());
        assertEquals(1, output.warnings().size(), "Partial match should warn once");
        assertTrue(output.warnings().get(0).contains("Missing"));
        assertEquals(List.of("a.jar", "b.jar"), manager.lastDiscovery.sources());
    }

    @Test
    void missingSourcesFailBeforeDiscovery() {
        TestRequestManager manager = mock(TestRequestManager.class);
        SelectiveTestsEngine engine = engine(SelectiveTestsConfig.builder().build(), manager);
        engine.initialize("A");

        assertThrows(ConfigurationException.class, engine::execute);
        verifyNoInteractions(manager);
    }

    @Test
    void testCaseFilterCannotBeCombinedWithFragments() {
        TestRequestManager manager = mock(TestRequestManager.class);
        SelectiveTestsEngine engine = engine(SelectiveTestsConfig.builder()
                .sources(List.of("tests.jar"))
                .testCaseFilter("fast")
                .build(), manager);
        engine.initialize("A");

        ConfigurationException e = assertThrows(ConfigurationException.class, engine::execute);
        assertTrue(e.getMessage().contains("--testcasefilter"));
        verifyNoInteractions(manager);
    }

    @Test
    void emptyArgumentFailsDuringInitialize() {
        SelectiveTestsEngine engine = engine(config(), mock(TestRequestManager.class));

        assertThrows(ConfigurationException.class, () -> engine.initialize(" , "));
        assertEquals(SelectiveTestsEngine.State.UNINITIALIZED, engine.state());
    }

    @Test
    void fragmentsFromFileAreUsed() throws Exception {
        Path file = tempDir.resolve("tests.txt");
        Files.writeString(file, "A1,B1");
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(threeTests()));
        SelectiveTestsEngine engine = engine(config(), manager);

        engine.initialize(file.toString());
        SelectiveTestsResult result = engine.execute();

        assertEquals(2, result.selectedTests().size());
        assertEquals(1, output.information().stream().filter(m -> m.contains(file.toString())).count());
    }

    @Test
    void runSettingsAreCapturedOnceAndPassedThrough() {
        RunSettings settings = new RunSettings(Map.of("key", "value"));
        AtomicInteger reads = new AtomicInteger();
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(threeTests()));
        SelectiveTestsEngine engine = new SelectiveTestsEngine(config(), manager, () -> {
            reads.incrementAndGet();
            return settings;
        }, output);

        engine.initialize("A");
        engine.execute();

        assertEquals(1, reads.get());
        assertSame(settings, manager.lastDiscovery.runSettings());
        assertSame(settings, manager.runs.get(0).runSettings());
    }

    @Test
    void discoveryFailurePropagatesUnchanged() {
        TestRequestManager manager = mock(TestRequestManager.class);
        IllegalStateException failure = new IllegalStateException("engine crashed");
        when(manager.discoverTests(any(), any(), any())).thenReturn(CompletableFuture.failedFuture(failure));
        SelectiveTestsEngine engine = engine(config(), manager);
        engine.initialize("A");

        assertSame(failure, assertThrows(IllegalStateException.class, engine::execute));
        verify(manager, never()).runTests(any(), any());
    }

    @Test
    void cancelledDiscoverySubmitsNoRun() {
        TestRequestManager manager = mock(TestRequestManager.class);
        when(manager.discoverTests(any(), any(), any())).thenAnswer(invocation -> {
            DiscoveryEventsRegistrar registrar = invocation.getArgument(1);
            registrar.listener().onDiscoveredTests(threeTests());
            CompletableFuture<Void> future = new CompletableFuture<>();
            future.cancel(true);
            return future;
        });
        SelectiveTestsEngine engine = engine(config(), manager);
        engine.initialize("A");

        assertThrows(CancellationException.class, engine::execute);
        verify(manager, never()).runTests(any(), any());
    }

    @Test
    void interruptedWaitCancelsDiscoveryAndSubmitsNoRun() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        TestRequestManager manager = mock(TestRequestManager.class);
        when(manager.discoverTests(any(), any(), any())).thenAnswer(invocation -> {
            DiscoveryEventsRegistrar registrar = invocation.getArgument(1);
            registrar.listener().onDiscoveredTests(threeTests());
            Thread.currentThread().interrupt();
            return pending;
        });
        SelectiveTestsEngine engine = engine(config(), manager);
        engine.initialize("A");

        assertThrows(CancellationException.class, engine::execute);
        assertTrue(Thread.interrupted(), "Interrupt flag should be restored");
        assertTrue(pending.isCancelled());
        verify(manager, never()).runTests(any(), any());
    }

    @Test
    void registrarWarningsReachTheOutput() {
        TestRequestManager manager = mock(TestRequestManager.class);
        when(manager.discoverTests(any(), any(), any())).thenAnswer(invocation -> {
            DiscoveryEventsRegistrar registrar = invocation.getArgument(1);
            registrar.logWarning("adapter is outdated");
            registrar.listener().onDiscoveredTests(threeTests());
            return CompletableFuture.completedFuture(null);
        });
        SelectiveTestsEngine engine = engine(config(), manager);
        engine.initialize("A");

        engine.execute();

        assertTrue(output.warnings().contains("adapter is outdated"));
        verify(manager).runTests(any(), eq(ProtocolConfig.DEFAULT));
    }

    @Test
    void defaultOutputLogsInsteadOfFailing() {
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(threeTests()));
        SelectiveTestsEngine engine = new SelectiveTestsEngine(config(), manager, () -> RunSettings.EMPTY);

        engine.initialize("A1,Missing");
        SelectiveTestsResult result = engine.execute();

        assertEquals(SelectiveTestsEngine.ResultCode.SUCCESS, result.code());
        assertEquals(1, manager.runs.size());
        assertEquals(Set.of("Missing"), result.undiscoveredFilters());
    }

    @Test
    void engineServesASingleInvocation() {
        ScriptedRequestManager manager = new ScriptedRequestManager(List.of(threeTests()));
        SelectiveTestsEngine engine = engine(config(), manager);

        assertThrows(IllegalStateException.class, engine::execute);
        engine.initialize("A");
        engine.execute();

        assertThrows(IllegalStateException.class, () -> engine.initialize("B"));
        assertThrows(IllegalStateException.class, engine::execute);
        assertEquals(1, manager.discoveryRequests.get());
    }
}
