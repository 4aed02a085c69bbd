package io.selectivetests.core.discovery;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.DiscoveryEventsRegistrar;
import io.selectivetests.core.request.DiscoveryRequestPayload;
import io.selectivetests.core.request.ProtocolConfig;
import io.selectivetests.core.request.TestDiscoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Discovers tests from Java test sources without compiling them.
 *
 * <p>Each source is a project directory. Test source roots ({@code src/test/java} by default)
 * are located at any module depth, every {@code .java} file is parsed with JavaParser, and
 * each file yields one batch holding its methods annotated with a test annotation such as
 * {@code @Test} or {@code @ParameterizedTest}. Abstract classes and interfaces are skipped;
 * nested classes are named by their binary name ({@code Outer$Inner}).
 */
public final class SourceTestDiscoverer implements TestDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(SourceTestDiscoverer.class);

    private final SelectiveTestsConfig config;
    private final Executor executor;

    /** Discovers on the calling thread. */
    public SourceTestDiscoverer(SelectiveTestsConfig config) {
        this(config, Runnable::run);
    }

    public SourceTestDiscoverer(SelectiveTestsConfig config, Executor executor) {
        this.config = config;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> discoverTests(DiscoveryRequestPayload payload,
                                                 DiscoveryEventsRegistrar registrar,
                                                 ProtocolConfig protocolConfig) {
        return CompletableFuture.runAsync(() -> discover(payload.sources(), registrar), executor);
    }

    private void discover(List<String> sources, DiscoveryEventsRegistrar registrar) {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        int total = 0;

        for (String source : sources) {
            Path projectDir = Path.of(source);
            if (!Files.isDirectory(projectDir)) {
                registrar.logWarning("Test source " + source + " is not a directory; skipping it.");
                continue;
            }

            List<Path> testFiles = SourceFileScanner.collectTestFiles(projectDir, config.testDirs());
            log.debug("Scanning {} test files under {}", testFiles.size(), projectDir);

            for (Path testFile : testFiles) {
                List<DiscoveredTestCase> batch = parseTestFile(parser, testFile, source, registrar);
                if (!batch.isEmpty()) {
                    total += batch.size();
                    registrar.listener().onDiscoveredTests(batch);
                }
            }
        }

        log.info("[source] Discovered {} tests in {} sources", total, sources.size());
    }

    private List<DiscoveredTestCase> parseTestFile(JavaParser parser, Path testFile, String source,
                                                   DiscoveryEventsRegistrar registrar) {
        List<DiscoveredTestCase> batch = new ArrayList<>();
        try {
            ParseResult<CompilationUnit> result = parser.parse(testFile);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                registrar.logWarning("Could not parse " + testFile + "; its tests are not discovered.");
                return batch;
            }

            CompilationUnit cu = result.getResult().get();
            String packagePrefix = cu.getPackageDeclaration()
                    .map(pd -> pd.getNameAsString() + ".")
                    .orElse("");
            for (TypeDeclaration<?> type : cu.getTypes()) {
                collectTests(type, packagePrefix + type.getNameAsString(), source, batch);
            }
        } catch (IOException e) {
            registrar.logWarning("Could not read " + testFile + ": " + e.getMessage());
        }
        return batch;
    }

    private void collectTests(TypeDeclaration<?> type, String binaryName, String source,
                              List<DiscoveredTestCase> batch) {
        if (isInstantiableClass(type)) {
            for (MethodDeclaration method : type.getMethods()) {
                if (isTestMethod(method)) {
                    batch.add(DiscoveredTestCase.ofMethod(source, binaryName, method.getNameAsString()));
                }
            }
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                collectTests(nested, binaryName + "$" + nested.getNameAsString(), source, batch);
            }
        }
    }

    private static boolean isInstantiableClass(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration decl) {
            return !decl.isInterface() && !decl.isAbstract();
        }
        return false;
    }

    private boolean isTestMethod(MethodDeclaration method) {
        for (AnnotationExpr annotation : method.getAnnotations()) {
            String name = annotation.getNameAsString();
            int dot = name.lastIndexOf('.');
            String simpleName = dot >= 0 ? name.substring(dot + 1) : name;
            if (config.testAnnotations().contains(simpleName)) {
                return true;
            }
        }
        return false;
    }
}
