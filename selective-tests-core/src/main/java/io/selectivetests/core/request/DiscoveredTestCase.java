package io.selectivetests.core.request;

import java.util.Objects;
import java.util.Optional;

/**
 * A test case reported by a {@link TestDiscoverer}.
 *
 * <p>Instances are shared by reference between the discoverer, the selection and the run
 * request. Equality is identity: the same test reported twice as two distinct objects is
 * two entries, while the same object reported twice is one.
 */
public final class DiscoveredTestCase {

    private final String fullyQualifiedName;
    private final String source;
    private final String className;
    private final String methodName;
    private final String uniqueId;

    private DiscoveredTestCase(String fullyQualifiedName, String source, String className,
                               String methodName, String uniqueId) {
        this.fullyQualifiedName = Objects.requireNonNull(fullyQualifiedName, "fullyQualifiedName");
        this.source = Objects.requireNonNull(source, "source");
        this.className = className;
        this.methodName = methodName;
        this.uniqueId = uniqueId;
    }

    /**
     * Test case identified by class and method, e.g. {@code com.example.FooTest#parses}.
     * The fully-qualified name is {@code className.methodName}.
     */
    public static DiscoveredTestCase ofMethod(String source, String className, String methodName) {
        return new DiscoveredTestCase(className + "." + methodName, source, className, methodName, null);
    }

    /**
     * Test case identified by an engine-specific unique id, as reported by a test engine.
     */
    public static DiscoveredTestCase ofUniqueId(String source, String fullyQualifiedName,
                                                String className, String methodName, String uniqueId) {
        return new DiscoveredTestCase(fullyQualifiedName, source, className, methodName,
                Objects.requireNonNull(uniqueId, "uniqueId"));
    }

    public String fullyQualifiedName() { return fullyQualifiedName; }
    public String source() { return source; }
    public String className() { return className; }
    public Optional<String> methodName() { return Optional.ofNullable(methodName); }
    public Optional<String> uniqueId() { return Optional.ofNullable(uniqueId); }

    @Override
    public String toString() {
        return fullyQualifiedName;
    }
}
