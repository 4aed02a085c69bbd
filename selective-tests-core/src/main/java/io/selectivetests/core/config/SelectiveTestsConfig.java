package io.selectivetests.core.config;

import java.util.List;
import java.util.Set;

/**
 * Configuration for selecting tests by name.
 * Immutable value object — use the {@link Builder} to construct.
 */
public final class SelectiveTestsConfig {

    private final List<String> sources;
    private final String testCaseFilter;
    private final String testAdapterPath;
    private final char delimiter;
    private final char escapeCharacter;
    private final String fragmentFileExtension;
    private final List<String> testDirs;
    private final Set<String> testAnnotations;

    private SelectiveTestsConfig(Builder builder) {
        this.sources = List.copyOf(builder.sources);
        this.testCaseFilter = builder.testCaseFilter;
        this.testAdapterPath = builder.testAdapterPath;
        this.delimiter = builder.delimiter;
        this.escapeCharacter = builder.escapeCharacter;
        this.fragmentFileExtension = builder.fragmentFileExtension;
        this.testDirs = List.copyOf(builder.testDirs);
        this.testAnnotations = Set.copyOf(builder.testAnnotations);
    }

    public List<String> sources() { return sources; }
    public String testCaseFilter() { return testCaseFilter; }
    public String testAdapterPath() { return testAdapterPath; }
    public char delimiter() { return delimiter; }
    public char escapeCharacter() { return escapeCharacter; }
    public String fragmentFileExtension() { return fragmentFileExtension; }
    public List<String> testDirs() { return testDirs; }
    public Set<String> testAnnotations() { return testAnnotations; }

    /** True when a global test case filter expression is active. */
    public boolean hasTestCaseFilter() {
        return testCaseFilter != null && !testCaseFilter.isBlank();
    }

    /** True when a test adapter search path was configured. */
    public boolean hasTestAdapterPath() {
        return testAdapterPath != null && !testAdapterPath.isBlank();
    }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> sources = List.of();
        private String testCaseFilter;
        private String testAdapterPath;
        private char delimiter = ',';
        private char escapeCharacter = '\\';
        private String fragmentFileExtension = ".txt";
        private List<String> testDirs = List.of("src/test/java");
        private Set<String> testAnnotations = Set.of(
                "Test", "ParameterizedTest", "RepeatedTest", "TestFactory", "TestTemplate");

        public Builder sources(List<String> v) { this.sources = v; return this; }
        public Builder testCaseFilter(String v) { this.testCaseFilter = v; return this; }
        public Builder testAdapterPath(String v) { this.testAdapterPath = v; return this; }
        public Builder testDirs(List<String> v) { this.testDirs = v; return this; }
        public Builder testAnnotations(Set<String> v) { this.testAnnotations = v; return this; }

        public Builder delimiter(char v) {
            this.delimiter = v;
            return this;
        }

        public Builder escapeCharacter(char v) {
            this.escapeCharacter = v;
            return this;
        }

        public Builder fragmentFileExtension(String v) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("fragmentFileExtension must not be null or blank");
            }
            this.fragmentFileExtension = v;
            return this;
        }

        public SelectiveTestsConfig build() {
            if (delimiter == escapeCharacter) {
                throw new IllegalArgumentException(
                        "delimiter and escapeCharacter must differ, both are '" + delimiter + "'");
            }
            return new SelectiveTestsConfig(this);
        }
    }
}
