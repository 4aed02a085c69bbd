package io.selectivetests.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds test source files in single-module and multi-module Gradle/Maven projects.
 *
 * <p>Modules can be nested at any depth (e.g. {@code services/payment/src/test/java}).
 */
public final class SourceFileScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceFileScanner.class);

    /** Directories that should never be descended into when searching for modules. */
    private static final Set<String> SKIP_DIRS = Set.of(
            ".git", ".gradle", ".idea", ".mvn", "build", "out", "target", "node_modules"
    );

    private SourceFileScanner() {
        // utility class
    }

    /**
     * Collects all test Java files from the given test directories, scanning the
     * entire project tree at any depth. Files are returned in a stable, sorted order.
     *
     * @param projectDir the root project directory
     * @param testDirs   test directory suffixes (e.g. {@code ["src/test/java"]})
     * @return list of Java test files
     */
    public static List<Path> collectTestFiles(Path projectDir, List<String> testDirs) {
        List<Path> files = new ArrayList<>();
        for (String testDir : testDirs) {
            for (Path resolved : findAllMatchingDirs(projectDir, testDir)) {
                List<Path> underRoot = new ArrayList<>();
                collectJavaFiles(resolved, underRoot);
                underRoot.sort(null);
                files.addAll(underRoot);
            }
        }
        return files;
    }

    /**
     * Recursively collects all {@code .java} files under {@code dir},
     * appending them to the provided list.
     */
    static void collectJavaFiles(Path dir, List<Path> result) {
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (file.toString().endsWith(".java")) {
                        result.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error collecting Java files from {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Walks the project tree and returns every directory that matches the given
     * relative suffix (e.g. {@code "src/test/java"}). Directories in {@link #SKIP_DIRS}
     * are pruned, and a matched source tree is not descended into.
     *
     * @param projectDir  the root project directory
     * @param relativeDir the directory suffix to look for
     * @return list of paths that exist and match
     */
    static List<Path> findAllMatchingDirs(Path projectDir, String relativeDir) {
        List<Path> matches = new ArrayList<>();

        Path rootMatch = projectDir.resolve(relativeDir);
        if (Files.isDirectory(rootMatch)) {
            matches.add(rootMatch);
        }

        try {
            Files.walkFileTree(projectDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String dirName = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (SKIP_DIRS.contains(dirName)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (dir.equals(projectDir)) {
                        return FileVisitResult.CONTINUE;
                    }
                    // The root's own source tree is already recorded
                    if (dir.equals(rootMatch)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }

                    Path candidate = dir.resolve(relativeDir);
                    if (Files.isDirectory(candidate)) {
                        matches.add(candidate);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error searching for '{}' under {}: {}", relativeDir, projectDir, e.getMessage());
        }

        log.debug("Found {} directories matching '{}' under {}", matches.size(), relativeDir, projectDir);
        return matches;
    }
}
