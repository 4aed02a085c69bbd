package io.selectivetests.cli.junit;

import io.selectivetests.core.request.DiscoveredTestCase;
import org.junit.platform.engine.FilterResult;
import org.junit.platform.engine.TestDescriptor;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.PostDiscoveryFilter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps only the selected tests when whole classes are selected for a run.
 *
 * <p>A test is kept when its unique id was selected, or when its method source names a
 * selected class and method. Overloads of a selected method are all kept.
 */
final class SelectedTestsFilter implements PostDiscoveryFilter {

    private final Set<String> uniqueIds = new HashSet<>();
    private final Set<String> methods = new HashSet<>();

    SelectedTestsFilter(List<DiscoveredTestCase> testCases) {
        for (DiscoveredTestCase testCase : testCases) {
            testCase.uniqueId().ifPresent(uniqueIds::add);
            testCase.methodName().ifPresent(method -> methods.add(key(testCase.className(), method)));
        }
    }

    @Override
    public FilterResult apply(TestDescriptor descriptor) {
        if (uniqueIds.contains(descriptor.getUniqueId().toString())) {
            return FilterResult.included("selected by unique id");
        }
        if (descriptor.getSource().orElse(null) instanceof MethodSource source
                && methods.contains(key(source.getClassName(), source.getMethodName()))) {
            return FilterResult.included("selected by name");
        }
        return FilterResult.excluded("not selected");
    }

    private static String key(String className, String methodName) {
        return className + "#" + methodName;
    }
}
