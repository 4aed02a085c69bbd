package io.selectivetests.core.selection;

import io.selectivetests.core.filter.FilterTracker;
import io.selectivetests.core.request.DiscoveredTestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Cumulative result of matching discovered tests against name fragments.
 *
 * <p>Test cases are kept in first-match order and deduplicated by identity. The discovered
 * count includes every test case seen, matched or not. The result does not depend on how
 * discovery splits test cases into batches.
 */
public final class SelectionAccumulator {

    private static final Logger log = LoggerFactory.getLogger(SelectionAccumulator.class);

    private final Object lock = new Object();
    private final List<DiscoveredTestCase> selected = new ArrayList<>();
    private final Set<DiscoveredTestCase> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private long discoveredTestCount;

    /**
     * Matches one batch of discovered test cases. The whole batch is recorded under one lock,
     * so batches delivered from several threads are applied one at a time.
     *
     * <p>Every fragment is checked against every test case in the original fragment order,
     * including fragments that already matched an earlier test case. The first fragment that
     * is contained in the test's fully-qualified name (ignoring case) selects the test case and
     * is marked matched in {@code tracker}; later fragments are not checked for that test case.
     */
    public void recordBatch(List<DiscoveredTestCase> batch, List<String> fragments, FilterTracker tracker) {
        synchronized (lock) {
            discoveredTestCount += batch.size();
            int added = 0;
            for (DiscoveredTestCase testCase : batch) {
                String name = testCase.fullyQualifiedName();
                for (String fragment : fragments) {
                    if (containsIgnoreCase(name, fragment)) {
                        if (seen.add(testCase)) {
                            selected.add(testCase);
                            added++;
                        }
                        tracker.markMatched(fragment);
                        break;
                    }
                }
            }
            log.debug("Batch of {} test cases: {} newly selected, {} selected of {} discovered so far",
                    batch.size(), added, selected.size(), discoveredTestCount);
        }
    }

    /** Snapshot of the selected test cases in selection order. */
    public List<DiscoveredTestCase> selectedTestCases() {
        synchronized (lock) {
            return List.copyOf(selected);
        }
    }

    public long discoveredTestCount() {
        synchronized (lock) {
            return discoveredTestCount;
        }
    }

    static boolean containsIgnoreCase(String name, String fragment) {
        int max = name.length() - fragment.length();
        for (int i = 0; i <= max; i++) {
            if (name.regionMatches(true, i, fragment, 0, fragment.length())) {
                return true;
            }
        }
        return false;
    }
}
