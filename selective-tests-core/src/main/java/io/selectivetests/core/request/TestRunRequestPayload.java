package io.selectivetests.core.request;

import java.util.List;

/**
 * What to run: exactly the selected test cases, with the same run settings used for discovery.
 *
 * @param testCases      the selected test cases, in selection order
 * @param runSettings    effective run settings captured at execution start
 * @param keepAlive      whether the runner session outlives this request
 * @param testCaseFilter optional filter expression narrowing the selection, may be {@code null}
 */
public record TestRunRequestPayload(
        List<DiscoveredTestCase> testCases,
        RunSettings runSettings,
        boolean keepAlive,
        String testCaseFilter
) {

    public TestRunRequestPayload {
        testCases = List.copyOf(testCases);
    }
}
