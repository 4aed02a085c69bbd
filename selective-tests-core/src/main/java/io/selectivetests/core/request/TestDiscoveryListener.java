package io.selectivetests.core.request;

import java.util.List;

/**
 * Callback receiving newly discovered test cases, one batch per call.
 * May be invoked from any thread the discoverer chooses.
 */
@FunctionalInterface
public interface TestDiscoveryListener {

    void onDiscoveredTests(List<DiscoveredTestCase> batch);
}
