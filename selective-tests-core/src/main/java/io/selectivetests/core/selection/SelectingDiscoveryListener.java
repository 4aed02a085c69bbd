package io.selectivetests.core.selection;

import io.selectivetests.core.filter.FilterTracker;
import io.selectivetests.core.request.DiscoveredTestCase;
import io.selectivetests.core.request.TestDiscoveryListener;

import java.util.List;

/**
 * Feeds every discovered batch into the selection of one invocation.
 * Safe to call from any thread.
 */
public final class SelectingDiscoveryListener implements TestDiscoveryListener {

    private final List<String> fragments;
    private final FilterTracker tracker;
    private final SelectionAccumulator accumulator;

    public SelectingDiscoveryListener(List<String> fragments, FilterTracker tracker,
                                      SelectionAccumulator accumulator) {
        this.fragments = List.copyOf(fragments);
        this.tracker = tracker;
        this.accumulator = accumulator;
    }

    @Override
    public void onDiscoveredTests(List<DiscoveredTestCase> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        accumulator.recordBatch(batch, fragments, tracker);
    }
}
