package io.selectivetests.core.filter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FilterTrackerTest {

    @Test
    void startsWithEveryFragment() {
        FilterTracker tracker = new FilterTracker(List.of("A", "B", "A"));

        assertEquals(Set.of("A", "B"), tracker.remaining());
        assertFalse(tracker.allMatched());
    }

    @Test
    void markMatchedRemovesOnce() {
        FilterTracker tracker = new FilterTracker(List.of("A", "B"));

        tracker.markMatched("A");
        tracker.markMatched("A");

        assertEquals(Set.of("B"), tracker.remaining());
    }

    @Test
    void unknownFragmentIsIgnored() {
        FilterTracker tracker = new FilterTracker(List.of("A"));

        tracker.markMatched("Z");

        assertEquals(Set.of("A"), tracker.remaining());
    }

    @Test
    void comparesFragmentsExactly() {
        FilterTracker tracker = new FilterTracker(List.of("Foo"));

        tracker.markMatched("foo");

        assertEquals(Set.of("Foo"), tracker.remaining(), "Tracking is case-sensitive");
    }

    @Test
    void remainingIsASnapshot() {
        FilterTracker tracker = new FilterTracker(List.of("A", "B"));
        Set<String> before = tracker.remaining();

        tracker.markMatched("A");
        tracker.markMatched("B");

        assertEquals(2, before.size());
        assertTrue(tracker.allMatched());
    }
}
