package io.selectivetests.core.filter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Fragments that have not matched any discovered test yet. Only ever shrinks.
 *
 * <p>Fragments are compared by exact string equality here, independent of the
 * case-insensitive matching used to select tests.
 */
public final class FilterTracker {

    private final Set<String> undiscovered;

    public FilterTracker(Collection<String> fragments) {
        this.undiscovered = new HashSet<>(fragments);
    }

    /** Removes the fragment from the undiscovered set; no-op if already removed. */
    public synchronized void markMatched(String fragment) {
        undiscovered.remove(fragment);
    }

    /** Snapshot of the fragments still unmatched, in no particular order. */
    public synchronized Set<String> remaining() {
        return Set.copyOf(undiscovered);
    }

    public synchronized boolean allMatched() {
        return undiscovered.isEmpty();
    }
}
