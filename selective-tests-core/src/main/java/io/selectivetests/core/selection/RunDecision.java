package io.selectivetests.core.selection;

import io.selectivetests.core.request.TestRunRequestPayload;

import java.util.Optional;

/**
 * Outcome of discovery: whether to run, what to run, and what to warn about.
 *
 * @param action  what happens next
 * @param warning warning to surface, or {@code null}
 * @param payload run request when {@code action} is {@link Action#RUN}, otherwise {@code null}
 */
public record RunDecision(Action action, String warning, TestRunRequestPayload payload) {

    public enum Action {
        /** At least one test matched; the selection is submitted. */
        RUN,
        /** Tests were discovered but none matched a fragment. */
        NO_MATCH,
        /** No test was discovered in the sources at all. */
        NO_DISCOVERY
    }

    public Optional<String> warningMessage() {
        return Optional.ofNullable(warning);
    }
}
