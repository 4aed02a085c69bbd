package io.selectivetests.core.request;

/**
 * Source of the run settings active for an invocation. Read once per execution.
 */
@FunctionalInterface
public interface RunSettingsProvider {

    RunSettings activeRunSettings();
}
