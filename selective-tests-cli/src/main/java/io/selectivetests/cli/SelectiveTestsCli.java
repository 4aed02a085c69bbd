package io.selectivetests.cli;

/**
 * Entry point of the {@code selective-tests} command line tool.
 */
public final class SelectiveTestsCli {

    private SelectiveTestsCli() {
        // entry point only
    }

    public static void main(String[] args) {
        int exitCode = SelectiveTestsCommand.commandLine().execute(args);
        System.exit(exitCode);
    }
}
