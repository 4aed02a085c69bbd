package io.selectivetests.cli;

import io.selectivetests.core.output.Output;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * ANSI-colored terminal output for the selective-tests CLI.
 */
public class ConsoleOutput implements Output {

    private final PrintWriter out;
    private final PrintWriter err;

    public ConsoleOutput(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void information(String message) {
        out.println(message);
        out.flush();
    }

    @Override
    public void warning(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) Warning:|@ ") + message);
        out.flush();
    }

    public void error(String message) {
        err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red),bold Error:|@ ") + message);
        err.flush();
    }
}
