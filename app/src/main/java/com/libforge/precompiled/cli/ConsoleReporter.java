package com.libforge.precompiled.cli;

import com.libforge.precompiled.types.Reporter;

import java.io.PrintWriter;

/**
 * Writes resolution progress to the terminal. Debug lines only appear with
 * {@code --verbose}.
 */
class ConsoleReporter implements Reporter {

    private final PrintWriter out;
    private final boolean verbose;

    ConsoleReporter(PrintWriter out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public void info(String message) {
        out.println(message);
        out.flush();
    }

    @Override
    public void debug(String message) {
        if (verbose) {
            out.println("  " + message);
            out.flush();
        }
    }

    @Override
    public void warn(String message, Throwable cause) {
        out.println("warning: " + message);
        if (verbose && cause != null) {
            cause.printStackTrace(out);
        }
        out.flush();
    }
}
