package io.vecbench.cli;

import io.vecbench.core.benchmark.ProgressListener;
import java.io.PrintStream;

/**
 * Prints progress to stdout, rewriting the status line in place with a carriage return.
 */
final class ConsoleProgress implements ProgressListener {
    private final PrintStream out;
    private boolean statusPending;

    ConsoleProgress(PrintStream out) {
        this.out = out;
    }

    @Override
    public synchronized void status(String text) {
        out.print("\r" + text);
        out.flush();
        statusPending = true;
    }

    @Override
    public synchronized void line(String text) {
        if (statusPending) {
            out.println();
            statusPending = false;
        }
        out.println(text);
    }
}
