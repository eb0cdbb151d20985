package io.vecbench.core.benchmark;

/**
 * Receives human-readable progress while a benchmark runs. {@link #status(String)} replaces the
 * current status line; {@link #line(String)} prints a permanent one.
 */
public interface ProgressListener {
    ProgressListener NONE = new ProgressListener() {
    };

    default void status(String text) {
    }

    default void line(String text) {
    }
}
