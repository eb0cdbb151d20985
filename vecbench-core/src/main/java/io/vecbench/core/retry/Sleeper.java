package io.vecbench.core.retry;

import java.io.InterruptedIOException;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = delayMs -> {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while sleeping " + delayMs + "ms");
        }
    };

    void sleep(long delayMs) throws InterruptedIOException;
}
