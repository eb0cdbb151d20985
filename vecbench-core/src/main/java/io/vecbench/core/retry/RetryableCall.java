package io.vecbench.core.retry;

import java.io.IOException;

@FunctionalInterface
public interface RetryableCall<T> {
    T call() throws IOException;
}
